package formlang.grammar;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Base class for grammars that consist of variables, terminals, productions and an optional start symbol.
 *
 * Grammars are immutable: all collections are fixed on construction and every symbol used in a production
 * is part of the variables or terminals.
 */
public abstract class Grammar {

	protected final Set<Variable> variables;

	protected final Set<Terminal> terminals;

	/**
	 * Might be null
	 */
	protected final Variable startSymbol;

	protected final Set<Production> productions;

	protected Grammar(Collection<? extends Variable> variables, Collection<? extends Terminal> terminals,
	                  Variable startSymbol, Collection<Production> productions) {
		Set<Variable> vars = new LinkedHashSet<>(variables);
		Set<Terminal> terms = new LinkedHashSet<>();
		for (Terminal terminal : terminals){
			if (!(terminal instanceof Epsilon)){
				terms.add(terminal);
			}
		}
		if (startSymbol != null){
			vars.add(startSymbol);
		}
		Set<Production> prods = new LinkedHashSet<>(productions);
		for (Production production : prods){
			vars.add(production.head);
			for (Symbol symbol : production.body){
				if (symbol instanceof Variable){
					vars.add((Variable)symbol);
				} else if (!(symbol instanceof Epsilon)){
					terms.add((Terminal)symbol);
				}
			}
		}
		this.variables = Collections.unmodifiableSet(vars);
		this.terminals = Collections.unmodifiableSet(terms);
		this.startSymbol = startSymbol;
		this.productions = Collections.unmodifiableSet(prods);
	}

	public Set<Variable> getVariables() {
		return variables;
	}

	public Set<Terminal> getTerminals() {
		return terminals;
	}

	public Variable getStartSymbol() {
		return startSymbol;
	}

	public Set<Production> getProductions() {
		return productions;
	}

	/**
	 * Productions grouped by their head
	 */
	public Map<Variable, List<Production>> getProductionsByHead(){
		return groupByHead(productions);
	}

	static Map<Variable, List<Production>> groupByHead(Collection<Production> productions){
		Map<Variable, List<Production>> ret = new LinkedHashMap<>();
		for (Production production : productions){
			ret.computeIfAbsent(production.head, h -> new ArrayList<>()).add(production);
		}
		return ret;
	}

	/**
	 * Is every production of the form <code>A → a</code> or <code>A → B C</code>?
	 */
	public boolean isNormalForm(){
		return productions.stream().allMatch(Production::isNormalForm);
	}

	/**
	 * Textual representation with one production per line, might lose the start symbol
	 */
	public String toText(){
		return productions.stream().map(p -> p.toString() + "\n").collect(Collectors.joining());
	}

	@Override
	public String toString() {
		return toText();
	}

	/**
	 * Reads productions from a text with one line per variable.
	 *
	 * Each line has the form <code>head -> body1 | body2 | …</code>, the symbols of a body are separated
	 * by whitespace. Symbols starting with an upper case letter are variables, other symbols are terminals.
	 * The epsilon aliases produce empty bodies. <code>"VAR:x"</code> and <code>"TER:X"</code> give the kind
	 * of a symbol explicitly.
	 *
	 * @throws GrammarFormatException if a non empty line doesn't contain an arrow
	 */
	protected static List<Production> readProductions(String text){
		List<Production> productions = new ArrayList<>();
		String[] lines = text.split("\\r?\\n");
		for (int i = 0; i < lines.length; i++){
			String line = lines[i].trim();
			if (line.isEmpty()){
				continue;
			}
			if (!line.contains("->")){
				throw new GrammarFormatException(i + 1, String.format("missing \"->\" in \"%s\"", line));
			}
			String[] parts = line.split("->", 2);
			String headText = parts[0].trim();
			if (isSpecialText(headText)){
				headText = headText.substring(5, headText.length() - 1);
			}
			if (headText.isEmpty()){
				throw new GrammarFormatException(i + 1, "missing head");
			}
			Variable head = new Variable(headText);
			for (String subBody : parts[1].split("\\|", -1)){
				List<Symbol> body = new ArrayList<>();
				for (String component : subBody.trim().split("\\s+")){
					if (component.isEmpty()){
						continue;
					}
					body.add(readSymbol(component));
				}
				productions.add(new Production(head, body));
			}
		}
		return productions;
	}

	private static Symbol readSymbol(String component){
		if (isSpecialText(component)){
			String type = component.substring(1, 4);
			String value = component.substring(5, component.length() - 1);
			if (type.equals("VAR")){
				return new Variable(value);
			}
			return new Terminal(value);
		}
		if (Epsilon.isAlias(component)){
			return Epsilon.get();
		}
		if (Symbol.startsWithCapital(component)){
			return new Variable(component);
		}
		return Terminal.of(component);
	}

	private static boolean isSpecialText(String text){
		return text.length() > 5 && text.charAt(0) == '"' && text.charAt(text.length() - 1) == '"'
				&& (text.startsWith("\"VAR:") || text.startsWith("\"TER:"));
	}
}

package formlang.grammar;

import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import formlang.automata.*;
import formlang.grammar.cyk.CYKTable;
import formlang.util.Pair;

/**
 * A context free grammar.
 *
 * Instances are immutable, all transformations return new grammars. The only internal state that is
 * computed lazily is the impact table used for the nullable and generating symbols and the normal form.
 */
public class CFG extends Grammar {

	private static final Logger LOG = Logger.getLogger(CFG.class.getName());

	public static final String SUBS_SUFFIX = "#SUBS#";

	public static final String CNF_SUFFIX = "#CNF#";

	public static final String CNF_CHAIN_PREFIX = "C#CNF#";

	/**
	 * Prefix of the variables that stand for substituted empty languages
	 */
	public static final String EMPTY_PREFIX = "#EMPTY#";

	private ImpactTable impactTable;

	private CFG normalForm;

	public CFG(Collection<? extends Variable> variables, Collection<? extends Terminal> terminals,
	           Variable startSymbol, Collection<Production> productions) {
		super(variables, terminals, startSymbol, productions);
	}

	public CFG(Variable startSymbol, Collection<Production> productions){
		this(Collections.emptySet(), Collections.emptySet(), startSymbol, productions);
	}

	/**
	 * Creates the empty grammar without a start symbol
	 */
	public CFG(){
		this(null, Collections.emptySet());
	}

	/**
	 * Reads a grammar with the start symbol <code>S</code>
	 *
	 * @see Grammar#readProductions(String)
	 */
	public static CFG fromText(String text){
		return fromText(text, new Variable("S"));
	}

	public static CFG fromText(String text, Variable startSymbol){
		return new CFG(startSymbol, readProductions(text));
	}

	private ImpactTable impactTable(){
		if (impactTable == null){
			impactTable = new ImpactTable(productions);
		}
		return impactTable;
	}

	/**
	 * Symbols that derive a word of terminals (including all terminals)
	 */
	public Set<Symbol> getGeneratingSymbols(){
		return impactTable().propagate(terminals, null);
	}

	/**
	 * Symbols that derive the empty word
	 */
	public Set<Symbol> getNullableSymbols(){
		return impactTable().propagate(Collections.emptySet(), null);
	}

	/**
	 * Does the start symbol derive the empty word?
	 */
	public boolean generatesEpsilon(){
		if (startSymbol == null){
			return false;
		}
		return impactTable().propagate(Collections.emptySet(), startSymbol) == null;
	}

	/**
	 * Symbols that occur in some derivation of the start symbol
	 */
	public Set<Symbol> getReachableSymbols(){
		Set<Symbol> reachable = new LinkedHashSet<>();
		if (startSymbol == null){
			return reachable;
		}
		Map<Variable, List<Production>> byHead = getProductionsByHead();
		reachable.add(startSymbol);
		Deque<Symbol> stack = new ArrayDeque<>();
		stack.push(startSymbol);
		while (!stack.isEmpty()){
			Symbol current = stack.pop();
			for (Production production : byHead.getOrDefault(current, Collections.emptyList())){
				for (Symbol symbol : production.body){
					if (!(symbol instanceof Epsilon) && reachable.add(symbol)){
						stack.push(symbol);
					}
				}
			}
		}
		return reachable;
	}

	/**
	 * Removes the symbols that aren't generating and afterwards the symbols that aren't reachable
	 */
	public CFG removeUselessSymbols(){
		Set<Symbol> generating = getGeneratingSymbols();
		List<Production> prods = productions.stream()
				.filter(p -> generating.contains(p.head) && generating.containsAll(p.body))
				.collect(Collectors.toList());
		Set<Variable> vars = variables.stream().filter(generating::contains).collect(Collectors.toCollection(LinkedHashSet::new));
		Set<Terminal> terms = terminals.stream().filter(generating::contains).collect(Collectors.toCollection(LinkedHashSet::new));
		Set<Symbol> reachable = new CFG(vars, terms, startSymbol, prods).getReachableSymbols();
		prods = prods.stream().filter(p -> reachable.contains(p.head)).collect(Collectors.toList());
		vars.retainAll(reachable);
		terms.retainAll(reachable);
		return new CFG(vars, terms, startSymbol, prods);
	}

	/**
	 * Removes the epsilon productions. The resulting grammar generates the same language without
	 * the empty word.
	 */
	public CFG removeEpsilon(){
		Set<Symbol> nullables = getNullableSymbols();
		List<Production> prods = new ArrayList<>();
		for (Production production : productions){
			for (List<Symbol> body : bodiesWithoutNullables(production.body, 0, nullables)){
				if (!body.isEmpty()){
					prods.add(new Production(production.head, body));
				}
			}
		}
		return new CFG(variables, terminals, startSymbol, prods);
	}

	/**
	 * All variants of the body starting at the passed index in which nullable symbols might be left out
	 */
	private static List<List<Symbol>> bodiesWithoutNullables(List<Symbol> body, int start, Set<Symbol> nullables){
		List<List<Symbol>> ret = new ArrayList<>();
		if (start == body.size()){
			ret.add(new ArrayList<>());
			return ret;
		}
		Symbol first = body.get(start);
		for (List<Symbol> rest : bodiesWithoutNullables(body, start + 1, nullables)){
			if (nullables.contains(first)){
				ret.add(rest);
			}
			if (!(first instanceof Epsilon)){
				List<Symbol> withFirst = new ArrayList<>();
				withFirst.add(first);
				withFirst.addAll(rest);
				ret.add(withFirst);
			}
		}
		return ret;
	}

	/**
	 * Pairs (A, B) such that B can be derived from A by unit productions only, including all (A, A)
	 */
	public Set<Pair<Variable, Variable>> getUnitPairs(){
		Set<Pair<Variable, Variable>> unitPairs = new LinkedHashSet<>();
		for (Variable variable : variables){
			unitPairs.add(new Pair<>(variable, variable));
		}
		Map<Variable, List<Production>> unitProductions = groupByHead(productions.stream()
				.filter(CFG::isUnitProduction).collect(Collectors.toList()));
		Deque<Pair<Variable, Variable>> stack = new ArrayDeque<>(unitPairs);
		while (!stack.isEmpty()){
			Pair<Variable, Variable> current = stack.pop();
			for (Production production : unitProductions.getOrDefault(current.second, Collections.emptyList())){
				Pair<Variable, Variable> pair = new Pair<>(current.first, (Variable)production.body.get(0));
				if (unitPairs.add(pair)){
					stack.push(pair);
				}
			}
		}
		return unitPairs;
	}

	private static boolean isUnitProduction(Production production){
		return production.body.size() == 1 && production.body.get(0) instanceof Variable;
	}

	/**
	 * Replaces the unit productions <code>A → B</code> by copies of the non unit productions of B
	 */
	public CFG eliminateUnitProductions(){
		List<Production> prods = productions.stream().filter(p -> !isUnitProduction(p)).collect(Collectors.toList());
		Map<Variable, List<Production>> byHead = groupByHead(prods);
		for (Pair<Variable, Variable> pair : getUnitPairs()){
			for (Production production : byHead.getOrDefault(pair.second, Collections.emptyList())){
				prods.add(new Production(pair.first, production.body, false));
			}
		}
		return new CFG(variables, terminals, startSymbol, prods);
	}

	/**
	 * Chomsky normal form of the grammar, all productions have the form <code>A → a</code> or
	 * <code>A → B C</code>.
	 *
	 * The normal form doesn't generate the empty word, even if this grammar does.
	 */
	public CFG toNormalForm(){
		if (normalForm == null){
			normalForm = computeNormalForm();
		}
		return normalForm;
	}

	private CFG computeNormalForm(){
		CFG current = this;
		while (!current.isCleaned()){
			if (current.productions.isEmpty()){
				return current;
			}
			CFG previous = current;
			current = current.removeUselessSymbols().removeEpsilon().removeUselessSymbols()
					.eliminateUnitProductions().removeUselessSymbols();
			LOG.fine(String.format("Cleaned grammar from %d to %d productions", previous.productions.size(),
					current.productions.size()));
		}
		List<Production> prods = current.decomposeProductions(current.productionsWithSingleTerminals());
		return new CFG(current.startSymbol, prods);
	}

	/**
	 * Has the grammar no nullable symbols, no unit productions and only useful symbols?
	 */
	private boolean isCleaned(){
		int symbols = variables.size() + terminals.size();
		return getNullableSymbols().isEmpty()
				&& getUnitPairs().size() == variables.size()
				&& getGeneratingSymbols().size() == symbols
				&& getReachableSymbols().size() == symbols;
	}

	private List<Production> productionsWithSingleTerminals(){
		Map<Terminal, Variable> proxies = new LinkedHashMap<>();
		List<Production> prods = new ArrayList<>();
		for (Production production : productions){
			if (production.body.size() == 1){
				prods.add(production);
				continue;
			}
			List<Symbol> body = new ArrayList<>();
			for (Symbol symbol : production.body){
				if (symbol instanceof Terminal){
					body.add(proxies.computeIfAbsent((Terminal)symbol, t -> new Variable(t.value + CNF_SUFFIX)));
				} else {
					body.add(symbol);
				}
			}
			prods.add(new Production(production.head, body));
		}
		for (Map.Entry<Terminal, Variable> proxy : proxies.entrySet()){
			prods.add(new Production(proxy.getValue(), Collections.singletonList(proxy.getKey())));
		}
		return prods;
	}

	private List<Production> decomposeProductions(List<Production> prods){
		int[] index = {0};
		List<Production> ret = new ArrayList<>();
		Map<List<Symbol>, Variable> done = new HashMap<>();
		for (Production production : prods){
			List<Symbol> body = production.body;
			if (body.size() <= 2){
				ret.add(production);
				continue;
			}
			Variable head = production.head;
			boolean stopped = false;
			for (int i = 0; i < body.size() - 2; i++){
				List<Symbol> suffix = body.subList(i + 1, body.size());
				if (done.containsKey(suffix)){
					ret.add(new Production(head, Arrays.asList(body.get(i), done.get(suffix))));
					stopped = true;
					break;
				}
				Variable chain = nextFreeVariable(index, CNF_CHAIN_PREFIX);
				ret.add(new Production(head, Arrays.asList(body.get(i), chain)));
				done.put(new ArrayList<>(suffix), chain);
				head = chain;
			}
			if (!stopped){
				ret.add(new Production(head, body.subList(body.size() - 2, body.size())));
			}
		}
		return ret;
	}

	private Variable nextFreeVariable(int[] index, String prefix){
		Variable variable;
		do {
			index[0]++;
			variable = new Variable(prefix + index[0]);
		} while (variables.contains(variable));
		return variable;
	}

	/**
	 * Replaces the passed terminals by the languages of the passed grammars.
	 * The variables of all grammars are renamed with the suffix {@value #SUBS_SUFFIX} and a counter.
	 */
	public CFG substitute(Map<Terminal, CFG> substitution){
		int index = 0;
		Map<Variable, Variable> renaming = new HashMap<>();
		Set<Variable> vars = new LinkedHashSet<>();
		for (Variable variable : variables){
			Variable renamed = new Variable(variable.value + SUBS_SUFFIX + index++);
			renaming.put(variable, renamed);
			vars.add(renamed);
		}
		List<Production> prods = new ArrayList<>();
		Map<Terminal, Variable> replacements = new HashMap<>();
		for (Map.Entry<Terminal, CFG> entry : substitution.entrySet()){
			CFG other = entry.getValue();
			Map<Variable, Variable> localRenaming = new HashMap<>();
			for (Variable variable : other.variables){
				Variable renamed = new Variable(variable.value + SUBS_SUFFIX + index++);
				localRenaming.put(variable, renamed);
				vars.add(renamed);
			}
			for (Production production : other.productions){
				prods.add(new Production(localRenaming.get(production.head), rename(production.body, localRenaming, Collections.emptyMap())));
			}
			if (other.startSymbol != null){
				replacements.put(entry.getKey(), localRenaming.get(other.startSymbol));
			} else {
				// the language is empty, so the terminal becomes a variable without productions
				Variable empty = new Variable(EMPTY_PREFIX + SUBS_SUFFIX + index++);
				replacements.put(entry.getKey(), empty);
				vars.add(empty);
			}
		}
		for (Production production : productions){
			prods.add(new Production(renaming.get(production.head), rename(production.body, renaming, replacements)));
		}
		return new CFG(vars, Collections.emptySet(), startSymbol == null ? null : renaming.get(startSymbol), prods);
	}

	private static List<Symbol> rename(List<Symbol> body, Map<Variable, Variable> renaming, Map<Terminal, Variable> replacements){
		List<Symbol> ret = new ArrayList<>();
		for (Symbol symbol : body){
			if (renaming.containsKey(symbol)){
				ret.add(renaming.get(symbol));
			} else if (replacements.containsKey(symbol)){
				ret.add(replacements.get(symbol));
			} else {
				ret.add(symbol);
			}
		}
		return ret;
	}

	/**
	 * Grammar of the union of both languages
	 */
	public CFG union(CFG other){
		Variable start = new Variable("#STARTUNION#");
		Terminal first = new Terminal("#0UNION#");
		Terminal second = new Terminal("#1UNION#");
		CFG temp = new CFG(start, Arrays.asList(
				new Production(start, Collections.singletonList(first)),
				new Production(start, Collections.singletonList(second))));
		Map<Terminal, CFG> substitution = new LinkedHashMap<>();
		substitution.put(first, this);
		substitution.put(second, other);
		return temp.substitute(substitution);
	}

	/**
	 * Grammar of the concatenation of both languages
	 */
	public CFG concatenate(CFG other){
		Variable start = new Variable("#STARTCONC#");
		Terminal first = new Terminal("#0CONC#");
		Terminal second = new Terminal("#1CONC#");
		CFG temp = new CFG(start, Collections.singletonList(new Production(start, Arrays.asList(first, second))));
		Map<Terminal, CFG> substitution = new LinkedHashMap<>();
		substitution.put(first, this);
		substitution.put(second, other);
		return temp.substitute(substitution);
	}

	/**
	 * Grammar of the Kleene star of the language
	 */
	public CFG getClosure(){
		Variable start = new Variable("#STARTCLOS#");
		Terminal inner = new Terminal("#1CLOS#");
		CFG temp = new CFG(start, Arrays.asList(
				new Production(start, Collections.singletonList(inner)),
				new Production(start, Arrays.asList(start, start)),
				new Production(start, Collections.emptyList())));
		return temp.substitute(Collections.singletonMap(inner, this));
	}

	/**
	 * Grammar of the positive closure (one or more repetitions) of the language
	 */
	public CFG getPositiveClosure(){
		Variable start = new Variable("#STARTPOSCLOS#");
		Variable var = new Variable("#VARPOSCLOS#");
		Terminal inner = new Terminal("#1POSCLOS#");
		CFG temp = new CFG(start, Arrays.asList(
				new Production(start, Arrays.asList(inner, var)),
				new Production(var, Arrays.asList(var, var)),
				new Production(var, Collections.singletonList(inner)),
				new Production(var, Collections.emptyList())));
		return temp.substitute(Collections.singletonMap(inner, this));
	}

	/**
	 * Grammar of the mirrored language
	 */
	public CFG reverse(){
		List<Production> prods = new ArrayList<>();
		for (Production production : productions){
			List<Symbol> body = new ArrayList<>(production.body);
			Collections.reverse(body);
			prods.add(new Production(production.head, body));
		}
		return new CFG(variables, terminals, startSymbol, prods);
	}

	/**
	 * Does the grammar generate no word at all?
	 */
	public boolean isEmpty(){
		return startSymbol == null || !getGeneratingSymbols().contains(startSymbol);
	}

	/**
	 * Does the grammar generate the passed word? Epsilons in the word are ignored.
	 */
	public boolean contains(List<?> word){
		List<Terminal> terms = toTerminals(word);
		if (terms.isEmpty()){
			return generatesEpsilon();
		}
		return new CYKTable(this, terms).generatesWord();
	}

	/**
	 * Parse tree of the word with respect to the normal form of this grammar
	 *
	 * @throws DerivationNotFoundException if the grammar doesn't generate the word
	 */
	public ParseTree getCnfParseTree(List<?> word){
		return new CYKTable(this, toTerminals(word)).getParseTree();
	}

	public static List<Terminal> toTerminals(List<?> word){
		List<Terminal> ret = new ArrayList<>();
		for (Object obj : word){
			Terminal terminal = Terminal.of(obj);
			if (!(terminal instanceof Epsilon)){
				ret.add(terminal);
			}
		}
		return ret;
	}

	/**
	 * Intersection with an automaton or a regular expression
	 *
	 * @throws UnsupportedOperationException for other operands
	 */
	public CFG intersection(Object other){
		if (other instanceof FiniteAutomaton){
			return intersection((FiniteAutomaton)other);
		}
		if (other instanceof Regex){
			return intersection((Regex)other);
		}
		throw new UnsupportedOperationException(String.format("Can't intersect a grammar with %s",
				other == null ? "null" : other.getClass().getSimpleName()));
	}

	public CFG intersection(Regex regex){
		return intersection(regex.toEpsilonNfa());
	}

	/**
	 * Grammar of the intersection of the language with the language of the automaton.
	 *
	 * Variables of the new grammar stand for triples (p, A, q) and derive the words that A derives and
	 * that lead from p to q in the automaton.
	 */
	public CFG intersection(FiniteAutomaton automaton){
		DeterministicFiniteAutomaton dfa = automaton.toDeterministic();
		if (isEmpty() || dfa.isEmpty()){
			return new CFG();
		}
		boolean generatesEmpty = generatesEpsilon() && dfa.accepts(Collections.emptyList());
		CFG cnf = toNormalForm();
		List<State> states = new ArrayList<>(dfa.getStates());
		VariableConverter<State, Symbol> converter = new VariableConverter<>();
		List<Production> prods = new ArrayList<>();
		for (Production production : cnf.productions){
			if (production.body.size() == 2){
				intersectBinaryProduction(production, states, converter, prods);
			} else {
				intersectTerminalProduction(production, dfa, states, converter, prods);
			}
		}
		Variable start = new Variable("Start");
		if (cnf.startSymbol != null && dfa.getStartState() != null){
			for (State finalState : dfa.getFinalStates()){
				prods.add(new Production(start, Collections.singletonList(
						converter.toCombinedVariable(dfa.getStartState(), cnf.startSymbol, finalState))));
			}
		}
		if (generatesEmpty){
			prods.add(new Production(start, Collections.emptyList()));
		}
		LOG.fine(() -> String.format("Intersection with %d states has %d productions", states.size(), prods.size()));
		return new CFG(start, prods);
	}

	private static void intersectBinaryProduction(Production production, List<State> states,
	                                              VariableConverter<State, Symbol> converter, List<Production> prods){
		for (State p : states){
			for (State r : states){
				Variable head = converter.toCombinedVariable(p, production.head, r);
				for (State q : states){
					prods.add(new Production(head, Arrays.asList(
							converter.toCombinedVariable(p, production.body.get(0), q),
							converter.toCombinedVariable(q, production.body.get(1), r)), false));
				}
			}
		}
	}

	private static void intersectTerminalProduction(Production production, DeterministicFiniteAutomaton dfa,
	                                                List<State> states, VariableConverter<State, Symbol> converter,
	                                                List<Production> prods){
		Symbol terminal = production.body.get(0);
		InputSymbol symbol = InputSymbol.of(terminal.value);
		for (State p : states){
			State next = dfa.getNextState(p, symbol);
			if (next != null){
				prods.add(new Production(converter.toCombinedVariable(p, production.head, next),
						Collections.singletonList(terminal), false));
			}
		}
	}

	/**
	 * Words of the language, ordered by length.
	 *
	 * @param maxLength maximum length of the words, -1 for no bound
	 * @return a lazy stream that can be consumed once
	 */
	public Stream<List<Terminal>> getWords(int maxLength){
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(new WordGenerator(this, maxLength),
				Spliterator.ORDERED | Spliterator.NONNULL), false);
	}

	public Stream<List<Terminal>> getWords(){
		return getWords(-1);
	}

	/**
	 * Is the language finite? This is the case iff the graph of the binary productions of the
	 * normal form has no cycle.
	 */
	public boolean isFinite(){
		Graph<Variable, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
		for (Production production : toNormalForm().productions){
			if (production.body.size() != 2){
				continue;
			}
			for (Symbol symbol : production.body){
				Graphs.addEdgeWithVertices(graph, production.head, (Variable)symbol);
			}
		}
		return !new CycleDetector<>(graph).detectCycles();
	}
}

package formlang.parser.ll;

import java.util.*;
import java.util.logging.Logger;

import formlang.grammar.*;
import formlang.util.SetQueue;

/**
 * LL(1) parser for a context free grammar.
 *
 * The first and follow sets are computed with work lists, a variable is reprocessed whenever a set it
 * depends on grew.
 */
public class LLOneParser {

	private static final Logger LOG = Logger.getLogger(LLOneParser.class.getName());

	/**
	 * Marks the end of the input in the follow sets and the parsing table
	 */
	public static final Terminal END_MARKER = new Terminal("#EOF#");

	private final CFG cfg;

	private Map<Symbol, Set<Terminal>> firstSet;

	private Map<Symbol, Set<Terminal>> followSet;

	private Map<Variable, Map<Terminal, List<Production>>> parsingTable;

	public LLOneParser(CFG cfg) {
		this.cfg = cfg;
	}

	/**
	 * First sets of the terminals and variables, they contain epsilon for nullable variables
	 */
	public Map<Symbol, Set<Terminal>> getFirstSet(){
		if (firstSet != null){
			return firstSet;
		}
		Map<Symbol, List<Variable>> triggers = new HashMap<>();
		for (Production production : cfg.getProductions()){
			for (Symbol symbol : production.body){
				triggers.computeIfAbsent(symbol, s -> new ArrayList<>()).add(production.head);
			}
		}
		Map<Symbol, Set<Terminal>> first = new HashMap<>();
		SetQueue<Variable> queue = new SetQueue<>();
		for (Terminal terminal : cfg.getTerminals()){
			first.put(terminal, new LinkedHashSet<>(Collections.singleton(terminal)));
			triggers.getOrDefault(terminal, Collections.emptyList()).forEach(queue::append);
		}
		for (Production production : cfg.getProductions()){
			if (production.body.isEmpty()){
				first.computeIfAbsent(production.head, s -> new LinkedHashSet<>()).add(Epsilon.get());
				triggers.getOrDefault(production.head, Collections.emptyList()).forEach(queue::append);
			}
		}
		Map<Variable, List<Production>> byHead = cfg.getProductionsByHead();
		while (!queue.isEmpty()){
			Variable current = queue.pop();
			Set<Terminal> currentFirst = first.computeIfAbsent(current, s -> new LinkedHashSet<>());
			boolean modified = false;
			for (Production production : byHead.getOrDefault(current, Collections.emptyList())){
				modified |= currentFirst.addAll(getFirstSet(production.body, first));
			}
			if (modified){
				triggers.getOrDefault(current, Collections.emptyList()).forEach(queue::append);
			}
		}
		firstSet = first;
		return firstSet;
	}

	/**
	 * First set of a sequence of symbols, contains epsilon if all symbols are nullable
	 */
	private static Set<Terminal> getFirstSet(List<Symbol> symbols, Map<Symbol, Set<Terminal>> first){
		Set<Terminal> ret = new LinkedHashSet<>();
		for (Symbol symbol : symbols){
			Set<Terminal> symbolFirst = first.getOrDefault(symbol, Collections.emptySet());
			ret.addAll(symbolFirst);
			if (!symbolFirst.contains(Epsilon.get())){
				ret.remove(Epsilon.get());
				return ret;
			}
		}
		ret.add(Epsilon.get());
		return ret;
	}

	/**
	 * Follow sets of the symbols, the follow set of the start symbol contains {@link #END_MARKER}
	 */
	public Map<Symbol, Set<Terminal>> getFollowSet(){
		if (followSet != null){
			return followSet;
		}
		Map<Symbol, Set<Terminal>> first = getFirstSet();
		Map<Symbol, Set<Terminal>> follow = new HashMap<>();
		// the follow set of the head flows into a symbol that is only followed by nullable symbols
		Map<Symbol, Set<Symbol>> triggers = new HashMap<>();
		SetQueue<Symbol> queue = new SetQueue<>();
		if (cfg.getStartSymbol() != null){
			follow.computeIfAbsent(cfg.getStartSymbol(), s -> new LinkedHashSet<>()).add(END_MARKER);
			queue.append(cfg.getStartSymbol());
		}
		for (Production production : cfg.getProductions()){
			for (int i = 0; i < production.body.size(); i++){
				Symbol symbol = production.body.get(i);
				Set<Terminal> rest = getFirstSet(production.body.subList(i + 1, production.body.size()), first);
				Set<Terminal> symbolFollow = follow.computeIfAbsent(symbol, s -> new LinkedHashSet<>());
				for (Terminal terminal : rest){
					if (!(terminal instanceof Epsilon)){
						symbolFollow.add(terminal);
					}
				}
				if (rest.contains(Epsilon.get())){
					triggers.computeIfAbsent(production.head, s -> new LinkedHashSet<>()).add(symbol);
				}
				if (!symbolFollow.isEmpty()){
					queue.append(symbol);
				}
			}
		}
		while (!queue.isEmpty()){
			Symbol current = queue.pop();
			Set<Terminal> currentFollow = follow.getOrDefault(current, Collections.emptySet());
			for (Symbol triggered : triggers.getOrDefault(current, Collections.emptySet())){
				if (follow.computeIfAbsent(triggered, s -> new LinkedHashSet<>()).addAll(currentFollow)){
					queue.append(triggered);
				}
			}
		}
		followSet = follow;
		return followSet;
	}

	/**
	 * Maps a variable and a look ahead terminal to the productions that might be applied.
	 * Productions whose body is nullable are entered for the follow set of their head, the others for the
	 * first set of their body.
	 */
	public Map<Variable, Map<Terminal, List<Production>>> getParsingTable(){
		if (parsingTable != null){
			return parsingTable;
		}
		Map<Symbol, Set<Terminal>> first = getFirstSet();
		Map<Symbol, Set<Terminal>> follow = getFollowSet();
		Set<Symbol> nullables = cfg.getNullableSymbols();
		Map<Variable, Map<Terminal, List<Production>>> table = new LinkedHashMap<>();
		for (Production production : cfg.getProductions()){
			Set<Terminal> lookaheads;
			if (nullables.containsAll(production.body)){
				lookaheads = follow.getOrDefault(production.head, Collections.emptySet());
			} else {
				lookaheads = getFirstSet(production.body, first);
			}
			Map<Terminal, List<Production>> row = table.computeIfAbsent(production.head, v -> new LinkedHashMap<>());
			for (Terminal lookahead : lookaheads){
				row.computeIfAbsent(lookahead, t -> new ArrayList<>()).add(production);
			}
		}
		parsingTable = table;
		return parsingTable;
	}

	/**
	 * Has no cell of the parsing table more than one production?
	 */
	public boolean isLLOneParsable(){
		boolean parsable = true;
		for (Map.Entry<Variable, Map<Terminal, List<Production>>> row : getParsingTable().entrySet()){
			for (Map.Entry<Terminal, List<Production>> cell : row.getValue().entrySet()){
				if (cell.getValue().size() > 1){
					LOG.warning(String.format("Conflict for %s at look ahead %s: %s", row.getKey(), cell.getKey(),
							cell.getValue()));
					parsable = false;
				}
			}
		}
		return parsable;
	}

	/**
	 * Parses the word with a stack of open parse tree nodes.
	 *
	 * @throws NotParsableException if the word isn't in the language or the applicable production isn't unique
	 */
	public ParseTree getParseTree(List<?> word){
		List<Terminal> input = new ArrayList<>();
		for (Object obj : word){
			Terminal terminal = Terminal.of(obj);
			if (!(terminal instanceof Epsilon)){
				input.add(terminal);
			}
		}
		input.add(END_MARKER);
		Map<Variable, Map<Terminal, List<Production>>> table = getParsingTable();
		ParseTree root = new ParseTree(cfg.getStartSymbol() == null ? Epsilon.get() : cfg.getStartSymbol());
		Deque<ParseTree> stack = new ArrayDeque<>();
		stack.push(root);
		int position = 0;
		while (!stack.isEmpty()){
			ParseTree current = stack.pop();
			Terminal lookahead = input.get(position);
			if (current.value instanceof Terminal){
				if (!current.value.equals(lookahead)){
					throw new NotParsableException(String.format("Expected %s but got %s at position %d",
							current.value, lookahead, position));
				}
				position++;
				continue;
			}
			List<Production> applicable = table.getOrDefault((Variable)current.value, Collections.emptyMap())
					.getOrDefault(lookahead, Collections.emptyList());
			if (applicable.size() != 1){
				throw new NotParsableException(applicable.isEmpty()
						? String.format("Unexpected %s at position %d", lookahead, position)
						: String.format("Ambiguous productions %s at position %d", applicable, position));
			}
			if (applicable.get(0).body.isEmpty()){
				current.addSon(new ParseTree(Epsilon.get()));
				continue;
			}
			List<ParseTree> sons = new ArrayList<>();
			for (Symbol symbol : applicable.get(0).body){
				ParseTree son = new ParseTree(symbol);
				current.addSon(son);
				sons.add(son);
			}
			for (int i = sons.size() - 1; i >= 0; i--){
				stack.push(sons.get(i));
			}
		}
		if (!input.get(position).equals(END_MARKER)){
			throw new NotParsableException(String.format("Unexpected %s at position %d", input.get(position), position));
		}
		return root;
	}
}

package formlang.grammar.cyk;

import java.util.*;
import java.util.logging.Logger;

import formlang.grammar.*;
import formlang.util.Pair;

/**
 * CYK table for a grammar and a word.
 *
 * The cell (i, j) contains a node for every variable that derives the sub word from index i (inclusive)
 * to j (exclusive). Cells are filled by increasing window length. Each cell keeps the first node
 * that was inserted for a symbol, so the parse tree of ambiguous words only depends on the order
 * of the productions.
 */
public class CYKTable {

	private static final Logger LOG = Logger.getLogger(CYKTable.class.getName());

	private final CFG normalForm;

	private final List<Terminal> word;

	/**
	 * Heads by body
	 */
	private final Map<List<Symbol>, List<Variable>> productionsByBody = new HashMap<>();

	private final Map<Pair<Integer, Integer>, Map<Symbol, CYKNode>> table = new HashMap<>();

	public CYKTable(CFG grammar, List<Terminal> word) {
		this.normalForm = grammar.toNormalForm();
		this.word = Collections.unmodifiableList(new ArrayList<>(word));
		for (Production production : normalForm.getProductions()){
			productionsByBody.computeIfAbsent(production.body, b -> new ArrayList<>()).add(production.head);
		}
		if (!generatesAllTerminals()){
			LOG.finer(() -> String.format("Word %s contains a terminal without production", word));
			table.put(span(0, word.size()), new LinkedHashMap<>());
		} else {
			initialize();
			propagate();
		}
	}

	private boolean generatesAllTerminals(){
		for (Terminal terminal : word){
			if (!productionsByBody.containsKey(Collections.singletonList(terminal))){
				return false;
			}
		}
		return true;
	}

	private void initialize(){
		for (int i = 0; i < word.size(); i++){
			Terminal terminal = word.get(i);
			Map<Symbol, CYKNode> cell = new LinkedHashMap<>();
			for (Variable head : productionsByBody.get(Collections.<Symbol>singletonList(terminal))){
				cell.putIfAbsent(head, new CYKNode(head, new CYKNode(terminal), null));
			}
			table.put(span(i, i + 1), cell);
		}
		for (int size = 2; size <= word.size(); size++){
			for (int start = 0; start + size <= word.size(); start++){
				table.put(span(start, start + size), new LinkedHashMap<>());
			}
		}
	}

	private void propagate(){
		for (int size = 2; size <= word.size(); size++){
			for (int start = 0; start + size <= word.size(); start++){
				int end = start + size;
				Map<Symbol, CYKNode> cell = table.get(span(start, end));
				for (int mid = start + 1; mid < end; mid++){
					for (CYKNode left : table.get(span(start, mid)).values()){
						for (CYKNode right : table.get(span(mid, end)).values()){
							List<Variable> heads = productionsByBody.get(Arrays.asList(left.value, right.value));
							if (heads == null){
								continue;
							}
							for (Variable head : heads){
								cell.putIfAbsent(head, new CYKNode(head, left, right));
							}
						}
					}
				}
			}
		}
	}

	/**
	 * Does the grammar generate the word?
	 */
	public boolean generatesWord(){
		Variable start = normalForm.getStartSymbol();
		return start != null && table.getOrDefault(span(0, word.size()), Collections.emptyMap()).containsKey(start);
	}

	/**
	 * Symbols that derive the sub word [start, end)
	 */
	public Set<Symbol> getCell(int start, int end){
		return Collections.unmodifiableSet(table.getOrDefault(span(start, end), Collections.emptyMap()).keySet());
	}

	/**
	 * Parse tree of the word with respect to the normal form of the grammar
	 *
	 * @throws DerivationNotFoundException if the word isn't generated
	 */
	public ParseTree getParseTree(){
		if (word.isEmpty()){
			Variable start = normalForm.getStartSymbol();
			return new CYKNode(start == null ? Epsilon.get() : start);
		}
		if (!generatesWord()){
			throw new DerivationNotFoundException(word);
		}
		return table.get(span(0, word.size())).get(normalForm.getStartSymbol());
	}

	private static Pair<Integer, Integer> span(int start, int end){
		return new Pair<>(start, end);
	}
}

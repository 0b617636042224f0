package formlang.parser.rd;

import java.util.*;
import java.util.logging.Logger;

import formlang.Config;
import formlang.grammar.*;

/**
 * Backtracking recursive descent parser.
 *
 * Expands the leftmost (or rightmost) variable of the current sentential form with every production
 * of it in turn. Sentential forms that contain more terminals than the word or whose outer terminals
 * don't match the word are dropped.
 */
public class RecursiveDescentParser {

	private static final Logger LOG = Logger.getLogger(RecursiveDescentParser.class.getName());

	private final CFG cfg;

	private final Map<Variable, List<Production>> productionsByHead;

	private final int maxDepth;

	public RecursiveDescentParser(CFG cfg, int maxDepth) {
		this.cfg = cfg;
		this.productionsByHead = cfg.getProductionsByHead();
		this.maxDepth = maxDepth;
	}

	/**
	 * Uses the maximum depth from the config
	 */
	public RecursiveDescentParser(CFG cfg) {
		this(cfg, Config.getRecursiveDescentMaxDepth());
	}

	/**
	 * @param left expand the leftmost variable first?
	 * @throws RecursionLimitException if the search gets too deep
	 */
	public boolean isParsable(List<?> word, boolean left){
		try {
			getParseTree(word, left);
			return true;
		} catch (NotParsableException e){
			return false;
		}
	}

	public boolean isParsable(List<?> word){
		return isParsable(word, true);
	}

	/**
	 * @param left expand the leftmost variable first?
	 * @throws NotParsableException if the word can't be derived
	 * @throws RecursionLimitException if the search gets too deep
	 */
	public ParseTree getParseTree(List<?> word, boolean left){
		List<Terminal> terminals = CFG.toTerminals(word);
		if (cfg.getStartSymbol() == null){
			throw new NotParsableException("Grammar without start symbol");
		}
		ParseTree root = new ParseTree(cfg.getStartSymbol());
		if (!expand(Collections.singletonList(root), terminals, left, 0)){
			throw new NotParsableException(String.format("Can't derive %s", terminals));
		}
		return root;
	}

	public ParseTree getParseTree(List<?> word){
		return getParseTree(word, true);
	}

	private boolean expand(List<ParseTree> form, List<Terminal> word, boolean left, int depth){
		if (depth > maxDepth){
			LOG.fine(() -> String.format("Recursion limit reached for %s", word));
			throw new RecursionLimitException(maxDepth);
		}
		int terminalCount = 0;
		for (ParseTree node : form){
			if (node.value instanceof Terminal){
				terminalCount++;
			}
		}
		if (terminalCount > word.size()){
			return false;
		}
		int index = left ? matchPrefix(form, word) : matchSuffix(form, word);
		if (index == -1){
			return false;
		}
		if (index == form.size()){
			return form.size() == word.size();
		}
		ParseTree node = form.get(index);
		for (Production production : productionsByHead.getOrDefault((Variable)node.value, Collections.emptyList())){
			List<ParseTree> sons = new ArrayList<>();
			for (Symbol symbol : production.body){
				sons.add(new ParseTree(symbol));
			}
			List<ParseTree> newForm = new ArrayList<>(form.subList(0, index));
			newForm.addAll(sons);
			newForm.addAll(form.subList(index + 1, form.size()));
			if (sons.isEmpty()){
				node.addSon(new ParseTree(Epsilon.get()));
			}
			sons.forEach(node::addSon);
			if (expand(newForm, word, left, depth + 1)){
				return true;
			}
			node.removeSons();
		}
		return false;
	}

	/**
	 * Checks the terminals before the first variable against the start of the word
	 *
	 * @return index of the first variable, the size of the form if there is none, or -1 on a mismatch
	 */
	private static int matchPrefix(List<ParseTree> form, List<Terminal> word){
		for (int i = 0; i < form.size(); i++){
			if (form.get(i).value instanceof Variable){
				return i;
			}
			if (i >= word.size() || !form.get(i).value.equals(word.get(i))){
				return -1;
			}
		}
		return form.size();
	}

	/**
	 * Checks the terminals after the last variable against the end of the word
	 *
	 * @return index of the last variable, the size of the form if there is none, or -1 on a mismatch
	 */
	private static int matchSuffix(List<ParseTree> form, List<Terminal> word){
		for (int i = 0; i < form.size(); i++){
			int formIndex = form.size() - 1 - i;
			if (form.get(formIndex).value instanceof Variable){
				return formIndex;
			}
			if (i >= word.size() || !form.get(formIndex).value.equals(word.get(word.size() - 1 - i))){
				return -1;
			}
		}
		return form.size();
	}
}

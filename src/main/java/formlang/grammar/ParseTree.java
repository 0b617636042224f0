package formlang.grammar;

import java.util.*;

import formlang.util.DotGraph;

/**
 * A node of a parse tree, labeled with a grammar symbol
 */
public class ParseTree {

	public final Symbol value;

	protected final List<ParseTree> sons;

	public ParseTree(Symbol value) {
		this(value, new ArrayList<>());
	}

	public ParseTree(Symbol value, List<ParseTree> sons) {
		this.value = value;
		this.sons = new ArrayList<>(sons);
	}

	public List<ParseTree> getSons() {
		return Collections.unmodifiableList(sons);
	}

	/**
	 * Appends a son (used while building the tree)
	 */
	public void addSon(ParseTree son){
		sons.add(son);
	}

	/**
	 * Removes all sons (used while backtracking)
	 */
	public void removeSons(){
		sons.clear();
	}

	public boolean isLeaf(){
		return sons.isEmpty();
	}

	/**
	 * Sentential forms of the leftmost derivation that this tree represents, starting with the root symbol
	 * and ending with the derived word.
	 */
	public List<List<Symbol>> getLeftmostDerivation(){
		List<List<Symbol>> ret = new ArrayList<>();
		ret.add(Collections.singletonList(value));
		if (sons.isEmpty()){
			return ret;
		}
		List<Symbol> sonValues = new ArrayList<>();
		for (ParseTree son : sons){
			sonValues.add(son.value);
		}
		ret.add(withoutEpsilon(sonValues));
		List<Symbol> prefix = new ArrayList<>();
		for (int i = 0; i < sons.size(); i++){
			List<List<Symbol>> derivation = sons.get(i).getLeftmostDerivation();
			List<Symbol> suffix = sonValues.subList(i + 1, sonValues.size());
			for (List<Symbol> form : derivation.subList(1, derivation.size())){
				List<Symbol> sentential = new ArrayList<>(prefix);
				sentential.addAll(form);
				sentential.addAll(suffix);
				ret.add(withoutEpsilon(sentential));
			}
			prefix.addAll(derivation.get(derivation.size() - 1));
		}
		return ret;
	}

	private static List<Symbol> withoutEpsilon(List<Symbol> symbols){
		List<Symbol> ret = new ArrayList<>();
		for (Symbol symbol : symbols){
			if (!(symbol instanceof Epsilon)){
				ret.add(symbol);
			}
		}
		return ret;
	}

	/**
	 * Derived word, read from the leaves
	 */
	public List<Terminal> getYield(){
		List<Terminal> ret = new ArrayList<>();
		Deque<ParseTree> stack = new ArrayDeque<>();
		stack.push(this);
		while (!stack.isEmpty()){
			ParseTree current = stack.pop();
			if (current.sons.isEmpty()){
				if (current.value instanceof Terminal && !(current.value instanceof Epsilon)){
					ret.add((Terminal)current.value);
				}
			} else {
				for (int i = current.sons.size() - 1; i >= 0; i--){
					stack.push(current.sons.get(i));
				}
			}
		}
		return ret;
	}

	/**
	 * Graphviz representation of the tree
	 */
	public String toDot(){
		DotGraph graph = new DotGraph("parse tree");
		Deque<ParseTree> stack = new ArrayDeque<>();
		stack.push(this);
		Map<ParseTree, Integer> ids = new IdentityHashMap<>();
		ids.put(this, 0);
		graph.node(0, value.toString());
		while (!stack.isEmpty()){
			ParseTree current = stack.pop();
			for (ParseTree son : current.sons){
				ids.put(son, ids.size());
				graph.node(ids.get(son), son.value.toString());
				graph.edge(ids.get(current), ids.get(son));
				stack.push(son);
			}
		}
		return graph.toString();
	}

	@Override
	public String toString() {
		if (sons.isEmpty()){
			return value.toString();
		}
		StringBuilder builder = new StringBuilder(value.toString()).append("(");
		for (int i = 0; i < sons.size(); i++){
			if (i > 0){
				builder.append(" ");
			}
			builder.append(sons.get(i));
		}
		return builder.append(")").toString();
	}
}

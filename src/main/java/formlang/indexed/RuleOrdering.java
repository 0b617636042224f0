package formlang.indexed;

import java.util.*;
import java.util.function.ToIntFunction;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.scoring.Coreness;
import org.jgrapht.graph.AsUndirectedGraph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.BreadthFirstIterator;

import formlang.Config;
import formlang.grammar.Terminal;
import formlang.grammar.Variable;

/**
 * Orders the non consumption rules of an indexed grammar.
 *
 * The order doesn't change the result of the marking, only the number of passes it needs. Most
 * strategies use the dependency graph of the variables: a duplication rule <code>A → B C</code> adds
 * the edges B → A and C → A, a production rule <code>A → B[f]</code> adds an edge D → A for every
 * consumption rule <code>C[f] → D</code>.
 */
public class RuleOrdering {

	public enum Strategy {
		GIVEN,
		REVERSE,
		CORE,
		CORE_REVERSE,
		ARBORESCENCE,
		ARBORESCENCE_REVERSE,
		EDGES,
		EDGES_REVERSE,
		RANDOM;

		/**
		 * Strategy set in the config
		 */
		public static Strategy getDefault(){
			return valueOf(Config.getRuleOrdering());
		}
	}

	private final List<ReducedRule> rules;

	private final Map<Terminal, List<ConsumptionRule>> consumptionRules;

	private final Variable startVariable;

	public RuleOrdering(List<ReducedRule> rules, Map<Terminal, List<ConsumptionRule>> consumptionRules,
	                    Variable startVariable) {
		this.rules = rules;
		this.consumptionRules = consumptionRules;
		this.startVariable = startVariable;
	}

	/**
	 * Returns a new list with the rules ordered by the passed strategy
	 */
	public List<ReducedRule> order(Strategy strategy){
		switch (strategy){
			case GIVEN:
				return new ArrayList<>(rules);
			case REVERSE:
				return reverse();
			case CORE:
				return orderByCore(false);
			case CORE_REVERSE:
				return orderByCore(true);
			case ARBORESCENCE:
				return orderByArborescence(false);
			case ARBORESCENCE_REVERSE:
				return orderByArborescence(true);
			case EDGES:
				return orderByEdges(false);
			case EDGES_REVERSE:
				return orderByEdges(true);
			case RANDOM:
				return orderRandom(Config.getRuleOrderingSeed());
		}
		throw new IllegalArgumentException(strategy.toString());
	}

	public List<ReducedRule> reverse(){
		List<ReducedRule> ret = new ArrayList<>(rules);
		Collections.reverse(ret);
		return ret;
	}

	Graph<Variable, DefaultEdge> getGraph(){
		Graph<Variable, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
		for (ReducedRule rule : rules){
			rule.accept(new RuleVisitor<Void>() {
				@Override
				public Void visit(DuplicationRule rule) {
					addEdge(graph, rule.firstRight, rule.left);
					addEdge(graph, rule.secondRight, rule.left);
					return null;
				}

				@Override
				public Void visit(ProductionRule rule) {
					for (ConsumptionRule consumption : consumptionRules.getOrDefault(rule.production, Collections.emptyList())){
						addEdge(graph, consumption.right, rule.left);
					}
					return null;
				}

				@Override
				public Void visit(ConsumptionRule rule) {
					return null;
				}

				@Override
				public Void visit(EndRule rule) {
					return null;
				}
			});
		}
		return graph;
	}

	private static void addEdge(Graph<Variable, DefaultEdge> graph, Variable from, Variable to){
		if (!from.equals(to)){
			Graphs.addEdgeWithVertices(graph, from, to);
		}
	}

	/**
	 * Orders by the core number of the left variable, variables without edges have core number 0
	 */
	public List<ReducedRule> orderByCore(boolean reverse){
		Map<Variable, Integer> cores = coreNumbers(getGraph());
		return sorted(rule -> cores.getOrDefault(rule.left, 0), reverse);
	}

	/**
	 * Core numbers with the degree being the sum of in and out degree
	 */
	static Map<Variable, Integer> coreNumbers(Graph<Variable, DefaultEdge> graph){
		return new Coreness<>(new AsUndirectedGraph<>(graph)).getScores();
	}

	/**
	 * Orders by the depth of the left variable in a breadth first spanning tree of the undirected
	 * dependency graph rooted at the start variable, unconnected variables have depth 0
	 */
	public List<ReducedRule> orderByArborescence(boolean reverse){
		Graph<Variable, DefaultEdge> graph = getGraph();
		Map<Variable, Integer> depths = new HashMap<>();
		if (graph.containsVertex(startVariable)){
			BreadthFirstIterator<Variable, DefaultEdge> iterator =
					new BreadthFirstIterator<>(new AsUndirectedGraph<>(graph), startVariable);
			while (iterator.hasNext()){
				Variable variable = iterator.next();
				depths.put(variable, iterator.getDepth(variable));
			}
		}
		return sorted(rule -> depths.getOrDefault(rule.left, 0), reverse);
	}

	/**
	 * Orders by the out degree of the left variable
	 */
	public List<ReducedRule> orderByEdges(boolean reverse){
		Graph<Variable, DefaultEdge> graph = getGraph();
		return sorted(rule -> graph.containsVertex(rule.left) ? graph.outDegreeOf(rule.left) : 0, reverse);
	}

	public List<ReducedRule> orderRandom(long seed){
		List<ReducedRule> ret = new ArrayList<>(rules);
		Collections.shuffle(ret, new Random(seed));
		return ret;
	}

	private List<ReducedRule> sorted(ToIntFunction<ReducedRule> key, boolean reverse){
		List<ReducedRule> ret = new ArrayList<>(rules);
		ret.sort(Comparator.comparingInt(key));
		if (reverse){
			Collections.reverse(ret);
		}
		return ret;
	}
}

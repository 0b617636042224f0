package formlang.grammar;

import java.util.*;

import formlang.util.Pair;

/**
 * Backwards propagation structure used to compute the nullable and the generating symbols of a grammar.
 *
 * For every production <code>A → X1 … Xn</code> with index i (per head), each body symbol Xj impacts (A, i)
 * and the remaining counter of (A, i) starts at n. Processing a symbol decrements the counters it impacts,
 * a head whose counter drops to zero becomes derivable and is processed itself.
 */
class ImpactTable {

	private final Map<Symbol, List<Pair<Variable, Integer>>> impacts = new HashMap<>();

	private final Map<Variable, List<Integer>> remaining = new HashMap<>();

	/**
	 * Heads of epsilon productions
	 */
	private final Set<Variable> epsilonHeads = new LinkedHashSet<>();

	ImpactTable(Collection<Production> productions) {
		for (Production production : productions){
			if (production.body.isEmpty()){
				epsilonHeads.add(production.head);
				continue;
			}
			List<Integer> counters = remaining.computeIfAbsent(production.head, h -> new ArrayList<>());
			counters.add(production.body.size());
			int index = counters.size() - 1;
			for (Symbol symbol : production.body){
				impacts.computeIfAbsent(symbol, s -> new ArrayList<>()).add(new Pair<>(production.head, index));
			}
		}
	}

	/**
	 * Symbols that derive a word made of the passed seeds (and epsilon).
	 *
	 * @param seeds symbols that are derivable from the start
	 * @param stopAt symbol whose derivability ends the computation early, or null
	 * @return the derivable symbols (without epsilon), or null if the stopAt symbol was reached
	 */
	Set<Symbol> propagate(Collection<? extends Symbol> seeds, Variable stopAt){
		Map<Variable, int[]> counters = new HashMap<>();
		for (Map.Entry<Variable, List<Integer>> entry : remaining.entrySet()){
			counters.put(entry.getKey(), entry.getValue().stream().mapToInt(Integer::intValue).toArray());
		}
		Set<Symbol> derivable = new LinkedHashSet<>();
		Deque<Symbol> stack = new ArrayDeque<>();
		stack.push(Epsilon.get());
		for (Variable head : epsilonHeads){
			if (head.equals(stopAt)){
				return null;
			}
			if (derivable.add(head)){
				stack.push(head);
			}
		}
		for (Symbol seed : seeds){
			if (derivable.add(seed)){
				stack.push(seed);
			}
		}
		while (!stack.isEmpty()){
			Symbol current = stack.pop();
			for (Pair<Variable, Integer> impact : impacts.getOrDefault(current, Collections.emptyList())){
				if (derivable.contains(impact.first)){
					continue;
				}
				int[] headCounters = counters.get(impact.first);
				headCounters[impact.second]--;
				if (headCounters[impact.second] == 0){
					if (impact.first.equals(stopAt)){
						return null;
					}
					derivable.add(impact.first);
					stack.push(impact.first);
				}
			}
		}
		derivable.remove(Epsilon.get());
		return derivable;
	}
}

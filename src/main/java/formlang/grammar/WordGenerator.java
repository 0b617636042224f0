package formlang.grammar;

import java.util.*;

/**
 * Enumerates the words of a grammar by increasing length, using the binary productions of its normal form.
 *
 * The words of length n derived by a variable are combined from the words of length i and n - i of the
 * variables in its bodies. The enumeration ends after the maximum length or when no new word was found
 * for more than half of the current length.
 */
class WordGenerator implements Iterator<List<Terminal>> {

	private final CFG grammar;

	private final int maxLength;

	private final Deque<List<Terminal>> pending = new ArrayDeque<>();

	/**
	 * Words by variable and length
	 */
	private Map<Variable, List<Set<List<Terminal>>>> words;

	private CFG normalForm;

	private int currentLength = 0;

	private int roundsWithoutModification = 0;

	private boolean finished = false;

	WordGenerator(CFG grammar, int maxLength) {
		this.grammar = grammar;
		this.maxLength = maxLength;
	}

	@Override
	public boolean hasNext() {
		while (pending.isEmpty() && !finished){
			step();
		}
		return !pending.isEmpty();
	}

	@Override
	public List<Terminal> next() {
		if (!hasNext()){
			throw new NoSuchElementException();
		}
		return pending.poll();
	}

	private void step(){
		if (currentLength == 0){
			if (grammar.generatesEpsilon()){
				pending.add(Collections.emptyList());
			}
			currentLength = 1;
			if (maxLength == 0){
				finished = true;
			}
			return;
		}
		if (currentLength == 1){
			initialize();
			currentLength = 2;
			return;
		}
		if (maxLength != -1 && currentLength > maxLength){
			finished = true;
			return;
		}
		boolean modified = false;
		for (List<Set<List<Terminal>>> byLength : words.values()){
			byLength.add(new LinkedHashSet<>());
		}
		for (Production production : normalForm.getProductions()){
			if (production.body.size() != 2){
				continue;
			}
			Set<List<Terminal>> target = words.get(production.head).get(currentLength);
			List<Set<List<Terminal>>> lefts = words.get((Variable)production.body.get(0));
			List<Set<List<Terminal>>> rights = words.get((Variable)production.body.get(1));
			for (int i = 1; i < currentLength; i++){
				for (List<Terminal> left : lefts.get(i)){
					for (List<Terminal> right : rights.get(currentLength - i)){
						List<Terminal> word = new ArrayList<>(left);
						word.addAll(right);
						if (target.add(word)){
							modified = true;
							if (production.head.equals(normalForm.getStartSymbol())){
								pending.add(word);
							}
						}
					}
				}
			}
		}
		if (modified){
			roundsWithoutModification = 0;
		} else {
			roundsWithoutModification++;
		}
		currentLength++;
		if (roundsWithoutModification > currentLength / 2.0){
			finished = true;
		}
	}

	private void initialize(){
		normalForm = grammar.toNormalForm();
		words = new HashMap<>();
		for (Variable variable : normalForm.getVariables()){
			List<Set<List<Terminal>>> byLength = new ArrayList<>();
			byLength.add(new LinkedHashSet<>());
			byLength.add(new LinkedHashSet<>());
			words.put(variable, byLength);
		}
		for (Production production : normalForm.getProductions()){
			if (production.body.size() == 1 && production.body.get(0) instanceof Terminal){
				List<Terminal> word = Collections.singletonList((Terminal)production.body.get(0));
				if (words.get(production.head).get(1).add(word) && production.head.equals(normalForm.getStartSymbol())){
					pending.add(word);
				}
			}
		}
	}
}

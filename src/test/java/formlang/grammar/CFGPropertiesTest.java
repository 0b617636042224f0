package formlang.grammar;

import java.util.*;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import org.junit.runner.RunWith;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the grammar transformations on small random grammars against a bounded word oracle
 */
@RunWith(JUnitQuickcheck.class)
public class CFGPropertiesTest {

	private static final int MAX_LENGTH = 3;

	private static final List<Variable> VARIABLES = Arrays.asList(new Variable("S"), new Variable("A"), new Variable("B"));

	private static final List<Terminal> TERMINALS = Arrays.asList(new Terminal("a"), new Terminal("b"));

	public static class SmallGrammars extends Generator<CFG> {

		public SmallGrammars() {
			super(CFG.class);
		}

		@Override
		public CFG generate(SourceOfRandomness random, GenerationStatus status) {
			List<Symbol> symbols = new ArrayList<>(VARIABLES);
			symbols.addAll(TERMINALS);
			List<Production> productions = new ArrayList<>();
			int number = random.nextInt(1, 7);
			for (int i = 0; i < number; i++){
				List<Symbol> body = new ArrayList<>();
				int length = random.nextInt(0, 3);
				for (int j = 0; j < length; j++){
					body.add(random.choose(symbols));
				}
				productions.add(new Production(random.choose(VARIABLES), body));
			}
			return new CFG(VARIABLES.get(0), productions);
		}
	}

	/**
	 * Words of the grammar up to {@link #MAX_LENGTH}, computed as a least fixed point over all symbols
	 */
	static Set<List<Terminal>> boundedLanguage(CFG cfg){
		Map<Symbol, Set<List<Terminal>>> words = new HashMap<>();
		for (Terminal terminal : cfg.getTerminals()){
			words.put(terminal, Collections.singleton(Collections.singletonList(terminal)));
		}
		for (Variable variable : cfg.getVariables()){
			words.put(variable, new HashSet<>());
		}
		boolean changed = true;
		while (changed){
			changed = false;
			for (Production production : cfg.getProductions()){
				Set<List<Terminal>> current = Collections.singleton(Collections.emptyList());
				for (Symbol symbol : production.body){
					Set<List<Terminal>> next = new HashSet<>();
					for (List<Terminal> prefix : current){
						for (List<Terminal> suffix : words.get(symbol)){
							if (prefix.size() + suffix.size() <= MAX_LENGTH){
								List<Terminal> word = new ArrayList<>(prefix);
								word.addAll(suffix);
								next.add(word);
							}
						}
					}
					current = next;
				}
				changed |= words.get(production.head).addAll(current);
			}
		}
		if (cfg.getStartSymbol() == null){
			return Collections.emptySet();
		}
		return words.get(cfg.getStartSymbol());
	}

	static List<List<Terminal>> allWords(){
		List<List<Terminal>> ret = new ArrayList<>();
		List<List<Terminal>> current = Collections.singletonList(Collections.emptyList());
		for (int length = 0; length <= MAX_LENGTH; length++){
			ret.addAll(current);
			List<List<Terminal>> next = new ArrayList<>();
			for (List<Terminal> word : current){
				for (Terminal terminal : TERMINALS){
					List<Terminal> longer = new ArrayList<>(word);
					longer.add(terminal);
					next.add(longer);
				}
			}
			current = next;
		}
		return ret;
	}

	@Property(trials = 100)
	public void testContainsMatchesDerivations(@From(SmallGrammars.class) CFG cfg){
		Set<List<Terminal>> expected = boundedLanguage(cfg);
		for (List<Terminal> word : allWords()){
			assertEquals(expected.contains(word), cfg.contains(word), cfg + " with " + word);
		}
	}

	@Property(trials = 100)
	public void testNormalFormShape(@From(SmallGrammars.class) CFG cfg){
		CFG cnf = cfg.toNormalForm();
		assertTrue(cnf.isNormalForm(), cnf.toString());
		assertFalse(cnf.generatesEpsilon());
		assertEquals(cnf.getProductions(), cnf.toNormalForm().getProductions());
	}

	@Property(trials = 100)
	public void testNormalFormKeepsNonEmptyWords(@From(SmallGrammars.class) CFG cfg){
		Set<List<Terminal>> expected = new HashSet<>(boundedLanguage(cfg));
		expected.remove(Collections.<Terminal>emptyList());
		assertEquals(expected, boundedLanguage(cfg.toNormalForm()), cfg.toString());
	}

	@Property(trials = 100)
	public void testRemovalPassesKeepLanguage(@From(SmallGrammars.class) CFG cfg){
		Set<List<Terminal>> expected = boundedLanguage(cfg);
		assertEquals(expected, boundedLanguage(cfg.removeUselessSymbols()), cfg.toString());
		assertEquals(expected, boundedLanguage(cfg.eliminateUnitProductions()), cfg.toString());
		Set<List<Terminal>> withoutEpsilon = new HashSet<>(expected);
		withoutEpsilon.remove(Collections.<Terminal>emptyList());
		assertEquals(withoutEpsilon, boundedLanguage(cfg.removeEpsilon()), cfg.toString());
	}

	@Property(trials = 50)
	public void testFixedPointsAgreeWithLanguage(@From(SmallGrammars.class) CFG cfg){
		Set<List<Terminal>> words = boundedLanguage(cfg);
		assertEquals(words.contains(Collections.<Terminal>emptyList()), cfg.generatesEpsilon());
		if (!words.isEmpty()){
			assertFalse(cfg.isEmpty());
			assertTrue(cfg.getGeneratingSymbols().contains(cfg.getStartSymbol()));
		}
	}
}

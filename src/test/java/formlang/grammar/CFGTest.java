package formlang.grammar;

import java.util.*;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import formlang.automata.DeterministicFiniteAutomaton;
import formlang.automata.Regex;
import formlang.util.Pair;

import static formlang.util.Utils.set;
import static org.junit.jupiter.api.Assertions.*;

public class CFGTest {

	static final CFG anbn = CFG.fromText("S -> a S b | $");

	static List<String> word(String text){
		if (text.isEmpty()){
			return Collections.emptyList();
		}
		return Arrays.asList(text.split(" "));
	}

	static Variable v(String name){
		return new Variable(name);
	}

	static Terminal t(String name){
		return new Terminal(name);
	}

	@Nested
	public class Text {

		@Test
		public void testReadProductions(){
			CFG cfg = CFG.fromText("S -> A b | c\nA -> $ | a A");
			assertEquals(set(v("S"), v("A")), cfg.getVariables());
			assertEquals(set(t("a"), t("b"), t("c")), cfg.getTerminals());
			assertEquals(4, cfg.getProductions().size());
			assertTrue(cfg.getProductions().contains(new Production(v("A"), Collections.emptyList())));
		}

		@Test
		public void testExplicitSymbolKinds(){
			CFG cfg = CFG.fromText("S -> \"VAR:x\" \"TER:Y\"\n\"VAR:x\" -> z");
			assertEquals(set(v("S"), v("x")), cfg.getVariables());
			assertEquals(set(t("Y"), t("z")), cfg.getTerminals());
			assertTrue(cfg.contains(word("z Y")));
		}

		@Test
		public void testToTextRoundTrip(){
			CFG cfg = CFG.fromText("S -> \"VAR:x\" \"TER:Y\"\n\"VAR:x\" -> z | $");
			CFG reread = CFG.fromText(cfg.toText());
			assertEquals(cfg.getProductions(), reread.getProductions());
		}

		@Test
		public void testMissingArrow(){
			GrammarFormatException exception = assertThrows(GrammarFormatException.class,
					() -> CFG.fromText("S -> a\nS b"));
			assertEquals(2, exception.lineNumber);
		}

		@ParameterizedTest
		@ValueSource(strings = {"$", "epsilon", "ε", "ϵ", "Є"})
		public void testEpsilonAliases(String alias){
			CFG cfg = CFG.fromText("S -> a | " + alias);
			assertTrue(cfg.generatesEpsilon());
			assertEquals(set(t("a")), cfg.getTerminals());
		}

		@Test
		public void testCyrillicEpsilonInRecursiveBody(){
			CFG cfg = CFG.fromText("S -> a S b | Є");
			assertEquals(set(v("S")), cfg.getVariables());
			assertTrue(cfg.contains(Collections.emptyList()));
			assertTrue(cfg.contains(word("a b")));
		}

		@Test
		public void testOnlyAsciiCapitalsStartVariables(){
			CFG cfg = CFG.fromText("S -> É \"VAR:Ö\"\n\"VAR:Ö\" -> ü");
			assertEquals(set(v("S"), v("Ö")), cfg.getVariables());
			assertEquals(set(t("É"), t("ü")), cfg.getTerminals());
			assertEquals(cfg.getProductions(), CFG.fromText(cfg.toText()).getProductions());
		}
	}

	@Nested
	public class FixedPoints {

		final CFG cfg = CFG.fromText("S -> A B | C\nA -> a | $\nB -> b\nC -> C c\nD -> d");

		@Test
		public void testGenerating(){
			Set<Symbol> generating = cfg.getGeneratingSymbols();
			assertTrue(generating.containsAll(set(v("S"), v("A"), v("B"), v("D"), t("a"), t("b"), t("c"), t("d"))));
			assertFalse(generating.contains(v("C")));
		}

		@Test
		public void testNullable(){
			assertEquals(set(v("A")), cfg.getNullableSymbols());
			assertFalse(cfg.generatesEpsilon());
			assertTrue(anbn.generatesEpsilon());
		}

		@Test
		public void testReachable(){
			Set<Symbol> reachable = cfg.getReachableSymbols();
			assertTrue(reachable.containsAll(set(v("S"), v("A"), v("B"), v("C"), t("a"), t("b"), t("c"))));
			assertFalse(reachable.contains(v("D")));
			assertFalse(reachable.contains(t("d")));
		}

		@Test
		public void testRemoveUselessSymbols(){
			CFG cleaned = cfg.removeUselessSymbols();
			assertEquals(set(v("S"), v("A"), v("B")), cleaned.getVariables());
			assertEquals(set(t("a"), t("b")), cleaned.getTerminals());
			assertTrue(cleaned.contains(word("a b")));
			assertTrue(cleaned.contains(word("b")));
		}
	}

	@Nested
	public class Cleaning {

		@Test
		public void testRemoveEpsilon(){
			CFG cfg = anbn.removeEpsilon();
			assertFalse(cfg.generatesEpsilon());
			assertTrue(cfg.contains(word("a b")));
			assertTrue(cfg.contains(word("a a b b")));
			for (Production production : cfg.getProductions()){
				assertFalse(production.body.isEmpty(), production.toString());
			}
		}

		@Test
		public void testUnitPairs(){
			CFG cfg = CFG.fromText("S -> A\nA -> B | a\nB -> b");
			Set<Pair<Variable, Variable>> pairs = cfg.getUnitPairs();
			assertTrue(pairs.contains(new Pair<>(v("S"), v("A"))));
			assertTrue(pairs.contains(new Pair<>(v("S"), v("B"))));
			assertTrue(pairs.contains(new Pair<>(v("A"), v("B"))));
			assertTrue(pairs.contains(new Pair<>(v("B"), v("B"))));
			assertFalse(pairs.contains(new Pair<>(v("B"), v("A"))));
		}

		@Test
		public void testEliminateUnitProductions(){
			CFG cfg = CFG.fromText("S -> A\nA -> B | a\nB -> b").eliminateUnitProductions();
			for (Production production : cfg.getProductions()){
				assertFalse(production.body.size() == 1 && production.body.get(0) instanceof Variable, production.toString());
			}
			assertTrue(cfg.contains(word("a")));
			assertTrue(cfg.contains(word("b")));
		}
	}

	@Nested
	public class NormalForm {

		@Test
		public void testShape(){
			CFG cnf = CFG.fromText("S -> a S b c | A\nA -> $ | d A").toNormalForm();
			assertTrue(cnf.isNormalForm());
			assertTrue(cnf.contains(word("a b c")));
			assertTrue(cnf.contains(word("a d d b c")));
			assertFalse(cnf.contains(word("a b")));
		}

		@Test
		public void testEpsilonIsDropped(){
			assertTrue(anbn.contains(Collections.emptyList()));
			assertFalse(anbn.toNormalForm().generatesEpsilon());
		}

		@Test
		public void testCached(){
			CFG cfg = CFG.fromText("S -> a S b | a b");
			assertSame(cfg.toNormalForm(), cfg.toNormalForm());
		}

		@Test
		public void testEmptyGrammar(){
			CFG cnf = CFG.fromText("S -> S a").toNormalForm();
			assertTrue(cnf.getProductions().isEmpty());
			assertTrue(cnf.isEmpty());
		}
	}

	@Nested
	public class Membership {

		@Test
		public void testAnBn(){
			assertTrue(anbn.contains(Collections.emptyList()));
			assertTrue(anbn.contains(word("a b")));
			assertTrue(anbn.contains(word("a a b b")));
			assertFalse(anbn.contains(word("a b b")));
			assertFalse(anbn.contains(word("b a")));
		}

		@Test
		public void testUnknownTerminal(){
			assertFalse(anbn.contains(word("a x b")));
		}

		@Test
		public void testEpsilonInWordIsIgnored(){
			assertTrue(anbn.contains(Arrays.asList("a", "$", "b")));
		}

		@Test
		public void testParseTree(){
			ParseTree tree = anbn.getCnfParseTree(word("a a b b"));
			assertEquals(CFG.toTerminals(word("a a b b")), tree.getYield());
			assertEquals(anbn.getStartSymbol(), tree.value);
		}

		@Test
		public void testMissingDerivation(){
			assertThrows(DerivationNotFoundException.class, () -> anbn.getCnfParseTree(word("a b b")));
		}

		@Test
		public void testIsEmpty(){
			assertFalse(anbn.isEmpty());
			assertTrue(CFG.fromText("S -> S a").isEmpty());
			assertTrue(new CFG().isEmpty());
		}

		@Test
		public void testIsFinite(){
			assertFalse(anbn.isFinite());
			assertTrue(CFG.fromText("S -> A B\nA -> a | b\nB -> c").isFinite());
			assertTrue(CFG.fromText("S -> a | S\nS -> X\nX -> X x").isFinite());
			assertFalse(CFG.fromText("S -> a A\nA -> b B | b\nB -> c A").isFinite());
		}
	}

	@Nested
	public class ClosureOperations {

		final CFG a = CFG.fromText("S -> a");
		final CFG b = CFG.fromText("S -> b");

		@Test
		public void testUnion(){
			CFG union = a.union(b);
			assertTrue(union.contains(word("a")));
			assertTrue(union.contains(word("b")));
			assertFalse(union.contains(word("a b")));
		}

		@Test
		public void testConcatenate(){
			CFG concatenation = a.concatenate(b);
			assertTrue(concatenation.contains(word("a b")));
			assertFalse(concatenation.contains(word("a")));
			assertFalse(concatenation.contains(word("b a")));
		}

		@Test
		public void testClosure(){
			CFG closure = a.getClosure();
			assertTrue(closure.contains(Collections.emptyList()));
			assertTrue(closure.contains(word("a a a")));
			assertFalse(closure.contains(word("a b")));
		}

		@Test
		public void testPositiveClosure(){
			CFG closure = a.getPositiveClosure();
			assertFalse(closure.contains(Collections.emptyList()));
			assertTrue(closure.contains(word("a")));
			assertTrue(closure.contains(word("a a a")));
		}

		@Test
		public void testReverse(){
			CFG reversed = CFG.fromText("S -> a S b b | $").reverse();
			assertTrue(reversed.contains(word("b b a")));
			assertFalse(reversed.contains(word("a b b")));
		}

		@Test
		public void testSubstitute(){
			CFG substituted = anbn.substitute(Collections.singletonMap(t("a"), CFG.fromText("S -> c d")));
			assertTrue(substituted.contains(word("c d b")));
			assertFalse(substituted.contains(word("a b")));
		}

		@Nested
		public class EmptyOperand {

			final CFG empty = anbn.intersection(new DeterministicFiniteAutomaton());

			@Test
			public void testUnion(){
				CFG union = empty.union(anbn);
				assertTrue(union.contains(word("a b")));
				assertFalse(union.contains(word("#0UNION#")));
				assertTrue(new CFG().union(new CFG()).isEmpty());
			}

			@Test
			public void testConcatenate(){
				assertTrue(empty.concatenate(anbn).isEmpty());
				assertTrue(anbn.concatenate(empty).isEmpty());
				assertFalse(empty.concatenate(anbn).contains(word("#0CONC# a b")));
			}

			@Test
			public void testClosure(){
				CFG closure = empty.getClosure();
				assertTrue(closure.contains(Collections.emptyList()));
				assertFalse(closure.contains(word("#1CLOS#")));
			}

			@Test
			public void testPositiveClosure(){
				assertTrue(empty.getPositiveClosure().isEmpty());
			}

			@Test
			public void testSubstitute(){
				CFG substituted = anbn.substitute(Collections.singletonMap(t("a"), new CFG()));
				assertTrue(substituted.contains(Collections.emptyList()));
				assertFalse(substituted.contains(word("a b")));
			}
		}
	}

	@Nested
	public class Intersection {

		@Test
		public void testWithRegex(){
			CFG cfg = CFG.fromText("S -> a S a | b");
			CFG intersection = cfg.intersection(new Regex("a* b a*"));
			assertTrue(intersection.contains(word("a b a")));
			assertTrue(intersection.contains(word("b")));
			assertFalse(intersection.contains(word("a a")));
			assertFalse(intersection.contains(word("a b")));
		}

		@Test
		public void testRestricts(){
			CFG intersection = anbn.intersection(new Regex("a a b b | a b b"));
			assertTrue(intersection.contains(word("a a b b")));
			assertFalse(intersection.contains(word("a b")));
			assertFalse(intersection.contains(Collections.emptyList()));
		}

		@Test
		public void testEpsilon(){
			assertTrue(anbn.intersection(new Regex("(a b)*")).contains(Collections.emptyList()));
		}

		@Test
		public void testWithEmptyAutomaton(){
			assertTrue(anbn.intersection(new DeterministicFiniteAutomaton()).isEmpty());
		}

		@Test
		public void testUnsupportedOperand(){
			assertThrows(UnsupportedOperationException.class, () -> anbn.intersection("a b"));
		}
	}

	@Nested
	public class Words {

		@Test
		public void testShortestFirst(){
			List<List<Terminal>> words = new ArrayList<>();
			anbn.getWords(6).forEach(words::add);
			assertEquals(4, words.size());
			assertEquals(Collections.emptyList(), words.get(0));
			assertEquals(CFG.toTerminals(word("a b")), words.get(1));
			assertEquals(CFG.toTerminals(word("a a a b b b")), words.get(3));
		}

		@Test
		public void testFiniteLanguageEnds(){
			CFG cfg = CFG.fromText("S -> A B\nA -> a | b\nB -> c");
			Set<List<Terminal>> words = new HashSet<>();
			cfg.getWords().forEach(words::add);
			assertEquals(set(CFG.toTerminals(word("a c")), CFG.toTerminals(word("b c"))), words);
		}
	}
}

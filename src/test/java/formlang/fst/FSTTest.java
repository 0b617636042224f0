package formlang.fst;

import java.util.*;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import formlang.automata.InputSymbol;
import formlang.automata.State;
import formlang.grammar.Terminal;
import formlang.indexed.IndexedGrammar;
import formlang.indexed.IndexedGrammarTest;
import formlang.indexed.Rules;

import static formlang.util.Utils.set;
import static org.junit.jupiter.api.Assertions.*;

public class FSTTest {

	static List<InputSymbol> out(String... symbols){
		List<InputSymbol> ret = new ArrayList<>();
		for (String symbol : symbols){
			ret.add(InputSymbol.of(symbol));
		}
		return ret;
	}

	/**
	 * Translates a b* into x y z*
	 */
	static FST translator(){
		FST fst = new FST();
		fst.addTransition(0, "a", 1, Arrays.asList("x", "y"));
		fst.addTransition(1, "b", 1, Collections.singletonList("z"));
		fst.addStartState(new State(0));
		fst.addFinalState(new State(1));
		return fst;
	}

	static FST single(String input, String output){
		FST fst = new FST();
		fst.addTransition(0, input, 1, Collections.singletonList(output));
		fst.addStartState(new State(0));
		fst.addFinalState(new State(1));
		return fst;
	}

	@Nested
	public class Translation {

		@Test
		public void testTranslate(){
			FST fst = translator();
			assertEquals(set(out("x", "y", "z", "z")), fst.translate(Arrays.asList("a", "b", "b")));
			assertEquals(set(out("x", "y")), fst.translate(Collections.singletonList("a")));
			assertTrue(fst.translate(Collections.singletonList("b")).isEmpty());
		}

		@Test
		public void testEpsilonOutputIsDropped(){
			FST fst = new FST();
			fst.addTransition(0, "a", 0, Arrays.asList("$", "x"));
			fst.addStartState(new State(0));
			fst.addFinalState(new State(0));
			assertEquals(set(out("x")), fst.translate(Collections.singletonList("a")));
			assertEquals(set(InputSymbol.of("x")), fst.getOutputSymbols());
		}

		@Test
		public void testEpsilonCycleIsBounded(){
			FST fst = new FST();
			fst.addTransition(0, "epsilon", 0, Collections.singletonList("x"));
			fst.addStartState(new State(0));
			fst.addFinalState(new State(0));
			assertEquals(set(out(), out("x"), out("x", "x")), fst.translate(Collections.emptyList(), 2));
			assertTrue(fst.getInputSymbols().isEmpty());
		}

		@Test
		public void testNonDeterministic(){
			FST fst = new FST();
			fst.addTransition(0, "a", 1, Collections.singletonList("x"));
			fst.addTransition(0, "a", 1, Collections.singletonList("y"));
			fst.addStartState(new State(0));
			fst.addFinalState(new State(1));
			assertEquals(set(out("x"), out("y")), fst.translate(Collections.singletonList("a")));
			assertEquals(2, fst.getNumberOfTransitions());
		}
	}

	@Nested
	public class Operations {

		@Test
		public void testUnion(){
			FST union = single("a", "x").union(single("b", "y"));
			assertEquals(4, union.getStates().size());
			assertEquals(set(out("x")), union.translate(Collections.singletonList("a")));
			assertEquals(set(out("y")), union.translate(Collections.singletonList("b")));
			assertTrue(union.translate(Arrays.asList("a", "b")).isEmpty());
		}

		@Test
		public void testConcatenate(){
			FST concatenation = single("a", "x").concatenate(single("b", "y"));
			assertEquals(set(out("x", "y")), concatenation.translate(Arrays.asList("a", "b")));
			assertTrue(concatenation.translate(Collections.singletonList("a")).isEmpty());
			assertEquals(1, concatenation.getStartStates().size());
			assertEquals(1, concatenation.getFinalStates().size());
		}

		@Test
		public void testKleeneStar(){
			FST star = single("a", "x").kleeneStar();
			assertEquals(set(out()), star.translate(Collections.emptyList()));
			assertEquals(set(out("x", "x", "x")), star.translate(Arrays.asList("a", "a", "a")));
			assertTrue(star.translate(Collections.singletonList("b")).isEmpty());
		}

		@Test
		public void testStateRenaming(){
			StateRenaming renaming = new StateRenaming();
			renaming.addState(new State("q"), 0);
			renaming.addState(new State("q"), 1);
			assertEquals(new State("q"), renaming.getRenamedState(new State("q"), 0));
			assertEquals(new State("q0"), renaming.getRenamedState(new State("q"), 1));
			assertThrows(NoSuchElementException.class, () -> renaming.getRenamedState(new State("q"), 2));
		}

		@Test
		public void testToDot(){
			String dot = translator().toDot();
			assertTrue(dot.contains("a:x y"), dot);
		}
	}

	@Nested
	public class Intersection {

		private IndexedGrammar ab(){
			return new IndexedGrammar(new Rules(IndexedGrammarTest.abRules()));
		}

		@Test
		public void testTranslatedLanguage(){
			FST fst = new FST();
			fst.addTransition(0, "a", 1, Collections.singletonList("x"));
			fst.addTransition(1, "b", 2, Arrays.asList("y", "z"));
			fst.addStartState(new State(0));
			fst.addFinalState(new State(2));
			IndexedGrammar translated = fst.intersection(ab());
			assertFalse(translated.isEmpty());
			assertEquals(set(new Terminal("x"), new Terminal("y"),
					new Terminal("z")), filterOutputs(translated));
		}

		@Test
		public void testNoMatchingRun(){
			FST fst = new FST();
			fst.addTransition(0, "b", 1, Collections.singletonList("x"));
			fst.addTransition(1, "a", 2, Collections.singletonList("y"));
			fst.addStartState(new State(0));
			fst.addFinalState(new State(2));
			assertTrue(fst.intersection(ab()).isEmpty());
		}

		@Test
		public void testErasingTransducer(){
			FST fst = new FST();
			fst.addTransition(0, "a", 0, Collections.emptyList());
			fst.addTransition(0, "b", 0, Collections.emptyList());
			fst.addStartState(new State(0));
			fst.addFinalState(new State(0));
			assertFalse(fst.intersection(ab()).isEmpty());
		}

		private Set<Terminal> filterOutputs(IndexedGrammar grammar){
			Set<Terminal> ret = new HashSet<>(grammar.getTerminals());
			ret.remove(new Terminal("f"));
			return ret;
		}
	}
}

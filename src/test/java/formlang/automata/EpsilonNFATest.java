package formlang.automata;

import java.util.*;

import org.junit.jupiter.api.Test;

import formlang.fst.FST;

import static formlang.util.Utils.set;
import static org.junit.jupiter.api.Assertions.*;

public class EpsilonNFATest {

	/**
	 * Words over {a, b} that end with "a b"
	 */
	private EpsilonNFA endsWithAB(){
		EpsilonNFA nfa = new EpsilonNFA();
		nfa.addTransition(0, "a", 0);
		nfa.addTransition(0, "b", 0);
		nfa.addTransition(0, "$", 1);
		nfa.addTransition(1, "a", 2);
		nfa.addTransition(2, "b", 3);
		nfa.addStartState(new State(0));
		nfa.addFinalState(new State(3));
		return nfa;
	}

	@Test
	public void testAccepts(){
		EpsilonNFA nfa = endsWithAB();
		assertTrue(nfa.accepts(Arrays.asList("a", "b")));
		assertTrue(nfa.accepts(Arrays.asList("b", "b", "a", "b")));
		assertFalse(nfa.accepts(Arrays.asList("b", "a")));
		assertFalse(nfa.accepts(Collections.emptyList()));
		assertFalse(nfa.isDeterministic());
	}

	@Test
	public void testEpsilonClosure(){
		assertEquals(set(new State(0), new State(1)), endsWithAB().getEpsilonClosure(new State(0)));
	}

	@Test
	public void testEpsilonIsNoInputSymbol(){
		assertEquals(set(InputSymbol.of("a"), InputSymbol.of("b")), endsWithAB().getInputSymbols());
	}

	@Test
	public void testToDeterministic(){
		EpsilonNFA nfa = endsWithAB();
		DeterministicFiniteAutomaton dfa = nfa.toDeterministic();
		assertTrue(dfa.isDeterministic());
		for (List<String> word : Arrays.asList(Arrays.asList("a", "b"), Arrays.asList("a", "b", "a"),
				Arrays.asList("a", "a", "b"), Collections.<String>emptyList())){
			assertEquals(nfa.accepts(word), dfa.accepts(word), word.toString());
		}
		assertTrue(dfa.isEquivalentTo(nfa));
	}

	@Test
	public void testMinimize(){
		DeterministicFiniteAutomaton minimal = endsWithAB().minimize();
		assertEquals(3, minimal.getStates().size());
		assertTrue(minimal.isEquivalentTo(new Regex("(a | b)* a b").toEpsilonNfa()));
	}

	@Test
	public void testNotEquivalent(){
		assertFalse(endsWithAB().isEquivalentTo(new Regex("(a | b)* b").toEpsilonNfa()));
	}

	@Test
	public void testToFst(){
		FST fst = endsWithAB().toFst();
		assertEquals(set(Arrays.asList(InputSymbol.of("a"), InputSymbol.of("b"))),
				fst.translate(Arrays.asList("a", "b")));
		assertTrue(fst.translate(Arrays.asList("b", "a")).isEmpty());
	}

	@Test
	public void testToDot(){
		String dot = endsWithAB().toDot();
		assertTrue(dot.contains("EpsilonNFA"), dot);
	}
}

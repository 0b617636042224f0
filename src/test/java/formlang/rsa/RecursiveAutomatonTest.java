package formlang.rsa;

import java.util.*;

import org.junit.jupiter.api.Test;

import formlang.automata.Regex;
import formlang.grammar.GrammarFormatException;
import formlang.grammar.Variable;

import static org.junit.jupiter.api.Assertions.*;

public class RecursiveAutomatonTest {

	@Test
	public void testFromEbnf(){
		RecursiveAutomaton rsa = RecursiveAutomaton.fromEbnf("S -> a S b | $\nA -> a* B\nB -> b");
		assertEquals(3, rsa.getNumberOfBoxes());
		assertEquals(new Variable("S"), rsa.getStartNonTerminal());
		assertTrue(rsa.getStartBox().automaton.accepts(Arrays.asList("a", "S", "b")));
		assertTrue(rsa.getStartBox().automaton.accepts(Collections.emptyList()));
		assertTrue(rsa.getBox(new Variable("A")).automaton.accepts(Arrays.asList("a", "a", "B")));
		assertNull(rsa.getBox(new Variable("C")));
	}

	@Test
	public void testRepeatedHeadsAreAlternatives(){
		RecursiveAutomaton rsa = RecursiveAutomaton.fromEbnf("S -> a\nS -> b\nS ->");
		Box box = rsa.getStartBox();
		assertTrue(box.automaton.accepts(Collections.singletonList("a")));
		assertTrue(box.automaton.accepts(Collections.singletonList("b")));
		assertTrue(box.automaton.accepts(Collections.emptyList()));
		assertEquals(1, rsa.getNumberOfBoxes());
	}

	@Test
	public void testSkipsLinesWithoutArrow(){
		RecursiveAutomaton rsa = RecursiveAutomaton.fromEbnf("S -> a\n\nnot a production");
		assertEquals(1, rsa.getNumberOfBoxes());
	}

	@Test
	public void testOtherStart(){
		RecursiveAutomaton rsa = RecursiveAutomaton.fromEbnf("S -> a B\nB -> b", new Variable("B"));
		assertEquals(new Variable("B"), rsa.getStartNonTerminal());
		assertEquals(2, rsa.getNumberOfBoxes());
	}

	@Test
	public void testMissingStart(){
		assertThrows(GrammarFormatException.class, () -> RecursiveAutomaton.fromEbnf("A -> a"));
	}

	@Test
	public void testFromRegex(){
		RecursiveAutomaton rsa = RecursiveAutomaton.fromRegex(new Regex("a* b"), new Variable("S"));
		assertEquals(1, rsa.getNumberOfBoxes());
		assertTrue(rsa.getStartBox().automaton.accepts(Arrays.asList("a", "a", "b")));
		assertEquals(rsa, RecursiveAutomaton.fromEbnf("S -> a* b"));
		assertNotEquals(rsa, RecursiveAutomaton.fromEbnf("S -> a b*"));
	}

	@Test
	public void testBoxEquivalence(){
		Box first = new Box(new Regex("a a*").toEpsilonNfa(), new Variable("S"));
		Box second = new Box(new Regex("a* a").toEpsilonNfa(), new Variable("S"));
		Box other = new Box(new Regex("a a*").toEpsilonNfa(), new Variable("T"));
		assertTrue(first.isEquivalentTo(second));
		assertEquals(first, second);
		assertFalse(first.isEquivalentTo(other));
	}

	@Test
	public void testStartBoxReplacesBox(){
		Box start = new Box(new Regex("a").toEpsilonNfa(), new Variable("S"));
		Box replaced = new Box(new Regex("b").toEpsilonNfa(), new Variable("S"));
		RecursiveAutomaton rsa = new RecursiveAutomaton(start, Arrays.asList(replaced,
				new Box(new Regex("c").toEpsilonNfa(), new Variable("C"))));
		assertSame(start, rsa.getStartBox());
		assertEquals(2, rsa.getNumberOfBoxes());
	}

	@Test
	public void testToDot(){
		String dot = RecursiveAutomaton.fromEbnf("S -> a S b | $\nA -> a").toDot();
		assertTrue(dot.contains("cluster_0"), dot);
		assertTrue(dot.contains("cluster_1"), dot);
	}
}

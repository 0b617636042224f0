package formlang.parser.ll;

import java.util.*;

import org.junit.jupiter.api.Test;

import formlang.grammar.*;

import static formlang.util.Utils.set;
import static org.junit.jupiter.api.Assertions.*;

public class LLOneParserTest {

	private static final CFG expressions = CFG.fromText(
			"E -> T Ep\n" +
			"Ep -> + T Ep | $\n" +
			"T -> F Tp\n" +
			"Tp -> * F Tp | $\n" +
			"F -> ( E ) | id", new Variable("E"));

	static List<String> word(String text){
		return Arrays.asList(text.split(" "));
	}

	static Variable v(String name){
		return new Variable(name);
	}

	static Terminal t(String name){
		return new Terminal(name);
	}

	@Test
	public void testFirstSet(){
		Map<Symbol, Set<Terminal>> first = new LLOneParser(expressions).getFirstSet();
		assertEquals(set(t("("), t("id")), first.get(v("E")));
		assertEquals(set(t("("), t("id")), first.get(v("F")));
		assertEquals(set(t("+"), Epsilon.get()), first.get(v("Ep")));
		assertEquals(set(t("*"), Epsilon.get()), first.get(v("Tp")));
		assertEquals(set(t("id")), first.get(t("id")));
	}

	@Test
	public void testFollowSet(){
		Map<Symbol, Set<Terminal>> follow = new LLOneParser(expressions).getFollowSet();
		assertEquals(set(t(")"), LLOneParser.END_MARKER), follow.get(v("E")));
		assertEquals(set(t(")"), LLOneParser.END_MARKER), follow.get(v("Ep")));
		assertEquals(set(t("+"), t(")"), LLOneParser.END_MARKER), follow.get(v("T")));
		assertEquals(set(t("+"), t("*"), t(")"), LLOneParser.END_MARKER), follow.get(v("F")));
	}

	@Test
	public void testParsingTable(){
		LLOneParser parser = new LLOneParser(expressions);
		Map<Variable, Map<Terminal, List<Production>>> table = parser.getParsingTable();
		assertEquals(Collections.singletonList(new Production(v("Ep"), Collections.emptyList())),
				table.get(v("Ep")).get(t(")")));
		assertEquals(Collections.singletonList(new Production(v("F"), Collections.singletonList(t("id")))),
				table.get(v("F")).get(t("id")));
		assertNull(table.get(v("F")).get(t("+")));
		assertTrue(parser.isLLOneParsable());
	}

	@Test
	public void testParseTree(){
		ParseTree tree = new LLOneParser(expressions).getParseTree(word("id + id * id"));
		assertEquals(CFG.toTerminals(word("id + id * id")), tree.getYield());
		List<List<Symbol>> derivation = tree.getLeftmostDerivation();
		assertEquals(Collections.singletonList(v("E")), derivation.get(0));
		assertEquals(Arrays.asList(v("T"), v("Ep")), derivation.get(1));
		assertEquals(Arrays.asList(v("F"), v("Tp"), v("Ep")), derivation.get(2));
		assertEquals(Arrays.asList(t("id"), v("Tp"), v("Ep")), derivation.get(3));
		assertEquals(Arrays.asList(t("id"), v("Ep")), derivation.get(4));
	}

	@Test
	public void testEpsilonSon(){
		ParseTree tree = new LLOneParser(expressions).getParseTree(word("id"));
		ParseTree ep = tree.getSons().get(1);
		assertEquals(v("Ep"), ep.value);
		assertEquals(1, ep.getSons().size());
		assertEquals(Epsilon.get(), ep.getSons().get(0).value);
	}

	@Test
	public void testRejects(){
		LLOneParser parser = new LLOneParser(expressions);
		assertThrows(NotParsableException.class, () -> parser.getParseTree(word("id +")));
		assertThrows(NotParsableException.class, () -> parser.getParseTree(word("id id")));
		assertThrows(NotParsableException.class, () -> parser.getParseTree(word("( id")));
	}

	@Test
	public void testConflict(){
		LLOneParser parser = new LLOneParser(CFG.fromText("S -> a S | a"));
		assertFalse(parser.isLLOneParsable());
		assertThrows(NotParsableException.class, () -> parser.getParseTree(word("a a")));
	}
}

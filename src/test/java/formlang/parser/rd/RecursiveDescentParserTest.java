package formlang.parser.rd;

import java.util.*;

import org.junit.jupiter.api.Test;

import formlang.grammar.*;

import static org.junit.jupiter.api.Assertions.*;

public class RecursiveDescentParserTest {

	private static final CFG arithmetic = CFG.fromText(
			"E -> S + S\n" +
			"E -> S * S\n" +
			"S -> ( E )\n" +
			"S -> int");

	private static final List<String> nested = Arrays.asList("(", "int", "+", "(", "int", "*", "int", ")", ")");

	static Variable v(String name){
		return new Variable(name);
	}

	static Terminal t(String name){
		return new Terminal(name);
	}

	@Test
	public void testParsable(){
		RecursiveDescentParser parser = new RecursiveDescentParser(arithmetic);
		assertTrue(parser.isParsable(nested));
		assertTrue(parser.isParsable(nested, false));
		assertFalse(parser.isParsable(Collections.singletonList(")")));
		assertFalse(parser.isParsable(Arrays.asList("int", "+")));
	}

	@Test
	public void testLeftmostDerivation(){
		ParseTree tree = new RecursiveDescentParser(arithmetic).getParseTree(nested);
		List<List<Symbol>> derivation = tree.getLeftmostDerivation();
		assertEquals(Collections.singletonList(v("S")), derivation.get(0));
		assertEquals(Arrays.asList(t("("), v("E"), t(")")), derivation.get(1));
		assertEquals(Arrays.asList(t("("), v("S"), t("+"), v("S"), t(")")), derivation.get(2));
		assertEquals(CFG.toTerminals(nested), tree.getYield());
	}

	@Test
	public void testRightFirstGivesSameTree(){
		RecursiveDescentParser parser = new RecursiveDescentParser(arithmetic);
		assertEquals(parser.getParseTree(nested, true).toString(), parser.getParseTree(nested, false).toString());
	}

	@Test
	public void testNotParsable(){
		RecursiveDescentParser parser = new RecursiveDescentParser(arithmetic);
		assertThrows(NotParsableException.class, () -> parser.getParseTree(Collections.singletonList(")")));
	}

	@Test
	public void testEpsilonProduction(){
		RecursiveDescentParser parser = new RecursiveDescentParser(CFG.fromText("S -> a S b | $"));
		assertTrue(parser.isParsable(Collections.emptyList()));
		ParseTree tree = parser.getParseTree(Arrays.asList("a", "b"));
		ParseTree inner = tree.getSons().get(1);
		assertEquals(Epsilon.get(), inner.getSons().get(0).value);
		assertFalse(parser.isParsable(Arrays.asList("a", "b", "b")));
	}

	@Test
	public void testLeftRecursion(){
		RecursiveDescentParser parser = new RecursiveDescentParser(CFG.fromText("S -> S E"), 50);
		assertThrows(RecursionLimitException.class, () -> parser.isParsable(Collections.singletonList("a")));
		assertFalse(parser.isParsable(Collections.singletonList("a"), false));
	}

	@Test
	public void testEmptyGrammar(){
		assertThrows(NotParsableException.class, () -> new RecursiveDescentParser(new CFG()).getParseTree(Collections.emptyList()));
	}
}

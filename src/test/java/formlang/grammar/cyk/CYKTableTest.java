package formlang.grammar.cyk;

import java.util.*;

import org.junit.jupiter.api.Test;

import formlang.grammar.*;

import static formlang.util.Utils.set;
import static org.junit.jupiter.api.Assertions.*;

public class CYKTableTest {

	private final CFG cfg = CFG.fromText("S -> A B | B C\nA -> B A | a\nB -> C C | b\nC -> A B | a");

	private CYKTable table(String word){
		return new CYKTable(cfg, CFG.toTerminals(Arrays.asList(word.split(" "))));
	}

	@Test
	public void testTextbookExample(){
		CYKTable table = table("b a a b a");
		assertTrue(table.generatesWord());
		assertEquals(set(new Variable("B")), table.getCell(0, 1));
		assertEquals(set(new Variable("A"), new Variable("C")), table.getCell(1, 2));
		assertEquals(set(new Variable("S"), new Variable("A")), table.getCell(0, 2));
		assertTrue(table.getCell(0, 5).contains(new Variable("S")));
	}

	@Test
	public void testRejected(){
		assertFalse(table("a b b").generatesWord());
	}

	@Test
	public void testUnknownTerminal(){
		CYKTable table = table("b c");
		assertFalse(table.generatesWord());
		assertThrows(DerivationNotFoundException.class, table::getParseTree);
	}

	@Test
	public void testParseTree(){
		ParseTree tree = table("b a a b a").getParseTree();
		assertEquals(new Variable("S"), tree.value);
		assertEquals(CFG.toTerminals(Arrays.asList("b", "a", "a", "b", "a")), tree.getYield());
		for (ParseTree son : tree.getSons()){
			assertTrue(son instanceof CYKNode);
		}
		assertEquals(2, tree.getSons().size());
	}

	@Test
	public void testEmptyWord(){
		CYKTable table = new CYKTable(cfg, Collections.emptyList());
		assertFalse(table.generatesWord());
		assertEquals(new Variable("S"), table.getParseTree().value);
		assertTrue(table.getParseTree().isLeaf());
	}

	@Test
	public void testNodeEquality(){
		CYKNode first = new CYKNode(new Variable("A"), new CYKNode(new Terminal("a")), null);
		CYKNode second = new CYKNode(new Variable("A"));
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertNotEquals(first, new CYKNode(new Variable("B")));
	}
}

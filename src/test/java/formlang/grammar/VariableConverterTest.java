package formlang.grammar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VariableConverterTest {

	@Test
	public void testSameTripleSameVariable(){
		VariableConverter<Integer, String> converter = new VariableConverter<>();
		Variable first = converter.toCombinedVariable(0, "A", 1);
		assertSame(first, converter.toCombinedVariable(0, "A", 1));
		assertEquals(1, converter.getNumberOfVariables());
	}

	@Test
	public void testDistinctTriples(){
		VariableConverter<Integer, String> converter = new VariableConverter<>();
		Variable first = converter.toCombinedVariable(0, "A", 1);
		assertNotEquals(first, converter.toCombinedVariable(1, "A", 0));
		assertNotEquals(first, converter.toCombinedVariable(0, "B", 1));
		assertEquals(3, converter.getNumberOfVariables());
	}

	@Test
	public void testValidity(){
		VariableConverter<Integer, String> converter = new VariableConverter<>();
		Variable variable = converter.toCombinedVariable(0, "A", 1);
		assertNull(converter.isValidAndGet(0, "A", 1));
		assertNull(converter.isValidAndGet(2, "A", 2));
		converter.setValid(0, "A", 1);
		assertSame(variable, converter.isValidAndGet(0, "A", 1));
		converter.setValid(2, "A", 2);
		assertNotNull(converter.isValidAndGet(2, "A", 2));
	}
}

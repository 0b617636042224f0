package formlang.util;

import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SetQueueTest {

	@Test
	public void testFirstInFirstOut(){
		SetQueue<String> queue = new SetQueue<>();
		queue.append("a");
		queue.append("b");
		queue.append("c");
		assertEquals("a", queue.pop());
		assertEquals("b", queue.pop());
		assertEquals("c", queue.pop());
		assertTrue(queue.isEmpty());
	}

	@Test
	public void testNoDuplicates(){
		SetQueue<String> queue = new SetQueue<>();
		assertTrue(queue.append("a"));
		assertFalse(queue.append("a"));
		assertEquals(1, queue.size());
		assertTrue(queue.contains("a"));
	}

	@Test
	public void testReappendAfterPop(){
		SetQueue<String> queue = new SetQueue<>();
		queue.append("a");
		queue.pop();
		assertFalse(queue.contains("a"));
		assertTrue(queue.append("a"));
	}

	@Test
	public void testPopEmpty(){
		assertThrows(NoSuchElementException.class, () -> new SetQueue<Integer>().pop());
	}
}

package formlang.util;

import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * A first in first out work list that never holds the same pending element twice.
 */
public class SetQueue<T> {

	private final LinkedHashSet<T> elements = new LinkedHashSet<>();

	/**
	 * Appends the element if it isn't already pending
	 *
	 * @return true if the element was added
	 */
	public boolean append(T element){
		return elements.add(element);
	}

	/**
	 * Removes the oldest pending element
	 *
	 * @throws java.util.NoSuchElementException if the queue is empty
	 */
	public T pop(){
		Iterator<T> iterator = elements.iterator();
		T element = iterator.next();
		iterator.remove();
		return element;
	}

	public boolean isEmpty(){
		return elements.isEmpty();
	}

	public int size(){
		return elements.size();
	}

	public boolean contains(T element){
		return elements.contains(element);
	}
}

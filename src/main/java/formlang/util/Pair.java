package formlang.util;

import java.io.Serializable;
import java.util.Objects;

/**
 * Simple implementation of an immutable pair
 */
public class Pair<T, V> implements Serializable {
	public final T first;

	public final V second;

	public Pair(T first, V second) {
		this.first = first;
		this.second = second;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(first) * 31 ^ Objects.hashCode(second);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Pair)){
			return false;
		}
		Pair<?, ?> pair = (Pair<?, ?>)obj;
		return Objects.equals(pair.first, this.first) && Objects.equals(pair.second, this.second);
	}

	@Override
	public String toString() {
		return String.format("(%s, %s)", first, second);
	}
}

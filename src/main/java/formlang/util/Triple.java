package formlang.util;

import java.io.Serializable;
import java.util.Objects;

/**
 * Simple implementation of an immutable triple
 */
public class Triple<T, R, S> implements Serializable {
	public final T first;
	public final R second;
	public final S third;

	public Triple(T first, R second, S third) {
		this.first = first;
		this.second = second;
		this.third = third;
	}

	public static <T, R, S> Triple<T, R, S> t(T first, R second, S third){
		return new Triple<>(first, second, third);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Triple<?, ?, ?> triple = (Triple<?, ?, ?>) o;
		return Objects.equals(first, triple.first) &&
				Objects.equals(second, triple.second) &&
				Objects.equals(third, triple.third);
	}

	@Override
	public int hashCode() {
		return Objects.hash(first, second, third);
	}

	@Override
	public String toString() {
		return String.format("(%s, %s, %s)", first, second, third);
	}
}

package formlang.util;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Class with utility methods...
 */
public class Utils {

	@SafeVarargs
	public static <T> Set<T> set(T... elements){
		return new LinkedHashSet<>(Arrays.asList(elements));
	}

	public static <T> String join(String joiner, Collection<T> objs){
		return objs.stream().map(Object::toString).collect(Collectors.joining(joiner));
	}

	/**
	 * Concatenates the passed lists into a new list
	 */
	@SafeVarargs
	public static <T> List<T> concat(List<? extends T>... lists){
		List<T> ret = new ArrayList<>();
		for (List<? extends T> list : lists){
			ret.addAll(list);
		}
		return ret;
	}

	/**
	 * Cartesian power of the passed elements, e.g. <code>product([a, b], 2)</code> yields
	 * <code>[a, a], [a, b], [b, a], [b, b]</code>.
	 */
	public static <T> List<List<T>> product(List<T> elements, int repeat){
		List<List<T>> ret = new ArrayList<>();
		ret.add(new ArrayList<>());
		for (int i = 0; i < repeat; i++){
			List<List<T>> next = new ArrayList<>();
			for (List<T> prefix : ret){
				for (T element : elements){
					List<T> extended = new ArrayList<>(prefix);
					extended.add(element);
					next.add(extended);
				}
			}
			ret = next;
		}
		return ret;
	}

	/**
	 * Escape the passed string so that it can be used inside a quoted graphviz label
	 */
	public static String toPrintableRepresentation(String str){
		return str.replace("\\", "\\\\").replace("\"", "'").replace("\n", "\\n");
	}
}

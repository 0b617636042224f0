package formlang.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The empty word
 */
public final class Epsilon extends Terminal {

	/**
	 * Texts that are read as epsilon
	 */
	public static final List<String> ALIASES = Collections.unmodifiableList(Arrays.asList("epsilon", "$", "ε", "ϵ", "Є"));

	private static final Epsilon instance = new Epsilon();

	private Epsilon() {
		super("epsilon");
	}

	public static Epsilon get(){
		return instance;
	}

	public static boolean isAlias(Object value){
		return value instanceof String && ALIASES.contains(value);
	}

	@Override
	public String toText() {
		return "epsilon";
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Epsilon;
	}

	@Override
	public int hashCode() {
		return 0;
	}

	private Object readResolve() {
		return instance;
	}
}

package formlang.grammar;

/**
 * A terminal of a grammar
 */
public class Terminal extends Symbol {

	public Terminal(Object value) {
		super(value);
	}

	/**
	 * Returns the passed object if it's already a terminal, epsilon for one of the epsilon aliases
	 * and wraps it otherwise
	 */
	public static Terminal of(Object value){
		if (value instanceof Terminal){
			return (Terminal)value;
		}
		if (Epsilon.isAlias(value)){
			return Epsilon.get();
		}
		return new Terminal(value);
	}

	@Override
	public String toText() {
		String text = value.toString();
		if (startsWithCapital(text)){
			return "\"TER:" + text + "\"";
		}
		return text;
	}
}

package formlang.grammar;

/**
 * A variable (non terminal) of a grammar
 */
public class Variable extends Symbol {

	public Variable(Object value) {
		super(value);
	}

	/**
	 * Returns the passed object if it's already a variable, or wraps it otherwise
	 */
	public static Variable of(Object value){
		if (value instanceof Variable){
			return (Variable)value;
		}
		return new Variable(value);
	}

	@Override
	public String toText() {
		String text = value.toString();
		if (!text.isEmpty() && !startsWithCapital(text)){
			return "\"VAR:" + text + "\"";
		}
		return text;
	}
}

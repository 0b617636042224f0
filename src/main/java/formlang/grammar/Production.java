package formlang.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A grammar production with a head and an ordered body.
 */
public class Production implements Serializable {

	/**
	 * Left hand side of the production
	 */
	public final Variable head;
	/**
	 * Right hand side of the production, empty for epsilon productions
	 */
	public final List<Symbol> body;

	/**
	 * Creates a production and drops all epsilons from the body
	 */
	public Production(Variable head, List<? extends Symbol> body) {
		this(head, body, true);
	}

	/**
	 * @param filtering drop epsilons from the body? Only turn it off for bodies that are known to be clean.
	 */
	public Production(Variable head, List<? extends Symbol> body, boolean filtering) {
		this.head = head;
		List<Symbol> b = new ArrayList<>();
		for (Symbol symbol : body){
			if (!filtering || !(symbol instanceof Epsilon)){
				b.add(symbol);
			}
		}
		this.body = Collections.unmodifiableList(b);
	}

	/**
	 * Is the production of the form <code>A → a</code> or <code>A → B C</code>?
	 */
	public boolean isNormalForm(){
		if (body.size() == 1){
			return body.get(0) instanceof Terminal && !(body.get(0) instanceof Epsilon);
		}
		return body.size() == 2 && body.get(0).isVariable() && body.get(1).isVariable();
	}

	public String formatBody(){
		return body.stream().map(Symbol::toText).collect(Collectors.joining(" "));
	}

	@Override
	public String toString() {
		return head.toText() + " -> " + formatBody();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return head.equals(other.head) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return head.hashCode() * 31 + body.hashCode();
	}
}

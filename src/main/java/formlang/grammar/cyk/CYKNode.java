package formlang.grammar.cyk;

import java.util.Objects;

import formlang.grammar.ParseTree;
import formlang.grammar.Symbol;

/**
 * Entry of a CYK table cell. Two nodes are equal if they carry the same symbol,
 * regardless of the derivation below them.
 */
public class CYKNode extends ParseTree {

	public final CYKNode leftSon;

	public final CYKNode rightSon;

	public CYKNode(Symbol value) {
		this(value, null, null);
	}

	public CYKNode(Symbol value, CYKNode leftSon, CYKNode rightSon) {
		super(value);
		this.leftSon = leftSon;
		this.rightSon = rightSon;
		if (leftSon != null){
			addSon(leftSon);
		}
		if (rightSon != null){
			addSon(rightSon);
		}
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof CYKNode && ((CYKNode)obj).value.equals(value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}
}

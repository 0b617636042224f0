package formlang.grammar;

import java.util.List;

import formlang.FormlangException;

/**
 * Thrown if a parse tree is requested for a word that the grammar doesn't generate
 */
public class DerivationNotFoundException extends FormlangException {

	public final List<Terminal> word;

	public DerivationNotFoundException(List<Terminal> word) {
		super(String.format("No derivation found for %s", word));
		this.word = word;
	}
}

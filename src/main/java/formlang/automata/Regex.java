package formlang.automata;

import java.util.*;

import formlang.grammar.CFG;
import formlang.grammar.Production;
import formlang.grammar.Terminal;
import formlang.grammar.Variable;

/**
 * Regular expression over symbols.
 *
 * Syntax: symbols are separated by whitespace or operators, <code>.</code> (or juxtaposition) concatenates,
 * <code>|</code> and <code>+</code> denote the union, <code>*</code> the Kleene star, <code>$</code>
 * and <code>epsilon</code> the empty word. Parentheses group, a backslash escapes an operator character.
 * Example: <code>(a b)* | c.d</code>
 */
public class Regex {

	/**
	 * Node of the syntax tree
	 */
	public static abstract class Node {

		/**
		 * Adds the Thompson construction of this node between the passed states
		 */
		abstract void addToNfa(EpsilonNFA nfa, State from, State to, int[] counter);

		/**
		 * Adds productions with the passed head that generate the language of this node
		 */
		abstract void addProductions(Variable head, List<Production> productions, int[] counter);
	}

	public static class SymbolNode extends Node {
		public final String symbol;

		public SymbolNode(String symbol) {
			this.symbol = symbol;
		}

		@Override
		void addToNfa(EpsilonNFA nfa, State from, State to, int[] counter) {
			nfa.addTransition(from, InputSymbol.of(symbol), to);
		}

		@Override
		void addProductions(Variable head, List<Production> productions, int[] counter) {
			productions.add(new Production(head, Collections.singletonList(new Terminal(symbol))));
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	public static class EpsilonNode extends Node {

		@Override
		void addToNfa(EpsilonNFA nfa, State from, State to, int[] counter) {
			nfa.addTransition(from, InputSymbol.EPSILON, to);
		}

		@Override
		void addProductions(Variable head, List<Production> productions, int[] counter) {
			productions.add(new Production(head, Collections.emptyList()));
		}

		@Override
		public String toString() {
			return "$";
		}
	}

	/**
	 * The empty language
	 */
	public static class EmptyNode extends Node {

		@Override
		void addToNfa(EpsilonNFA nfa, State from, State to, int[] counter) {
			nfa.states.add(from);
			nfa.states.add(to);
		}

		@Override
		void addProductions(Variable head, List<Production> productions, int[] counter) {
		}

		@Override
		public String toString() {
			return "()";
		}
	}

	public static class ConcatenationNode extends Node {
		public final Node left;
		public final Node right;

		public ConcatenationNode(Node left, Node right) {
			this.left = left;
			this.right = right;
		}

		@Override
		void addToNfa(EpsilonNFA nfa, State from, State to, int[] counter) {
			State middle = new State(counter[0]++);
			left.addToNfa(nfa, from, middle, counter);
			right.addToNfa(nfa, middle, to, counter);
		}

		@Override
		void addProductions(Variable head, List<Production> productions, int[] counter) {
			Variable leftHead = freshVariable(counter);
			Variable rightHead = freshVariable(counter);
			productions.add(new Production(head, Arrays.asList(leftHead, rightHead)));
			left.addProductions(leftHead, productions, counter);
			right.addProductions(rightHead, productions, counter);
		}

		@Override
		public String toString() {
			return "(" + left + "." + right + ")";
		}
	}

	public static class UnionNode extends Node {
		public final Node left;
		public final Node right;

		public UnionNode(Node left, Node right) {
			this.left = left;
			this.right = right;
		}

		@Override
		void addToNfa(EpsilonNFA nfa, State from, State to, int[] counter) {
			for (Node son : Arrays.asList(left, right)){
				State sonFrom = new State(counter[0]++);
				State sonTo = new State(counter[0]++);
				nfa.addTransition(from, InputSymbol.EPSILON, sonFrom);
				son.addToNfa(nfa, sonFrom, sonTo, counter);
				nfa.addTransition(sonTo, InputSymbol.EPSILON, to);
			}
		}

		@Override
		void addProductions(Variable head, List<Production> productions, int[] counter) {
			for (Node son : Arrays.asList(left, right)){
				Variable sonHead = freshVariable(counter);
				productions.add(new Production(head, Collections.singletonList(sonHead)));
				son.addProductions(sonHead, productions, counter);
			}
		}

		@Override
		public String toString() {
			return "(" + left + "|" + right + ")";
		}
	}

	public static class KleeneStarNode extends Node {
		public final Node son;

		public KleeneStarNode(Node son) {
			this.son = son;
		}

		@Override
		void addToNfa(EpsilonNFA nfa, State from, State to, int[] counter) {
			State sonFrom = new State(counter[0]++);
			State sonTo = new State(counter[0]++);
			nfa.addTransition(from, InputSymbol.EPSILON, sonFrom);
			nfa.addTransition(from, InputSymbol.EPSILON, to);
			son.addToNfa(nfa, sonFrom, sonTo, counter);
			nfa.addTransition(sonTo, InputSymbol.EPSILON, sonFrom);
			nfa.addTransition(sonTo, InputSymbol.EPSILON, to);
		}

		@Override
		void addProductions(Variable head, List<Production> productions, int[] counter) {
			Variable sonHead = freshVariable(counter);
			productions.add(new Production(head, Collections.emptyList()));
			productions.add(new Production(head, Arrays.asList(head, head)));
			productions.add(new Production(head, Collections.singletonList(sonHead)));
			son.addProductions(sonHead, productions, counter);
		}

		@Override
		public String toString() {
			return "(" + son + ")*";
		}
	}

	private static Variable freshVariable(int[] counter){
		return new Variable("#REGEX#" + counter[0]++);
	}

	private static final String OPERATORS = ".|+*()";

	public final String text;

	public final Node root;

	/**
	 * @throws MisformedRegexException if the text isn't a valid regular expression
	 */
	public Regex(String text) {
		this.text = text;
		Parser parser = new Parser(text, tokenize(text));
		this.root = parser.parse();
	}

	private static class Token {
		final String text;
		final boolean operator;

		Token(String text, boolean operator) {
			this.text = text;
			this.operator = operator;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * Splits the text into symbols and single character operators, escaped operators become symbols
	 */
	private static List<Token> tokenize(String text){
		List<Token> tokens = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		boolean escaped = false;
		boolean containsEscape = false;
		for (char c : text.toCharArray()){
			if (escaped){
				current.append(c);
				escaped = false;
			} else if (c == '\\'){
				escaped = true;
				containsEscape = true;
			} else if (Character.isWhitespace(c) || OPERATORS.indexOf(c) != -1){
				if (current.length() > 0){
					tokens.add(new Token(current.toString(), !containsEscape && isEpsilon(current.toString())));
					current.setLength(0);
					containsEscape = false;
				}
				if (!Character.isWhitespace(c)){
					tokens.add(new Token(String.valueOf(c), true));
				}
			} else {
				current.append(c);
			}
		}
		if (escaped){
			throw new MisformedRegexException("Dangling escape character.", text);
		}
		if (current.length() > 0){
			tokens.add(new Token(current.toString(), !containsEscape && isEpsilon(current.toString())));
		}
		return tokens;
	}

	private static boolean isEpsilon(String token){
		return token.equals("$") || token.equals("epsilon");
	}

	/**
	 * Recursive descent parser over the tokens, the epsilon symbols count as operators
	 */
	private static class Parser {

		private final String text;
		private final List<Token> tokens;
		private int position = 0;

		Parser(String text, List<Token> tokens) {
			this.text = text;
			this.tokens = tokens;
		}

		Node parse(){
			if (tokens.isEmpty()){
				return new EmptyNode();
			}
			Node node = parseUnion();
			if (position != tokens.size()){
				throw new MisformedRegexException(String.format("Unexpected \"%s\".", tokens.get(position)), text);
			}
			return node;
		}

		private boolean at(String operator){
			return position < tokens.size() && tokens.get(position).operator && tokens.get(position).text.equals(operator);
		}

		private Node parseUnion(){
			Node node = parseConcatenation();
			while (at("|") || at("+")){
				position++;
				node = new UnionNode(node, parseConcatenation());
			}
			return node;
		}

		private Node parseConcatenation(){
			Node node = parseStar();
			while (position < tokens.size() && !at("|") && !at("+") && !at(")") && !at("*")){
				if (at(".")){
					position++;
				}
				node = new ConcatenationNode(node, parseStar());
			}
			return node;
		}

		private Node parseStar(){
			Node node = parseAtom();
			while (at("*")){
				position++;
				node = new KleeneStarNode(node);
			}
			return node;
		}

		private Node parseAtom(){
			if (position >= tokens.size()){
				throw new MisformedRegexException("Unexpected end of the regular expression.", text);
			}
			Token token = tokens.get(position++);
			if (!token.operator){
				return new SymbolNode(token.text);
			}
			switch (token.text){
				case "(":
					if (at(")")){
						position++;
						return new EmptyNode();
					}
					Node inner = parseUnion();
					if (!at(")")){
						throw new MisformedRegexException("Missing closing parenthesis.", text);
					}
					position++;
					return inner;
				case "$":
				case "epsilon":
					return new EpsilonNode();
				default:
					throw new MisformedRegexException(String.format("Unexpected \"%s\".", token), text);
			}
		}
	}

	/**
	 * Thompson construction of an automaton that accepts the language of the expression
	 */
	public EpsilonNFA toEpsilonNfa(){
		EpsilonNFA nfa = new EpsilonNFA();
		int[] counter = {0};
		State start = new State(counter[0]++);
		State end = new State(counter[0]++);
		nfa.addStartState(start);
		nfa.addFinalState(end);
		root.addToNfa(nfa, start, end, counter);
		return nfa;
	}

	/**
	 * Grammar that generates the language of the expression
	 */
	public CFG toCfg(){
		List<Production> productions = new ArrayList<>();
		Variable start = new Variable("S");
		root.addProductions(start, productions, new int[]{0});
		return new CFG(start, productions);
	}

	public boolean accepts(List<?> word){
		return toEpsilonNfa().accepts(word);
	}

	@Override
	public String toString() {
		return root.toString();
	}
}

package formlang.rsa;

import java.util.*;
import java.util.logging.Logger;

import formlang.automata.Regex;
import formlang.grammar.GrammarFormatException;
import formlang.grammar.Variable;
import formlang.util.DotGraph;

/**
 * Recursive automaton: a box per variable, the transitions of a box might be labelled with the
 * variables of other boxes
 */
public class RecursiveAutomaton {

	private static final Logger LOG = Logger.getLogger(RecursiveAutomaton.class.getName());

	private final Map<Variable, Box> boxes = new LinkedHashMap<>();

	private final Variable startNonTerminal;

	/**
	 * The start box replaces a box for the same variable in the passed boxes
	 */
	public RecursiveAutomaton(Box startBox, Collection<Box> boxes) {
		for (Box box : boxes){
			this.boxes.put(box.nonTerminal, box);
		}
		this.boxes.put(startBox.nonTerminal, startBox);
		this.startNonTerminal = startBox.nonTerminal;
	}

	/**
	 * Recursive automaton with a single box for the minimized automaton of the expression
	 */
	public static RecursiveAutomaton fromRegex(Regex regex, Variable start){
		Box box = new Box(regex.toEpsilonNfa().minimize(), start);
		return new RecursiveAutomaton(box, Collections.singleton(box));
	}

	/**
	 * Reads lines of the form <code>head -&gt; regex</code>, the bodies of repeated heads are joined
	 * as alternatives and an empty body stands for epsilon. Lines without an arrow are skipped.
	 *
	 * @throws GrammarFormatException if there is no line for the start variable
	 * @throws formlang.automata.MisformedRegexException if a body isn't a valid regular expression
	 */
	public static RecursiveAutomaton fromEbnf(String text, Variable start){
		Map<String, String> bodies = new LinkedHashMap<>();
		String[] lines = text.split("\n");
		for (int i = 0; i < lines.length; i++){
			String line = lines[i].trim();
			if (!line.contains("->")){
				if (!line.isEmpty()){
					LOG.warning(String.format("Skipped line %d without an arrow: %s", i + 1, line));
				}
				continue;
			}
			String[] parts = line.split("->", 2);
			String head = parts[0].trim();
			String body = parts[1].trim();
			if (body.isEmpty()){
				body = "$";
			}
			bodies.merge(head, body, (a, b) -> a + " | " + b);
		}
		if (!bodies.containsKey(start.value.toString())){
			throw new GrammarFormatException(lines.length, String.format("No production for the start variable %s", start));
		}
		List<Box> boxes = new ArrayList<>();
		Box startBox = null;
		for (Map.Entry<String, String> entry : bodies.entrySet()){
			Variable head = new Variable(entry.getKey());
			Box box = new Box(new Regex(entry.getValue()).toEpsilonNfa().minimize(), head);
			if (head.equals(start)){
				startBox = box;
			}
			boxes.add(box);
		}
		return new RecursiveAutomaton(startBox, boxes);
	}

	public static RecursiveAutomaton fromEbnf(String text){
		return fromEbnf(text, new Variable("S"));
	}

	/**
	 * @return the box or null
	 */
	public Box getBox(Variable nonTerminal){
		return boxes.get(nonTerminal);
	}

	public int getNumberOfBoxes(){
		return boxes.size();
	}

	public Set<Variable> getNonTerminals(){
		return Collections.unmodifiableSet(boxes.keySet());
	}

	public Variable getStartNonTerminal() {
		return startNonTerminal;
	}

	public Box getStartBox(){
		return boxes.get(startNonTerminal);
	}

	/**
	 * Graphviz representation with a cluster per box
	 */
	public String toDot(){
		DotGraph graph = new DotGraph("RSA");
		for (Box box : boxes.values()){
			box.addTo(graph.cluster(box.nonTerminal.value.toString()));
		}
		return graph.toString();
	}

	/**
	 * Are the boxes equivalent?
	 */
	@Override
	public boolean equals(Object obj) {
		return obj instanceof RecursiveAutomaton && boxes.equals(((RecursiveAutomaton)obj).boxes);
	}

	@Override
	public int hashCode() {
		return boxes.keySet().hashCode();
	}
}

package formlang.pda;

import java.util.*;
import java.util.function.Function;
import java.util.logging.Logger;

import formlang.automata.DeterministicFiniteAutomaton;
import formlang.automata.InputSymbol;
import formlang.automata.State;
import formlang.grammar.*;
import formlang.util.DotGraph;
import formlang.util.Pair;
import formlang.util.Utils;

/**
 * Push down automaton.
 *
 * Depending on the construction it accepts by final state or by empty stack, {@link #toFinalState()}
 * and {@link #toEmptyStack()} convert between both. The conversion into a grammar assumes acceptance
 * by empty stack.
 */
public class PDA implements Iterable<Transition> {

	private static final Logger LOG = Logger.getLogger(PDA.class.getName());

	public static final String TERMINAL_PREFIX = "#TERM#";

	private final Set<State> states = new LinkedHashSet<>();

	private final Set<InputSymbol> inputSymbols = new LinkedHashSet<>();

	private final Set<StackSymbol> stackSymbols = new LinkedHashSet<>();

	private final TransitionFunction transitionFunction;

	private State startState;

	private StackSymbol startStackSymbol;

	private final Set<State> finalStates = new LinkedHashSet<>();

	public PDA() {
		this.transitionFunction = new TransitionFunction();
	}

	private PDA(Collection<State> states, Collection<InputSymbol> inputSymbols, Collection<StackSymbol> stackSymbols,
	            TransitionFunction transitionFunction, State startState, StackSymbol startStackSymbol,
	            Collection<State> finalStates) {
		this.transitionFunction = transitionFunction;
		this.states.addAll(states);
		this.inputSymbols.addAll(inputSymbols);
		this.stackSymbols.addAll(stackSymbols);
		if (startState != null){
			setStartState(startState);
		}
		if (startStackSymbol != null){
			setStartStackSymbol(startStackSymbol);
		}
		finalStates.forEach(this::addFinalState);
	}

	public Set<State> getStates() {
		return Collections.unmodifiableSet(states);
	}

	public Set<InputSymbol> getInputSymbols() {
		return Collections.unmodifiableSet(inputSymbols);
	}

	public Set<StackSymbol> getStackSymbols() {
		return Collections.unmodifiableSet(stackSymbols);
	}

	/**
	 * @return the start state or null
	 */
	public State getStartState() {
		return startState;
	}

	/**
	 * @return the start stack symbol or null
	 */
	public StackSymbol getStartStackSymbol() {
		return startStackSymbol;
	}

	public Set<State> getFinalStates() {
		return Collections.unmodifiableSet(finalStates);
	}

	public PDA setStartState(State state){
		states.add(state);
		startState = state;
		return this;
	}

	public PDA setStartStackSymbol(StackSymbol symbol){
		stackSymbols.add(symbol);
		startStackSymbol = symbol;
		return this;
	}

	public PDA addFinalState(State state){
		states.add(state);
		finalStates.add(state);
		return this;
	}

	/**
	 * Adds a transition, epsilons in the pushed word are dropped
	 *
	 * @return the added transition
	 */
	public Transition addTransition(State from, InputSymbol input, StackSymbol stackFrom, State to, List<StackSymbol> stackTo){
		Transition transition = createTransition(from, input, stackFrom, to, stackTo);
		states.add(from);
		states.add(to);
		if (!input.isEpsilon()){
			inputSymbols.add(input);
		}
		stackSymbols.add(stackFrom);
		stackSymbols.addAll(transition.stackTo);
		transitionFunction.add(transition);
		return transition;
	}

	public Transition addTransition(Object from, Object input, Object stackFrom, Object to, List<?> stackTo){
		return addTransition(State.of(from), InputSymbol.of(input), StackSymbol.of(stackFrom), State.of(to),
				toStackSymbols(stackTo));
	}

	/**
	 * @return true if the transition existed
	 */
	public boolean removeTransition(Object from, Object input, Object stackFrom, Object to, List<?> stackTo){
		return transitionFunction.remove(createTransition(State.of(from), InputSymbol.of(input), StackSymbol.of(stackFrom),
				State.of(to), toStackSymbols(stackTo)));
	}

	public boolean contains(Object from, Object input, Object stackFrom, Object to, List<?> stackTo){
		return transitionFunction.contains(createTransition(State.of(from), InputSymbol.of(input),
				StackSymbol.of(stackFrom), State.of(to), toStackSymbols(stackTo)));
	}

	/**
	 * Transitions applicable in the state with the input symbol and the stack symbol on top
	 */
	public Set<Transition> getTransitions(Object from, Object input, Object stackFrom){
		return transitionFunction.get(State.of(from), InputSymbol.of(input), StackSymbol.of(stackFrom));
	}

	public int getNumberTransitions(){
		return transitionFunction.size();
	}

	@Override
	public Iterator<Transition> iterator() {
		return transitionFunction.iterator();
	}

	private static Transition createTransition(State from, InputSymbol input, StackSymbol stackFrom, State to, List<StackSymbol> stackTo){
		List<StackSymbol> pushed = new ArrayList<>();
		for (StackSymbol symbol : stackTo){
			if (!symbol.isEpsilon()){
				pushed.add(symbol);
			}
		}
		return new Transition(from, input, stackFrom, to, pushed);
	}

	private static List<StackSymbol> toStackSymbols(List<?> objs){
		List<StackSymbol> ret = new ArrayList<>();
		for (Object obj : objs){
			ret.add(StackSymbol.of(obj));
		}
		return ret;
	}

	public PDA copy(){
		return new PDA(states, inputSymbols, stackSymbols, transitionFunction.copy(), startState, startStackSymbol, finalStates);
	}

	/**
	 * Automaton accepting by final state the language this automaton accepts by empty stack
	 */
	public PDA toFinalState(){
		State newStart = nextFree("#STARTTOFINAL#", State::new, states);
		State newEnd = nextFree("#ENDTOFINAL#", State::new, states);
		StackSymbol bottom = nextFree("#BOTTOMTOFINAL#", StackSymbol::new, stackSymbols);
		PDA pda = new PDA(states, inputSymbols, stackSymbols, transitionFunction.copy(), newStart, bottom,
				Collections.singleton(newEnd));
		if (startState != null && startStackSymbol != null){
			pda.addTransition(newStart, InputSymbol.EPSILON, bottom, startState, Arrays.asList(startStackSymbol, bottom));
		}
		for (State state : states){
			pda.addTransition(state, InputSymbol.EPSILON, bottom, newEnd, Collections.emptyList());
		}
		return pda;
	}

	/**
	 * Automaton accepting by empty stack the language this automaton accepts by final state
	 */
	public PDA toEmptyStack(){
		State newStart = nextFree("#STARTEMPTYS#", State::new, states);
		State newEnd = nextFree("#ENDEMPTYS#", State::new, states);
		StackSymbol bottom = nextFree("#BOTTOMEMPTYS#", StackSymbol::new, stackSymbols);
		PDA pda = new PDA(states, inputSymbols, stackSymbols, transitionFunction.copy(), newStart, bottom,
				Collections.emptySet());
		pda.states.add(newEnd);
		if (startState != null && startStackSymbol != null){
			pda.addTransition(newStart, InputSymbol.EPSILON, bottom, startState, Arrays.asList(startStackSymbol, bottom));
		}
		List<StackSymbol> allStackSymbols = new ArrayList<>(pda.stackSymbols);
		for (State state : finalStates){
			for (StackSymbol symbol : allStackSymbols){
				pda.addTransition(state, InputSymbol.EPSILON, symbol, newEnd, Collections.emptyList());
			}
		}
		for (StackSymbol symbol : allStackSymbols){
			pda.addTransition(newEnd, InputSymbol.EPSILON, symbol, newEnd, Collections.emptyList());
		}
		return pda;
	}

	private static <T> T nextFree(String prefix, Function<String, T> creator, Set<T> used){
		T candidate = creator.apply(prefix);
		int index = 0;
		while (used.contains(candidate)){
			candidate = creator.apply(prefix + index++);
		}
		return candidate;
	}

	/**
	 * Grammar of the language accepted by empty stack.
	 *
	 * The variable for (p, X, q) derives the words that lead from p to q while removing X from the
	 * top of the stack. Only triples whose first two components start a transition get variables.
	 */
	public CFG toCFG(){
		VariableConverter<State, StackSymbol> converter = new VariableConverter<>();
		Variable start = new Variable("#StartCFG#");
		List<Production> productions = new ArrayList<>();
		if (startState != null && startStackSymbol != null){
			for (State state : states){
				productions.add(new Production(start, Collections.singletonList(
						converter.toCombinedVariable(startState, startStackSymbol, state))));
			}
		}
		for (Transition transition : this){
			for (State state : states){
				converter.setValid(transition.from, transition.stackFrom, state);
			}
		}
		for (Transition transition : this){
			for (State state : states){
				if (transition.stackTo.isEmpty() && !state.equals(transition.to)){
					continue;
				}
				Variable head = converter.toCombinedVariable(transition.from, transition.stackFrom, state);
				for (List<Symbol> body : bodies(transition.to, state, transition.stackTo, converter)){
					if (!transition.input.isEpsilon()){
						body.add(0, new Terminal(transition.input.value));
					}
					productions.add(new Production(head, body, false));
				}
			}
		}
		LOG.fine(() -> String.format("Grammar of a push down automaton with %d transitions has %d productions",
				getNumberTransitions(), productions.size()));
		return new CFG(start, productions);
	}

	/**
	 * Bodies that pop the pushed symbols one after another, passing through every sequence of states
	 */
	private List<List<Symbol>> bodies(State from, State to, List<StackSymbol> pushed,
	                                  VariableConverter<State, StackSymbol> converter){
		List<List<Symbol>> ret = new ArrayList<>();
		if (pushed.isEmpty()){
			ret.add(new ArrayList<>());
			return ret;
		}
		for (List<State> middle : Utils.product(new ArrayList<>(states), pushed.size() - 1)){
			List<Symbol> body = new ArrayList<>();
			State last = from;
			for (int i = 0; i < pushed.size(); i++){
				State next = i < middle.size() ? middle.get(i) : to;
				Variable variable = converter.isValidAndGet(last, pushed.get(i), next);
				if (variable == null){
					body = null;
					break;
				}
				body.add(variable);
				last = next;
			}
			if (body != null){
				ret.add(body);
			}
		}
		return ret;
	}

	/**
	 * Automaton with the single state <code>q</code> that accepts the language of the grammar by empty stack.
	 * Variables are pushed by their value, terminals with the prefix {@value #TERMINAL_PREFIX}.
	 */
	public static PDA fromCFG(CFG cfg){
		State state = new State("q");
		PDA pda = new PDA();
		pda.setStartState(state);
		for (Terminal terminal : cfg.getTerminals()){
			pda.inputSymbols.add(InputSymbol.of(terminal.value));
			pda.stackSymbols.add(toStackSymbol(terminal));
		}
		for (Variable variable : cfg.getVariables()){
			pda.stackSymbols.add(toStackSymbol(variable));
		}
		if (cfg.getStartSymbol() != null){
			pda.setStartStackSymbol(toStackSymbol(cfg.getStartSymbol()));
		}
		for (Production production : cfg.getProductions()){
			List<StackSymbol> pushed = new ArrayList<>();
			for (Symbol symbol : production.body){
				pushed.add(toStackSymbol(symbol));
			}
			pda.addTransition(state, InputSymbol.EPSILON, toStackSymbol(production.head), state, pushed);
		}
		for (Terminal terminal : cfg.getTerminals()){
			pda.addTransition(state, InputSymbol.of(terminal.value), toStackSymbol(terminal), state,
					Collections.emptyList());
		}
		return pda;
	}

	private static StackSymbol toStackSymbol(Symbol symbol){
		if (symbol instanceof Epsilon){
			return StackSymbol.EPSILON;
		}
		if (symbol instanceof Terminal){
			return new StackSymbol(TERMINAL_PREFIX + symbol.value);
		}
		return new StackSymbol(symbol.value);
	}

	/**
	 * Product with a deterministic automaton, accepts by final state the words that both accept by final state
	 */
	public PDA intersection(DeterministicFiniteAutomaton other){
		PDA pda = new PDA();
		if (startState == null || other.getStartState() == null || other.isEmpty()){
			return pda;
		}
		Pair<State, State> start = new Pair<>(startState, other.getStartState());
		pda.setStartState(combined(start));
		if (startStackSymbol != null){
			pda.setStartStackSymbol(startStackSymbol);
		}
		List<InputSymbol> symbols = new ArrayList<>(inputSymbols);
		symbols.add(InputSymbol.EPSILON);
		Set<Pair<State, State>> processed = new HashSet<>();
		processed.add(start);
		Deque<Pair<State, State>> stack = new ArrayDeque<>();
		stack.push(start);
		while (!stack.isEmpty()){
			Pair<State, State> current = stack.pop();
			if (finalStates.contains(current.first) && other.getFinalStates().contains(current.second)){
				pda.addFinalState(combined(current));
			}
			for (InputSymbol symbol : symbols){
				State nextDfa = symbol.isEpsilon() ? current.second : other.getNextState(current.second, symbol);
				if (nextDfa == null){
					continue;
				}
				for (StackSymbol stackSymbol : stackSymbols){
					for (Transition transition : transitionFunction.get(current.first, symbol, stackSymbol)){
						Pair<State, State> next = new Pair<>(transition.to, nextDfa);
						pda.addTransition(combined(current), symbol, stackSymbol, combined(next), transition.stackTo);
						if (processed.add(next)){
							stack.push(next);
						}
					}
				}
			}
		}
		return pda;
	}

	private static State combined(Pair<State, State> states){
		return new State(states);
	}

	/**
	 * Graphviz representation, the edges are labelled with <code>input -&gt; stackFrom / stackTo</code>
	 */
	public String toDot(){
		DotGraph graph = new DotGraph("PDA");
		for (State state : states){
			graph.node(state);
		}
		if (startState != null){
			graph.startNode(startState);
		}
		for (State state : finalStates){
			graph.finalNode(state);
		}
		for (Transition transition : this){
			graph.edge(transition.from, transition.to, String.format("%s -> %s / [%s]", transition.input,
					transition.stackFrom, Utils.join(" ", transition.stackTo)));
		}
		return graph.toString();
	}
}

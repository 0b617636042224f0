package formlang.rsa;

import formlang.automata.FiniteAutomaton;
import formlang.automata.InputSymbol;
import formlang.automata.State;
import formlang.grammar.Variable;
import formlang.util.DotGraph;
import formlang.util.Pair;

/**
 * Finite automaton for the right hand sides of a variable in a recursive automaton
 */
public class Box {

	public final FiniteAutomaton automaton;

	public final Variable nonTerminal;

	public Box(FiniteAutomaton automaton, Variable nonTerminal) {
		this.automaton = automaton;
		this.nonTerminal = nonTerminal;
	}

	/**
	 * Same variable and an equivalent automaton?
	 */
	public boolean isEquivalentTo(Box other){
		return nonTerminal.equals(other.nonTerminal) && automaton.isEquivalentTo(other.automaton);
	}

	void addTo(DotGraph cluster){
		for (State state : automaton.getStates()){
			cluster.node(state);
		}
		for (State state : automaton.getStartStates()){
			cluster.startNode(state);
		}
		for (State state : automaton.getFinalStates()){
			cluster.finalNode(state);
		}
		for (Pair<Pair<State, InputSymbol>, State> transition : automaton.getTransitionList()){
			cluster.edge(transition.first.first, transition.second, transition.first.second.toString());
		}
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Box && isEquivalentTo((Box)obj);
	}

	@Override
	public int hashCode() {
		return nonTerminal.hashCode();
	}

	@Override
	public String toString() {
		return "Box(" + nonTerminal + ")";
	}
}

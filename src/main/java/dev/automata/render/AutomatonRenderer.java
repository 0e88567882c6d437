package dev.automata.render;

import dev.automata.model.CanonicalAutomaton;

/**
 * Turns a generated automaton into text for display.
 */
public interface AutomatonRenderer {

    /** Render the automaton. Never mutates it. */
    String render(CanonicalAutomaton automaton);
}

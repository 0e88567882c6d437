package dev.automata.model;

/**
 * Base type for every failure raised while generating an automaton.
 */
public class AutomatonException extends RuntimeException {

    public AutomatonException(String message) {
        super(message);
    }
}

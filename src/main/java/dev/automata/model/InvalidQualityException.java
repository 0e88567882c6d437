package dev.automata.model;

/**
 * A quality cannot be turned into an automaton, typically because its pattern is empty.
 */
public class InvalidQualityException extends AutomatonException {

    public InvalidQualityException(String message) {
        super(message);
    }
}

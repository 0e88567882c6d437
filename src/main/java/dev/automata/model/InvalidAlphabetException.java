package dev.automata.model;

/**
 * The alphabet is empty or contains repeated symbols.
 */
public class InvalidAlphabetException extends AutomatonException {

    public InvalidAlphabetException(String message) {
        super(message);
    }
}

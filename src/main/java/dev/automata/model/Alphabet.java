package dev.automata.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, duplicate-free set of single-character symbols shared by every automaton
 * built in one generation.
 */
public record Alphabet(List<Character> symbols) {

    public Alphabet {
        if (symbols == null || symbols.isEmpty()) {
            throw new InvalidAlphabetException("Alphabet cannot be empty.");
        }
        symbols = List.copyOf(symbols);
        if (new HashSet<>(symbols).size() != symbols.size()) {
            throw new InvalidAlphabetException("Alphabet cannot contain duplicate characters.");
        }
    }

    /**
     * Alphabet of the characters of {@code text}, in order. Duplicates are rejected.
     */
    public static Alphabet of(String text) {
        return new Alphabet(toList(text));
    }

    /**
     * Alphabet of the distinct characters of {@code text}, keeping first-seen order.
     */
    public static Alphabet deduplicated(String text) {
        Set<Character> unique = new LinkedHashSet<>(toList(text));
        return new Alphabet(new ArrayList<>(unique));
    }

    public int size() {
        return symbols.size();
    }

    public char symbolAt(int index) {
        return symbols.get(index);
    }

    /** Position of {@code symbol}, or -1 when it is not part of the alphabet. */
    public int indexOf(char symbol) {
        return symbols.indexOf(symbol);
    }

    public boolean contains(char symbol) {
        return indexOf(symbol) >= 0;
    }

    public String asString() {
        var sb = new StringBuilder(symbols.size());
        symbols.forEach(sb::append);
        return sb.toString();
    }

    private static List<Character> toList(String text) {
        var list = new ArrayList<Character>();
        if (text != null) {
            for (char c : text.toCharArray()) {
                list.add(c);
            }
        }
        return list;
    }
}

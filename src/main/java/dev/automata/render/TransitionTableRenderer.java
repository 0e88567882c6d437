package dev.automata.render;

import dev.automata.model.CanonicalAutomaton;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the transition function as a plain-text table, one row per state and one column
 * per symbol.
 */
public class TransitionTableRenderer implements AutomatonRenderer {

    static final String START_MARKER = "→ ";
    static final String FINAL_MARKER = "* ";
    static final String EMPTY_CELL = "—";
    static final String COLUMN_SEPARATOR = " | ";
    static final String LEGEND =
        "Note: '→' indicates the start state. '*' indicates a final (accepting) state.";

    @Override
    public String render(CanonicalAutomaton automaton) {
        var sb = new StringBuilder();
        sb.append("Start State: ").append(automaton.startState()).append('\n');
        sb.append("Final States: {").append(String.join(", ", automaton.finalStates())).append("}\n");
        automaton.dead().ifPresent(dead -> sb.append("Dead State: ").append(dead).append('\n'));
        sb.append('\n');

        List<List<String>> rows = new ArrayList<>();
        var header = new ArrayList<String>();
        header.add("State");
        automaton.alphabet().symbols().forEach(symbol -> header.add(String.valueOf(symbol)));
        rows.add(header);

        for (String state : automaton.states()) {
            var row = new ArrayList<String>();
            row.add(displayState(automaton, state));
            for (char symbol : automaton.alphabet().symbols()) {
                row.add(formatTargets(automaton.next(state, symbol)));
            }
            rows.add(row);
        }

        int[] widths = columnWidths(rows);
        appendRow(sb, rows.get(0), widths);
        appendRule(sb, widths);
        for (List<String> row : rows.subList(1, rows.size())) {
            appendRow(sb, row, widths);
        }

        sb.append('\n').append(LEGEND).append('\n');
        return sb.toString();
    }

    private static String displayState(CanonicalAutomaton automaton, String state) {
        String prefix = "";
        if (state.equals(automaton.startState())) {
            prefix += START_MARKER;
        }
        if (automaton.isFinal(state)) {
            prefix += FINAL_MARKER;
        }
        return prefix + state;
    }

    private static String formatTargets(List<String> targets) {
        if (targets.isEmpty()) {
            return EMPTY_CELL;
        }
        return "{" + String.join(", ", targets) + "}";
    }

    private static int[] columnWidths(List<List<String>> rows) {
        int[] widths = new int[rows.get(0).size()];
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        return widths;
    }

    private static void appendRow(StringBuilder sb, List<String> cells, int[] widths) {
        var line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append(COLUMN_SEPARATOR);
            }
            line.append(String.format("%-" + widths[i] + "s", cells.get(i)));
        }
        sb.append(line.toString().stripTrailing()).append('\n');
    }

    private static void appendRule(StringBuilder sb, int[] widths) {
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                sb.append("-+-");
            }
            sb.append("-".repeat(widths[i]));
        }
        sb.append('\n');
    }
}

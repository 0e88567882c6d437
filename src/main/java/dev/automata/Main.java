package dev.automata;

import dev.automata.cli.QualityAutomataCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = QualityAutomataCli.commandLine().execute(args);
        System.exit(exitCode);
    }
}

package dev.masterrecipe;

import dev.masterrecipe.cli.MasterRecipeCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MasterRecipeCli()).execute(args);
        System.exit(exitCode);
    }
}

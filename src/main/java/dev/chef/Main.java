package dev.chef;

import dev.chef.cli.ChefCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new ChefCli()).execute(args);
        System.exit(exitCode);
    }
}

package io.crisislink;

import io.crisislink.cli.CrisisLinkCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CrisisLinkCommand()).execute(args);
        System.exit(code);
    }
}

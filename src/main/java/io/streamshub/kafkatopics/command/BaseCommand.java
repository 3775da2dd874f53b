package io.streamshub.kafkatopics.command;

import java.io.PrintWriter;

import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;

public abstract class BaseCommand {

    @CommandLine.Spec
    protected CommandSpec commandSpec;

    protected PrintWriter out() {
        return commandSpec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return commandSpec.commandLine().getErr();
    }
}

package com.baseobject.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command; prints usage when no subcommand is given.
 */
@Command(
        name = "baseobject",
        mixinStandardHelpOptions = true,
        version = "baseobject 1.0.0",
        description = "Inspects and demonstrates dynamic attribute records.",
        subcommands = { InspectCommand.class, DemoCommand.class }
)
public class BaseObjectCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}

package com.baseobject;

import com.baseobject.cli.BaseObjectCommand;
import picocli.CommandLine;

/**
 * Main entry point for the record inspection tool.
 */
public class BaseObjectApplication {

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new BaseObjectCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}

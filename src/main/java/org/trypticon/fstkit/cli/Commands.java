package org.trypticon.fstkit.cli;

import java.io.PrintStream;

/**
 * Utilities for finding and listing commands.
 */
public class Commands {
    private static final Command[] commands = {
            new ConvertCommand(),
            new HelpCommand(),
            new InfoCommand(),
            new TopSortCommand(),
    };

    /**
     * Finds a command by name.
     *
     * @param name the command name.
     * @return the command. Returns {@code null} if no command with that name was found.
     */
    static Command findCommand(String name) {
        for (Command command : commands) {
            if (command.getName().equals(name)) {
                return command;
            }
        }
        return null;
    }

    /**
     * Prints a message for an unknown command.
     *
     * @param err the error stream.
     * @param command the command name which was unknown.
     */
    static void unknownCommand(PrintStream err, String command) {
        err.println("Unknown command: " + command);
        availableCommands(err);
    }

    /**
     * Prints a message listing the available commands.
     *
     * @param err the error stream.
     */
    static void availableCommands(PrintStream err) {
        err.println("Available commands:");
        for (Command command : commands) {
            err.println("  " + command.getName());
        }
    }

    /**
     * Prints the flags which every command accepts.
     *
     * @param err the error stream.
     */
    static void globalFlags(PrintStream err) {
        err.println("Global flags:");
        err.println("  --fst_read_mode=read|map  read FST files into memory or map them");
        err.println("  --fst_verify_properties   check stored properties against the FST on every query");
        err.println("  --fst_align               align the arrays of const FSTs when writing");
    }
}

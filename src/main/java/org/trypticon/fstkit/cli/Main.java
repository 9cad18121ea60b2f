package org.trypticon.fstkit.cli;

import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.InfoStream;
import org.trypticon.fstkit.PrintStreamInfoStream;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Main entry class.
 */
public class Main {
    /**
     * Main entry point for calling from a launcher.
     *
     * @param args the command-line arguments.
     */
    public static void main(String[] args) {
        int result = new Main().run(Arrays.asList(args), System.in, System.out, System.err);
        System.exit(result);
    }

    /**
     * Main entry point for command-line interface. Global flags may appear anywhere
     * in the arguments and override the {@code fstkit.*} system properties.
     *
     * @param args the command-line arguments.
     * @param in the input stream.
     * @param out the output stream.
     * @param err the error stream, which also receives log messages.
     * @return the result of running the command.
     */
    int run(List<String> args, InputStream in, PrintStream out, PrintStream err) {
        List<String> remaining = new ArrayList<>(args);
        FstConfig config = configure(remaining, new PrintStreamInfoStream(err));

        if (remaining.size() < 1) {
            usage(err);
            return 1;
        }

        String commandName = remaining.get(0);
        Command command = Commands.findCommand(commandName);
        if (command == null) {
            Commands.unknownCommand(err, commandName);
            return 1;
        }

        int result = command.run(remaining.subList(1, remaining.size()), config, in, out, err);
        out.flush();
        return result;
    }

    private static FstConfig configure(List<String> args, InfoStream infoStream) {
        FstConfig.Builder builder = FstConfig.fromSystemProperties(infoStream).toBuilder();
        String readMode = Command.takeFlag(args, "fst_read_mode");
        if (readMode != null) {
            builder.setReadMode(readMode);
        }
        Boolean verifyProperties = Command.takeBooleanFlag(args, "fst_verify_properties");
        if (verifyProperties != null) {
            builder.setVerifyProperties(verifyProperties);
        }
        Boolean align = Command.takeBooleanFlag(args, "fst_align");
        if (align != null) {
            builder.setAlign(align);
        }
        return builder.build();
    }

    private static void usage(PrintStream err) {
        err.println("usage: " + Constants.APP_NAME + " <command> <args...>");
        Commands.availableCommands(err);
        err.println("Use " + Constants.APP_NAME + " help <command> for help on a specific command.");
    }
}

package org.trypticon.fstkit.cli;

import org.trypticon.fstkit.FstClass;
import org.trypticon.fstkit.FstConfig;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Base class for CLI commands.
 */
abstract class Command {
    private final String name;
    private final String description;
    private final String usage;

    /**
     * Constructs the command.
     *
     * @param name a short name for the command.
     * @param description a description of the command.
     * @param usage usage summary of arguments to the command.
     */
    protected Command(String name, String description, String usage) {
        this.name = name;
        this.description = description;
        this.usage = usage;
    }

    /**
     * Gets the name of the command.
     *
     * @return the name of the command.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets a description of the command.
     *
     * @return a description of the command.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Prints usage info for this command.
     *
     * @param err the error stream.
     */
    void usage(PrintStream err) {
        err.println("usage: " + Constants.APP_NAME + " " + name + " " + usage);
    }

    /**
     * Prints anything {@code help} should show beyond the usage line.
     *
     * @param config the configuration.
     * @param err the error stream.
     */
    void details(FstConfig config, PrintStream err) {
    }

    /**
     * Runs the command.
     *
     * @param args the arguments to the command, global flags already removed.
     * @param config the configuration.
     * @param in the input stream.
     * @param out the output stream.
     * @param err the error stream.
     * @return the result of the command.
     */
    abstract int run(List<String> args, FstConfig config, InputStream in, PrintStream out, PrintStream err);

    /**
     * Removes a {@code --name=value} flag from the arguments.
     *
     * @param args the arguments, modified in place.
     * @param name the flag name.
     * @return the value of the last occurrence. Returns {@code null} if the flag was not given.
     */
    static String takeFlag(List<String> args, String name) {
        String prefix = "--" + name + "=";
        String value = null;
        for (Iterator<String> iterator = args.iterator(); iterator.hasNext(); ) {
            String arg = iterator.next();
            if (arg.startsWith(prefix)) {
                value = arg.substring(prefix.length());
                iterator.remove();
            }
        }
        return value;
    }

    /**
     * Removes a boolean flag from the arguments. {@code --name} alone means {@code true}.
     *
     * @param args the arguments, modified in place.
     * @param name the flag name.
     * @return the value of the last occurrence. Returns {@code null} if the flag was not given.
     */
    static Boolean takeBooleanFlag(List<String> args, String name) {
        String flag = "--" + name;
        Boolean value = null;
        for (Iterator<String> iterator = args.iterator(); iterator.hasNext(); ) {
            String arg = iterator.next();
            if (arg.equals(flag)) {
                value = true;
                iterator.remove();
            } else if (arg.startsWith(flag + "=")) {
                value = Boolean.parseBoolean(arg.substring(flag.length() + 1));
                iterator.remove();
            }
        }
        return value;
    }

    /**
     * Checks that no unrecognised flags are left in the arguments.
     *
     * @param args the remaining arguments.
     * @param err the error stream.
     * @return {@code true} if there are none.
     */
    boolean checkNoFlags(List<String> args, PrintStream err) {
        for (String arg : args) {
            if (arg.startsWith("--")) {
                err.println("Unknown flag: " + arg);
                usage(err);
                return false;
            }
        }
        return true;
    }

    /**
     * Reads an FST from a file, or from standard input if the path is missing, empty or {@code "-"}.
     *
     * @param args the arguments.
     * @param index the index of the input path in the arguments.
     * @param config the configuration.
     * @param in the standard input.
     * @return the FST. Returns {@code null} if it could not be read, the reason having been logged.
     */
    static FstClass readFst(List<String> args, int index, FstConfig config, InputStream in) {
        String path = index < args.size() ? args.get(index) : "";
        if (path.isEmpty() || path.equals("-")) {
            return FstClass.read(in, Constants.STDIN, config);
        }
        return FstClass.read(Path.of(path), config);
    }

    /**
     * Writes an FST to a file, or to standard output if the path is missing or empty.
     *
     * @param fst the FST.
     * @param args the arguments.
     * @param index the index of the output path in the arguments.
     * @param out the standard output.
     * @return {@code true} if written, the reason for failure having been logged otherwise.
     */
    static boolean writeFst(FstClass fst, List<String> args, int index, PrintStream out) {
        String path = index < args.size() ? args.get(index) : "";
        if (path.isEmpty()) {
            return fst.write(out, Constants.STDOUT);
        }
        return fst.write(Path.of(path));
    }
}

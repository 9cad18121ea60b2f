package org.trypticon.fstkit.cli;

import org.trypticon.fstkit.FstConfig;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;

/**
 * Command to show help on other commands, or on the flags every command takes.
 */
class HelpCommand extends Command {
    HelpCommand() {
        super("help", "Prints help for a command, or lists the global flags", "[<command>]");
    }

    @Override
    int run(List<String> args, FstConfig config, InputStream in, PrintStream out, PrintStream err) {
        if (args.isEmpty()) {
            Commands.availableCommands(err);
            Commands.globalFlags(err);
            return 0;
        }
        if (args.size() != 1) {
            usage(err);
            return 1;
        }
        Command command = Commands.findCommand(args.get(0));
        if (command == null) {
            Commands.unknownCommand(err, args.get(0));
            return 1;
        }

        err.println(Constants.APP_NAME + " " + command.getName() + " - " + command.getDescription());
        command.usage(err);
        command.details(config, err);
        return 0;
    }
}

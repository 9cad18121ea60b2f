package org.trypticon.fstkit.cli;

import org.trypticon.fstkit.FstClass;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.SymbolTable;
import org.trypticon.fstkit.properties.FstProperties;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;

/**
 * Command to show info about an FST.
 */
class InfoCommand extends Command {
    InfoCommand() {
        super("info", "Gives info about an FST", "[in.fst]");
    }

    @Override
    int run(List<String> args, FstConfig config, InputStream in, PrintStream out, PrintStream err) {
        if (!checkNoFlags(args, err)) {
            return 1;
        }
        if (args.size() > 1) {
            usage(err);
            return 1;
        }

        FstClass fst = readFst(args, 0, config, in);
        if (fst == null) {
            return 1;
        }
        long numArcs = 0;
        for (int s = 0; s < fst.numStates(); s++) {
            numArcs += fst.numArcs(s);
        }
        out.println("fst type: " + fst.fstType());
        out.println("arc type: " + fst.arcType());
        out.println("weight type: " + fst.weightType());
        out.println("input symbol table: " + symbolTableName(fst.inputSymbols()));
        out.println("output symbol table: " + symbolTableName(fst.outputSymbols()));
        out.println("# of states: " + fst.numStates());
        out.println("# of arcs: " + numArcs);
        out.println("initial state: " + fst.start());
        out.println("properties: " + FstProperties.toString(fst.properties(FstProperties.FST_PROPERTIES, true)));
        return 0;
    }

    private static String symbolTableName(SymbolTable symbols) {
        return symbols == null ? "none" : symbols.getName();
    }
}

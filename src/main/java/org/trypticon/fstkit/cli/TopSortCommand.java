package org.trypticon.fstkit.cli;

import org.trypticon.fstkit.FstClass;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.MutableFstClass;
import org.trypticon.fstkit.VectorFstClass;
import org.trypticon.fstkit.algorithm.TopSort;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;

/**
 * Command to topologically sort an FST. A cyclic FST is written back unchanged.
 */
class TopSortCommand extends Command {
    TopSortCommand() {
        super("topsort", "Topologically sorts an FST", "[in.fst [out.fst]]");
    }

    @Override
    int run(List<String> args, FstConfig config, InputStream in, PrintStream out, PrintStream err) {
        if (!checkNoFlags(args, err)) {
            return 1;
        }
        if (args.size() > 2) {
            usage(err);
            return 1;
        }

        FstClass ifst = readFst(args, 0, config, in);
        if (ifst == null) {
            return 1;
        }
        MutableFstClass fst = ifst instanceof MutableFstClass
                ? (MutableFstClass) ifst
                : new VectorFstClass(ifst);
        TopSort.topSort(fst);
        return writeFst(fst, args, 1, out) ? 0 : 1;
    }
}

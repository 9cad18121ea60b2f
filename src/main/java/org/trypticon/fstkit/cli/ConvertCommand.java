package org.trypticon.fstkit.cli;

import org.trypticon.fstkit.FstClass;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.algorithm.Convert;
import org.trypticon.fstkit.vector.VectorFst;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command to convert an FST to another implementation.
 */
class ConvertCommand extends Command {
    ConvertCommand() {
        super("convert", "Converts an FST to another type", "[--fst_type=<type>] [in.fst [out.fst]]");
    }

    @Override
    void details(FstConfig config, PrintStream err) {
        err.println("FST types: " + String.join(", ", config.getRegistry().getFstTypes()));
    }

    @Override
    int run(List<String> args, FstConfig config, InputStream in, PrintStream out, PrintStream err) {
        List<String> remaining = new ArrayList<>(args);
        String fstType = takeFlag(remaining, "fst_type");
        if (fstType == null) {
            fstType = VectorFst.TYPE;
        }
        if (!checkNoFlags(remaining, err)) {
            return 1;
        }
        if (remaining.size() > 2) {
            usage(err);
            return 1;
        }

        FstClass ifst = readFst(remaining, 0, config, in);
        if (ifst == null) {
            return 1;
        }
        FstClass ofst = Convert.convert(ifst, fstType);
        if (ofst == null) {
            return 1;
        }
        return writeFst(ofst, remaining, 1, out) ? 0 : 1;
    }
}

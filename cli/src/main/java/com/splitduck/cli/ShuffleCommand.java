package com.splitduck.cli;

import com.splitduck.logical.LogicalPlan;
import com.splitduck.rowstore.RowStore;
import com.splitduck.sampling.TieredShuffleStrategy;

import java.io.PrintStream;

/**
 * {@code shuffle <input> [-r SEED] [-o OUT] [-f FORMAT]}
 */
final class ShuffleCommand extends Command {

    ShuffleCommand(CommandLineArgs args, PrintStream out, PrintStream err) {
        super(args, out, err);
    }

    @Override
    protected void validate() {
        // nothing beyond option parsing
    }

    @Override
    protected void execute(RowStore store, LogicalPlan source, TieredShuffleStrategy shuffler) {
        long rows = store.count(source);
        progress("Shuffling " + rows + " rows");
        emit(store, shuffler.shuffle(source, rows, args.seed));
    }
}

package com.splitduck.cli;

import com.splitduck.exception.InvalidArgumentException;
import com.splitduck.logical.LogicalPlan;
import com.splitduck.rowstore.RowStore;
import com.splitduck.sampling.SampleMethod;
import com.splitduck.sampling.Sampler;
import com.splitduck.sampling.TieredShuffleStrategy;

import java.io.PrintStream;
import java.util.Locale;

/**
 * {@code sample <input> [-n N] [--method random|stratified|first|last]
 * [--stratify-by COL] [-r SEED] [-o OUT] [-f FORMAT]}
 */
final class SampleCommand extends Command {

    private SampleMethod method;

    SampleCommand(CommandLineArgs args, PrintStream out, PrintStream err) {
        super(args, out, err);
    }

    @Override
    protected void validate() {
        switch (args.method.toLowerCase(Locale.ROOT)) {
            case "random":
                method = SampleMethod.random();
                break;
            case "first":
                method = SampleMethod.first();
                break;
            case "last":
                method = SampleMethod.last();
                break;
            case "stratified":
                if (args.stratifyBy == null) {
                    throw new InvalidArgumentException("--stratify-by is required for stratified sampling");
                }
                method = SampleMethod.stratified(args.stratifyBy);
                break;
            default:
                throw new InvalidArgumentException("Invalid sampling method: " + args.method
                    + ". Must be 'random', 'stratified', 'first', or 'last'");
        }
    }

    @Override
    protected void execute(RowStore store, LogicalPlan source, TieredShuffleStrategy shuffler) {
        progress("Sampling " + args.number + " rows using method: " + method.displayName());
        LogicalPlan sample = new Sampler(store, shuffler).sample(source, args.number, method, args.seed);
        emit(store, sample);
    }
}

package com.splitduck.sampling;

import com.splitduck.logical.LogicalPlan;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One output of a split: its destination, the view of its rows, and the
 * number of rows the view holds.
 */
public record SplitPart(int index, Path destination, LogicalPlan view, long rowCount) {
    public SplitPart {
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(view, "view must not be null");
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }
}

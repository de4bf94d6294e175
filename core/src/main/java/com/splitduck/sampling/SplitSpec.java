package com.splitduck.sampling;

import com.splitduck.exception.InvalidArgumentException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of {@code (ratio, destination)} pairs describing a K-way split.
 *
 * <p>Ratios are validated on construction: each must be positive and they
 * must sum to 1.0, or to 100 in which case they are divided by 100. Both
 * checks use a tolerance of {@value #TOLERANCE}.
 */
public final class SplitSpec {

    static final double TOLERANCE = 0.001;

    /**
     * One part of a split.
     */
    public record Entry(double ratio, Path destination) {
        public Entry {
            Objects.requireNonNull(destination, "destination must not be null");
        }
    }

    private final List<Entry> entries;

    private SplitSpec(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    /**
     * Creates a split spec.
     *
     * @param ratios the ratios, as fractions or percentages
     * @param destinations one destination per ratio
     * @return the normalized spec
     * @throws InvalidArgumentException if the counts differ, a ratio is not
     *         positive, or the ratios sum to neither 1.0 nor 100
     */
    public static SplitSpec of(List<Double> ratios, List<Path> destinations) {
        Objects.requireNonNull(ratios, "ratios must not be null");
        Objects.requireNonNull(destinations, "destinations must not be null");
        if (ratios.size() != destinations.size()) {
            throw new InvalidArgumentException(String.format(
                "Number of ratios (%d) must match number of names (%d)", ratios.size(), destinations.size()));
        }

        List<Double> normalized = normalize(ratios);
        List<Entry> entries = new ArrayList<>(normalized.size());
        for (int i = 0; i < normalized.size(); i++) {
            entries.add(new Entry(normalized.get(i), destinations.get(i)));
        }
        return new SplitSpec(entries);
    }

    /**
     * Parses a comma-separated ratio list such as {@code "0.7,0.2,0.1"} or
     * {@code "70,20,10"}.
     *
     * @param text the ratio list
     * @return the normalized ratios
     * @throws InvalidArgumentException on syntax errors, non-positive
     *         ratios, or a bad sum
     */
    public static List<Double> parseRatios(String text) {
        Objects.requireNonNull(text, "text must not be null");
        List<Double> ratios = new ArrayList<>();
        for (String part : text.split(",", -1)) {
            String trimmed = part.trim();
            double ratio;
            try {
                ratio = Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                throw new InvalidArgumentException("Invalid ratio: " + trimmed, e);
            }
            if (Double.isNaN(ratio) || Double.isInfinite(ratio)) {
                throw new InvalidArgumentException("Invalid ratio: " + trimmed);
            }
            ratios.add(ratio);
        }
        return normalize(ratios);
    }

    /**
     * Validates ratios and converts percentages to fractions.
     */
    static List<Double> normalize(List<Double> ratios) {
        if (ratios.isEmpty()) {
            throw new InvalidArgumentException("At least one ratio is required");
        }
        double sum = 0;
        for (double ratio : ratios) {
            if (!(ratio > 0)) {
                throw new InvalidArgumentException("Ratio must be positive: " + ratio);
            }
            sum += ratio;
        }

        if (Math.abs(sum - 1.0) < TOLERANCE) {
            return List.copyOf(ratios);
        }
        if (Math.abs(sum - 100.0) < TOLERANCE) {
            List<Double> fractions = new ArrayList<>(ratios.size());
            for (double ratio : ratios) {
                fractions.add(ratio / 100.0);
            }
            return Collections.unmodifiableList(fractions);
        }
        throw new InvalidArgumentException("Ratios must sum to 1.0 or 100.0, got: " + sum);
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Computes split sizes for a row count: {@code round(rows * ratio)} for
     * every part but the last, each capped at what is left, and everything
     * that is left for the last part. The sizes always sum to {@code rows}.
     *
     * @param rows the number of rows to split
     * @return one size per entry
     */
    public long[] sizesFor(long rows) {
        long[] sizes = new long[entries.size()];
        long assigned = 0;
        for (int i = 0; i < sizes.length; i++) {
            long remaining = rows - assigned;
            if (i == sizes.length - 1) {
                sizes[i] = remaining;
            } else {
                sizes[i] = Math.min(Math.round(rows * entries.get(i).ratio()), remaining);
            }
            assigned += sizes[i];
        }
        return sizes;
    }

    @Override
    public String toString() {
        return "SplitSpec" + entries;
    }
}

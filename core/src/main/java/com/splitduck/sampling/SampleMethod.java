package com.splitduck.sampling;

import java.util.Locale;
import java.util.Objects;

/**
 * How a sample is drawn.
 */
public sealed interface SampleMethod
    permits SampleMethod.Random, SampleMethod.Stratified, SampleMethod.First, SampleMethod.Last {

    /** Uniform random rows, through the tiered shuffle. */
    record Random() implements SampleMethod {}

    /** Rows allocated proportionally to the categories of a column. */
    record Stratified(String column) implements SampleMethod {
        public Stratified {
            Objects.requireNonNull(column, "column must not be null");
        }
    }

    /** The leading rows, in source order. */
    record First() implements SampleMethod {}

    /** The trailing rows, in source order. */
    record Last() implements SampleMethod {}

    static SampleMethod random() {
        return new Random();
    }

    static SampleMethod stratified(String column) {
        return new Stratified(column);
    }

    static SampleMethod first() {
        return new First();
    }

    static SampleMethod last() {
        return new Last();
    }

    /**
     * Returns the lowercase name used on the command line.
     *
     * @return the method name
     */
    default String displayName() {
        return getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }
}

/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.exception.ValidationException;
import java.util.Arrays;

/**
 * Channels x samples matrix of signal values. {@link Double#NaN} is the invalid-data
 * sentinel: a sample column is invalid when any channel holds NaN at that column.
 *
 * <p>Instances are immutable; the constructor and {@link #toArray()} copy the data so a
 * matrix is never aliased across pipeline runs.
 */
public final class SampleMatrix {

    private final double[][] data;
    private final int sampleCount;

    public SampleMatrix(double[][] data) {
        if (data == null || data.length == 0) {
            throw new ValidationException("Sample matrix needs at least one channel");
        }
        int samples = data[0] == null ? 0 : data[0].length;
        double[][] copy = new double[data.length][];
        for (int c = 0; c < data.length; c++) {
            if (data[c] == null || data[c].length != samples) {
                throw ValidationException.sizeMismatch(
                        "channel " + (c + 1), samples, data[c] == null ? 0 : data[c].length);
            }
            copy[c] = Arrays.copyOf(data[c], samples);
        }
        this.data = copy;
        this.sampleCount = samples;
    }

    private SampleMatrix(double[][] owned, int sampleCount) {
        this.data = owned;
        this.sampleCount = sampleCount;
    }

    public int channelCount() {
        return data.length;
    }

    public int sampleCount() {
        return sampleCount;
    }

    /**
     * @param channel     0-based channel index
     * @param sampleIndex 1-based sample index
     */
    public double value(int channel, int sampleIndex) {
        return data[channel][sampleIndex - 1];
    }

    /** Whether any channel holds the invalid-data sentinel at the 1-based column. */
    public boolean isInvalidColumn(int sampleIndex) {
        int column = sampleIndex - 1;
        for (double[] channel : data) {
            if (Double.isNaN(channel[column])) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a new matrix holding only the columns flagged in {@code keep}.
     *
     * @param keep      per-column keep flags, 0-based, length equal to the sample count
     * @param keptCount number of {@code true} entries in {@code keep}
     */
    public SampleMatrix retainColumns(boolean[] keep, int keptCount) {
        if (keep.length != sampleCount) {
            throw ValidationException.sizeMismatch("keep mask", sampleCount, keep.length);
        }
        double[][] pruned = new double[data.length][keptCount];
        for (int c = 0; c < data.length; c++) {
            double[] source = data[c];
            double[] target = pruned[c];
            int k = 0;
            for (int i = 0; i < sampleCount; i++) {
                if (keep[i]) {
                    target[k++] = source[i];
                }
            }
        }
        return new SampleMatrix(pruned, keptCount);
    }

    public double[][] toArray() {
        double[][] copy = new double[data.length][];
        for (int c = 0; c < data.length; c++) {
            copy[c] = Arrays.copyOf(data[c], sampleCount);
        }
        return copy;
    }
}

package io.progtools.uncertain;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.annotations.SerializedName;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/// An unweighted empirical distribution: an ordered, mutable list of realizations.
///
/// ## Absent entries
///
/// A realization may be absent (`null`), for example when a Monte Carlo sample
/// terminated before a later save point. Individual components may also be
/// unresolved (`NaN`), for example an event that never occurred. Statistics skip
/// absent data and log a warning, since doing so can bias the result.
///
/// ## Statistics
///
/// | Statistic | Computation |
/// |-----------|-------------|
/// | mean      | per-key average of present values |
/// | median    | geometric median: the stored point minimizing total squared distance, O(n²) |
/// | cov       | unbiased (n - 1) sample covariance of fully present rows |
/// | sample    | uniform draws with replacement from the stored points |
///
/// The geometric median is quadratic in the sample count; for particle counts
/// in the thousands it dominates the cost of a summary.
@DistributionType(UnweightedSamples.TYPE)
public class UnweightedSamples extends UncertainData implements Iterable<LabeledVector> {

    public static final String TYPE = "samples";

    private static final Logger logger = LogManager.getLogger(UnweightedSamples.class);

    @SerializedName("keys")
    private final List<String> keys;

    @SerializedName("samples")
    private final List<double[]> samples;

    private transient KeySchema schema;

    /// Creates an empty sample set over the given keys.
    public UnweightedSamples(KeySchema schema) {
        this.schema = schema;
        this.keys = new ArrayList<>(schema.keys());
        this.samples = new ArrayList<>();
    }

    /// Creates a sample set from realizations, which may include `null` entries.
    public UnweightedSamples(KeySchema schema, List<LabeledVector> realizations) {
        this(schema);
        for (LabeledVector v : realizations) {
            add(v);
        }
    }

    /// Creates a sample set from columns of the form `{key: [value, ...]}`.
    ///
    /// @param columns key to values, every column of equal length
    /// @return the samples
    public static UnweightedSamples ofColumns(Map<String, double[]> columns) {
        KeySchema schema = KeySchema.of(columns.keySet());
        UnweightedSamples result = new UnweightedSamples(schema);
        if (columns.isEmpty()) {
            return result;
        }
        double[][] data = columns.values().toArray(new double[0][]);
        int n = data[0].length;
        for (double[] column : data) {
            if (column.length != n) {
                throw new IllegalArgumentException("All columns must have the same length, expected " + n
                    + " got " + column.length);
            }
        }
        for (int i = 0; i < n; i++) {
            double[] row = new double[data.length];
            for (int k = 0; k < data.length; k++) {
                row[k] = data[k][i];
            }
            result.samples.add(row);
        }
        return result;
    }

    @Override
    public KeySchema schema() {
        if (schema == null) {
            schema = KeySchema.of(keys);
        }
        return schema;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /// @param i sample index
    /// @return the realization, or `null` if absent
    public LabeledVector get(int i) {
        double[] row = samples.get(i);
        return row == null ? null : new LabeledVector(schema(), row.clone());
    }

    /// Appends a realization; `null` appends an absent entry.
    ///
    /// @throws KeyNotFoundException if the realization lacks one of this set's keys
    public void add(LabeledVector realization) {
        samples.add(toRow(realization));
    }

    public void set(int i, LabeledVector realization) {
        samples.set(i, toRow(realization));
    }

    public LabeledVector remove(int i) {
        double[] row = samples.remove(i);
        return row == null ? null : new LabeledVector(schema(), row);
    }

    private double[] toRow(LabeledVector realization) {
        if (realization == null) {
            return null;
        }
        return realization.reorder(schema()).toArray();
    }

    /// Values of one key across all present realizations, in order.
    ///
    /// Unresolved components are returned as NaN.
    ///
    /// @param key the key
    /// @return the column values
    public double[] key(String key) {
        int k = schema().indexOf(key);
        double[] out = new double[samples.size()];
        int count = 0;
        for (double[] row : samples) {
            if (row != null) {
                out[count++] = row[k];
            }
        }
        return Arrays.copyOf(out, count);
    }

    /// @return number of realizations that are not absent
    public int presentCount() {
        int count = 0;
        for (double[] row : samples) {
            if (row != null) {
                count++;
            }
        }
        return count;
    }

    @Override
    public UnweightedSamples sample(int n, UniformRandomProvider rng) {
        requirePositiveCount(n);
        if (samples.isEmpty()) {
            throw new EmptyDistributionException("Cannot sample from an empty sample set over " + keys);
        }
        UnweightedSamples result = new UnweightedSamples(schema());
        for (int i = 0; i < n; i++) {
            double[] row = samples.get(rng.nextInt(samples.size()));
            result.samples.add(row == null ? null : row.clone());
        }
        return result;
    }

    @Override
    public LabeledVector mean() {
        requireNotEmpty("mean");
        int d = keys.size();
        double[] sums = new double[d];
        int[] counts = new int[d];
        boolean skipped = false;
        for (double[] row : samples) {
            if (row == null) {
                skipped = true;
                continue;
            }
            for (int k = 0; k < d; k++) {
                if (Double.isNaN(row[k])) {
                    skipped = true;
                } else {
                    sums[k] += row[k];
                    counts[k]++;
                }
            }
        }
        if (skipped) {
            logger.warn("Some samples were absent; mean is of present samples only and may be biased");
        }
        double[] mean = new double[d];
        for (int k = 0; k < d; k++) {
            mean[k] = counts[k] == 0 ? Double.NaN : sums[k] / counts[k];
        }
        return new LabeledVector(schema(), mean);
    }

    @Override
    public LabeledVector median() {
        requireNotEmpty("median");
        double minDistance = Double.POSITIVE_INFINITY;
        double[] best = null;
        boolean partial = false;
        for (double[] p1 : samples) {
            if (p1 == null) {
                continue;
            }
            double total = 0.0;
            for (double[] p2 : samples) {
                if (p2 == null) {
                    continue;
                }
                for (int k = 0; k < p1.length; k++) {
                    if (Double.isNaN(p1[k]) || Double.isNaN(p2[k])) {
                        partial = true;
                        continue;
                    }
                    double diff = p1[k] - p2[k];
                    total += diff * diff;
                }
            }
            if (total < minDistance) {
                minDistance = total;
                best = p1;
            }
        }
        if (best == null) {
            throw new EmptyDistributionException("Every sample is absent; median is undefined for " + keys);
        }
        if (partial) {
            logger.warn("Some sample components were unresolved; median is of present components only and may be biased");
        }
        return new LabeledVector(schema(), best.clone());
    }

    @Override
    public double[][] cov() {
        int d = keys.size();
        if (samples.isEmpty() || d == 0) {
            return new double[d][d];
        }
        List<double[]> complete = new ArrayList<>();
        for (double[] row : samples) {
            if (row != null && Arrays.stream(row).noneMatch(Double::isNaN)) {
                complete.add(row);
            }
        }
        if (complete.size() < samples.size()) {
            logger.warn("Some samples were absent; covariance is of fully present samples only and may be biased");
        }
        if (complete.size() < 2) {
            double[][] undefined = new double[d][d];
            for (double[] r : undefined) {
                Arrays.fill(r, Double.NaN);
            }
            return undefined;
        }
        return new Covariance(complete.toArray(new double[0][]), true).getCovarianceMatrix().getData();
    }

    @Override
    public UnweightedSamples add(double offset) {
        UnweightedSamples result = new UnweightedSamples(schema());
        for (double[] row : samples) {
            if (row == null) {
                result.samples.add(null);
                continue;
            }
            double[] shifted = new double[row.length];
            for (int k = 0; k < row.length; k++) {
                shifted[k] = row[k] + offset;
            }
            result.samples.add(shifted);
        }
        return result;
    }

    /// Counts stored samples directly; `nSamples` is ignored.
    ///
    /// The denominator is the total number of entries, absent ones included.
    @Override
    public Map<String, Double> percentageInBounds(Map<String, double[]> bounds, List<String> keys, int nSamples) {
        requireNotEmpty("percentage in bounds");
        Map<String, Double> result = new LinkedHashMap<>();
        for (String key : keys) {
            double[] b = requireBounds(bounds, key);
            int k = schema().indexOf(key);
            int inside = 0;
            for (double[] row : samples) {
                if (row != null && b[0] < row[k] && row[k] < b[1]) {
                    inside++;
                }
            }
            result.put(key, inside / (double) samples.size());
        }
        return result;
    }

    private void requireNotEmpty(String statistic) {
        if (samples.isEmpty()) {
            throw new EmptyDistributionException("Cannot compute " + statistic + " of an empty sample set over " + keys);
        }
    }

    @Override
    public Iterator<LabeledVector> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < samples.size();
            }

            @Override
            public LabeledVector next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(next++);
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnweightedSamples)) return false;
        UnweightedSamples that = (UnweightedSamples) o;
        if (!keys.equals(that.keys) || samples.size() != that.samples.size()) {
            return false;
        }
        for (int i = 0; i < samples.size(); i++) {
            if (!Arrays.equals(samples.get(i), that.samples.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = keys.hashCode();
        for (double[] row : samples) {
            h = 31 * h + Arrays.hashCode(row);
        }
        return h;
    }

    @Override
    public String toString() {
        return "UnweightedSamples[keys=" + keys + ", size=" + samples.size() + "]";
    }
}

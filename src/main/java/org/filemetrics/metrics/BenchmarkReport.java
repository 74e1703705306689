package org.filemetrics.metrics;

import org.filemetrics.util.Utils;

import java.util.Objects;

/**
 * Sequential vs parallel timing over the same files.
 *
 * @param improvement   {@code sequentialMs / parallelMs} to 2 decimals, 0 when the parallel run took 0 ms
 * @param percentFaster {@code (sequentialMs - parallelMs) / sequentialMs * 100} to 1 decimal, 0 when the
 *                      sequential run took 0 ms
 * @param timeSavedMs   {@code |sequentialMs - parallelMs|}
 */
public record BenchmarkReport(long sequentialMs, long parallelMs, double improvement, double percentFaster,
                              long timeSavedMs, BatchResult sequential, BatchResult parallel) {

    public enum Verdict {
        PARALLEL_FASTER, SEQUENTIAL_FASTER, SAME
    }

    public BenchmarkReport {
        Objects.requireNonNull(sequential, "sequential");
        Objects.requireNonNull(parallel, "parallel");
    }

    public static BenchmarkReport of(final BatchResult sequential, final BatchResult parallel) {
        long seqMs = sequential.totalMillis();
        long parMs = parallel.totalMillis();
        double improvement = parMs > 0 ? Utils.round((double) seqMs / parMs, 2) : 0.0;
        double percentFaster = seqMs > 0 ? Utils.round((double) (seqMs - parMs) / seqMs * 100.0, 1) : 0.0;
        return new BenchmarkReport(seqMs, parMs, improvement, percentFaster, Math.abs(seqMs - parMs), sequential, parallel);
    }

    public int filesCount() {
        return sequential.size();
    }

    public Verdict verdict() {
        if (parallelMs < sequentialMs) return Verdict.PARALLEL_FASTER;
        if (parallelMs > sequentialMs) return Verdict.SEQUENTIAL_FASTER;
        return Verdict.SAME;
    }
}

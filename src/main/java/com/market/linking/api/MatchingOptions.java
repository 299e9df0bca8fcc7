package com.market.linking.api;

/**
 * Options for a matching run.
 * Configures the scorer cutoff, the temporal window and phase-1 parallelism.
 */
public class MatchingOptions {

    private static final double DEFAULT_SCORE_CUTOFF = 80.0;
    private static final double DEFAULT_MAX_TIME_DIFF_HOURS = 24.0;
    private static final int DEFAULT_PARALLELISM = 1;
    private static final int DEFAULT_PROGRESS_INTERVAL = 3_000;

    private final double scoreCutoff;
    private final double maxTimeDiffHours;
    private final int parallelism;
    private final int progressInterval;

    private MatchingOptions(Builder builder) {
        this.scoreCutoff = builder.scoreCutoff;
        this.maxTimeDiffHours = builder.maxTimeDiffHours;
        this.parallelism = builder.parallelism;
        this.progressInterval = builder.progressInterval;
    }

    public double getScoreCutoff() {
        return scoreCutoff;
    }

    public double getMaxTimeDiffHours() {
        return maxTimeDiffHours;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    /**
     * Creates default options: cutoff 80, a 24 hour window, single-threaded.
     */
    public static MatchingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "MatchingOptions{scoreCutoff=" + scoreCutoff +
                ", maxTimeDiffHours=" + maxTimeDiffHours +
                ", parallelism=" + parallelism +
                ", progressInterval=" + progressInterval + '}';
    }

    public static class Builder {
        private double scoreCutoff = DEFAULT_SCORE_CUTOFF;
        private double maxTimeDiffHours = DEFAULT_MAX_TIME_DIFF_HOURS;
        private int parallelism = DEFAULT_PARALLELISM;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        /**
         * Minimum text score, on the 0-100 scale, for a candidate to be kept.
         */
        public Builder scoreCutoff(double scoreCutoff) {
            this.scoreCutoff = scoreCutoff;
            return this;
        }

        /**
         * Maximum end-time distance in hours, inclusive.
         */
        public Builder maxTimeDiffHours(double maxTimeDiffHours) {
            this.maxTimeDiffHours = maxTimeDiffHours;
            return this;
        }

        /**
         * Number of threads for the scoring phase; 1 runs on the caller thread.
         */
        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public MatchingOptions build() {
            if (Double.isNaN(scoreCutoff) || scoreCutoff < 0.0 || scoreCutoff > 100.0) {
                throw new IllegalArgumentException("scoreCutoff must be within [0, 100]: " + scoreCutoff);
            }
            if (Double.isNaN(maxTimeDiffHours) || maxTimeDiffHours < 0.0) {
                throw new IllegalArgumentException("maxTimeDiffHours must not be negative: " + maxTimeDiffHours);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
            }
            if (progressInterval < 1) {
                throw new IllegalArgumentException("progressInterval must be at least 1: " + progressInterval);
            }
            return new MatchingOptions(this);
        }
    }
}

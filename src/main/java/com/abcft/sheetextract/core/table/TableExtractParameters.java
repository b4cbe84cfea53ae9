package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.ExtractParameters;
import com.abcft.sheetextract.core.util.MapUtils;

import java.util.Map;

/**
 * Parameters for table structure extraction.
 */
public class TableExtractParameters extends ExtractParameters {

    public static final int DEFAULT_GAP_THRESHOLD = 3;
    public static final int DEFAULT_COMPACT_GAP_THRESHOLD = 2;
    private static final OutputFormat DEFAULT_OUTPUT_FORMAT = OutputFormat.VERBOSE;

    public static final class Builder extends ExtractParameters.Builder<TableExtractParameters> {

        boolean useGaps = false;
        int gapThreshold = DEFAULT_GAP_THRESHOLD;                 // 通用 gaps 算法
        int compactGapThreshold = DEFAULT_COMPACT_GAP_THRESHOLD;  // compact 输出使用的阈值，两者互相独立
        OutputFormat outputFormat = DEFAULT_OUTPUT_FORMAT;
        int parallelism = 1;

        public Builder() {
        }

        public Builder(Map<String, String> params) {
            super(params);
            this.useGaps = MapUtils.getBoolean(params, "table_detection.use_gaps", useGaps);
            setGapThreshold(MapUtils.getInt(params, "table_detection.gap_threshold", gapThreshold));
            setCompactGapThreshold(MapUtils.getInt(params, "table_detection.compact_gap_threshold", compactGapThreshold));
            this.outputFormat = MapUtils.getEnum(params, "table.outputFormat", OutputFormat.class, DEFAULT_OUTPUT_FORMAT);
            setParallelism(MapUtils.getInt(params, "table.parallelism", parallelism));
        }

        public Builder setUseGaps(boolean useGaps) {
            this.useGaps = useGaps;
            return this;
        }

        /**
         * Minimal number of blank rows splitting two tables in the gaps strategy, at least 1.
         */
        public Builder setGapThreshold(int gapThreshold) {
            this.gapThreshold = gapThreshold >= 1 ? gapThreshold : DEFAULT_GAP_THRESHOLD;
            return this;
        }

        /**
         * Same as {@link #setGapThreshold(int)}, for compact output.
         */
        public Builder setCompactGapThreshold(int compactGapThreshold) {
            this.compactGapThreshold = compactGapThreshold >= 1 ? compactGapThreshold : DEFAULT_COMPACT_GAP_THRESHOLD;
            return this;
        }

        public Builder setOutputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat != null ? outputFormat : DEFAULT_OUTPUT_FORMAT;
            return this;
        }

        /**
         * Number of sheets processed at the same time.
         */
        public Builder setParallelism(int parallelism) {
            this.parallelism = Math.max(parallelism, 1);
            return this;
        }

        @Override
        public TableExtractParameters build() {
            return new TableExtractParameters(this);
        }
    }

    public static TableExtractParameters defaults() {
        return new Builder().build();
    }

    TableExtractParameters(Builder builder) {
        super(builder);
        this.useGaps = builder.useGaps;
        this.gapThreshold = builder.gapThreshold;
        this.compactGapThreshold = builder.compactGapThreshold;
        this.outputFormat = builder.outputFormat;
        this.parallelism = builder.parallelism;
    }

    @Override
    public Builder buildUpon() {
        return buildUpon(new Builder())
                .setUseGaps(useGaps)
                .setGapThreshold(gapThreshold)
                .setCompactGapThreshold(compactGapThreshold)
                .setOutputFormat(outputFormat)
                .setParallelism(parallelism);
    }

    /**
     * Gap threshold matching the output format.
     */
    public int effectiveGapThreshold() {
        return outputFormat == OutputFormat.COMPACT ? compactGapThreshold : gapThreshold;
    }

    public final boolean useGaps;
    public final int gapThreshold;
    public final int compactGapThreshold;
    public final OutputFormat outputFormat;
    public final int parallelism;

}

package com.abcft.sheetextract.core;

import com.abcft.sheetextract.core.util.MapUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Parameters for extractors.
 *
 * <p>Parameters are immutable, use {@link #buildUpon()} to derive a modified copy.</p>
 */
public abstract class ExtractParameters {

    public abstract static class Builder<T extends ExtractParameters> {

        boolean debug;
        String source;
        final Map<String, Object> meta = new HashMap<>();

        public Builder() {
        }

        public Builder(Map<String, String> params) {
            this.debug = MapUtils.getBoolean(params, "debug", false);
            this.source = MapUtils.getString(params, "source", null);
        }

        /**
         * sets whether we should run in debug mode.
         *
         * @param debug true if we wants to run in debug mode.
         * @return this builder.
         */
        public Builder<T> setDebug(boolean debug) {
            this.debug = debug;
            return this;
        }

        /**
         * Set the workbook source, used in log messages only.
         *
         * @param source the name of the workbook source.
         * @return this builder.
         */
        public Builder<T> setSource(String source) {
            this.source = source;
            return this;
        }

        /**
         * Add a single meta value.
         *
         * @param key the key
         * @param value the value
         * @return this builder.
         */
        public Builder<T> addMeta(String key, Object value) {
            this.meta.put(key, value);
            return this;
        }

        public Builder<T> addMetas(Map<String, Object> meta) {
            this.meta.putAll(meta);
            return this;
        }

        /**
         * Creates an new instance of the parameters.
         *
         * @return the new instance of parameters.
         */
        public abstract T build();
    }

    protected ExtractParameters(Builder<?> builder) {
        this.debug = builder.debug;
        this.source = builder.source;
        this.meta = new HashMap<>(builder.meta);
    }

    /**
     * Populates the builder with current parameters.
     * @param builder the builder to populate with.
     */
    protected <B extends Builder<?>> B buildUpon(B builder) {
        builder.setDebug(debug)
                .setSource(source)
                .addMetas(meta);
        return builder;
    }

    /**
     * Create a the builder with current parameters.
     *
     * @return a new builder with current parameters.
     */
    public abstract Builder<? extends ExtractParameters> buildUpon();

    /**
     * Debug mode.
     */
    public final boolean debug;
    /**
     * Source name of the workbook, might be {@code null}.
     */
    public final String source;
    /**
     * the meta of the workbook.
     */
    public final Map<String, Object> meta;

}

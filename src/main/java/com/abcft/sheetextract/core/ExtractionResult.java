package com.abcft.sheetextract.core;

import com.abcft.sheetextract.core.util.Taggable;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Represents result of an extraction.
 */
public abstract class ExtractionResult<T extends ExtractedItem> implements Taggable {

    public static final String TAG_EXTRACT_DURATION = "extract.duration";

    private Throwable lastError;
    private final ArrayList<Throwable> errors = new ArrayList<>();
    private final Map<String, Object> tags = new HashMap<>();  // 辅助标记信息

    @Override
    public void addTag(String key, Object value) {
        tags.put(key, value);
    }

    @Override
    public Object getTag(String key) {
        return tags.get(key);
    }

    @Override
    public boolean hasTag(String key) {
        return tags.containsKey(key);
    }

    @Override
    public void clearTags() {
        tags.clear();
    }

    @Override
    public void removeTag(String key) {
        tags.remove(key);
    }

    public long getExtractDuration() {
        Long duration = getTag(TAG_EXTRACT_DURATION, Long.class);
        return duration != null ? duration : -1;
    }

    public void setExtractDuration(long duration) {
        tags.put(TAG_EXTRACT_DURATION, duration);
    }

    /**
     * Determine whether there is any error.
     *
     * @return {@code true} if there is any error, {@code false} otherwise.
     */
    public boolean hasError() {
        return null != lastError;
    }

    /**
     * Get all errors.
     *
     * @return a list of errors, or an empty list if there is no error.
     */
    public List<Throwable> getErrors() {
        return Collections.unmodifiableList(this.errors);
    }

    /**
     * Get all errors as stack trace strings.
     */
    public List<String> getErrorStrings() {
        return this.errors.stream().map(e -> {
            StringWriter sw = new StringWriter();
            e.printStackTrace(new PrintWriter(sw, true));
            return sw.toString();
        }).collect(Collectors.toList());
    }

    public int getErrorCount() {
        return this.errors.size();
    }

    /**
     * Record an error and mark it as the last error.
     * @param e the error to record.
     */
    public synchronized void recordError(Throwable e) {
        this.lastError = e;
        this.errors.add(e);
    }

    public Throwable getLastError() {
        return this.lastError;
    }

    /**
     * Get the extracted items.
     *
     * @return a list of extracted items.
     */
    public abstract List<T> getItems();

    /**
     * Determine if there is any extracted items.
     */
    public abstract boolean hasResult();

}

package com.abcft.sheetextract.core.util;

/**
 * Object which carries auxiliary key/value tags.
 */
public interface Taggable {

    void addTag(String key, Object value);

    Object getTag(String key);

    default <T> T getTag(String key, Class<T> clazz) {
        Object value = getTag(key);
        return clazz.isInstance(value) ? clazz.cast(value) : null;
    }

    boolean hasTag(String key);

    void removeTag(String key);

    void clearTags();

}

package com.abcft.sheetextract.core;

/**
 * Basic callback for workbook extraction.
 */
public interface ExtractCallback<TItem extends ExtractedItem,
        TResult extends ExtractionResult<TItem>> {

    /**
     * Called when error occurs while extracting part of the workbook.
     *
     * After calling this method, extraction continues with the next sheet.
     *
     * @param e the error occurred.
     */
    void onExtractionError(Throwable e);

    /**
     * Called before extraction.
     *
     * @param document the workbook that is being processed.
     */
    default void onStart(Object document) {

    }

    /**
     * Called while a single item is extracted from a sheet.
     *
     * @param item the extracted item.
     */
    default void onItemExtracted(TItem item) {

    }

    /**
     * Called when extraction finished.
     *
     * Note that this will also be called if any {@link #onExtractionError(Throwable)} happened.
     *
     * @param result the result of the extraction.
     */
    void onFinished(TResult result);

}

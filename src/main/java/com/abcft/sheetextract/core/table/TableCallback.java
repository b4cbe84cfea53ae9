package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.ExtractCallback;

/**
 * Callback for table extraction.
 */
public interface TableCallback extends ExtractCallback<Table, TableExtractionResult> {

}

package com.abcft.sheetextract.core.table;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Headers of a single data cell: the header cells above it (one per header row) and the header
 * cells on its left (one per header column), outermost level first.
 */
public final class HeaderContext {

    private final ImmutableList<HeaderLevel> columnHeaders;
    private final ImmutableList<HeaderLevel> rowHeaders;

    HeaderContext(List<HeaderLevel> columnHeaders, List<HeaderLevel> rowHeaders) {
        this.columnHeaders = ImmutableList.copyOf(columnHeaders);
        this.rowHeaders = ImmutableList.copyOf(rowHeaders);
    }

    public List<HeaderLevel> getColumnHeaders() {
        return columnHeaders;
    }

    public List<HeaderLevel> getRowHeaders() {
        return rowHeaders;
    }

    public List<String> getFullColumnPath() {
        return pathOf(columnHeaders);
    }

    public List<String> getFullRowPath() {
        return pathOf(rowHeaders);
    }

    @Nullable
    public String getPrimaryColumnHeader() {
        return columnHeaders.isEmpty() ? null : columnHeaders.get(0).getText();
    }

    @Nullable
    public String getPrimaryRowHeader() {
        return rowHeaders.isEmpty() ? null : rowHeaders.get(0).getText();
    }

    public int getColumnHeaderLevels() {
        return columnHeaders.size();
    }

    public int getRowHeaderLevels() {
        return rowHeaders.size();
    }

    private static List<String> pathOf(List<HeaderLevel> levels) {
        ImmutableList.Builder<String> path = ImmutableList.builder();
        for (HeaderLevel level : levels) {
            path.add(level.getText());
        }
        return path.build();
    }

    JsonObject toDocument() {
        JsonObject doc = new JsonObject();
        JsonArray cols = new JsonArray();
        columnHeaders.forEach(h -> cols.add(h.toDocument()));
        JsonArray rows = new JsonArray();
        rowHeaders.forEach(h -> rows.add(h.toDocument()));
        doc.add("column_headers", cols);
        doc.add("row_headers", rows);
        JsonArray colPath = new JsonArray();
        getFullColumnPath().forEach(colPath::add);
        JsonArray rowPath = new JsonArray();
        getFullRowPath().forEach(rowPath::add);
        doc.add("full_column_path", colPath);
        doc.add("full_row_path", rowPath);
        JsonObject summary = new JsonObject();
        summary.addProperty("primary_column_header", getPrimaryColumnHeader());
        summary.addProperty("primary_row_header", getPrimaryRowHeader());
        summary.addProperty("column_header_levels", getColumnHeaderLevels());
        summary.addProperty("row_header_levels", getRowHeaderLevels());
        doc.add("header_summary", summary);
        return doc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HeaderContext that = (HeaderContext) o;
        return columnHeaders.equals(that.columnHeaders) && rowHeaders.equals(that.rowHeaders);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnHeaders, rowHeaders);
    }

    @Override
    public String toString() {
        return "HeaderContext{cols=" + getFullColumnPath() + ", rows=" + getFullRowPath() + '}';
    }

}

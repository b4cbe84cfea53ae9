package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.ExtractedItem;
import com.abcft.sheetextract.core.util.NumberUtil;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A table found in a sheet. Tables are immutable once assembled.
 */
public final class Table implements ExtractedItem {

    private final String id;
    private final String name;
    private final String sheetName;
    private final String title;
    private final OutputFormat outputFormat;
    private final TableRegion region;
    private final HeaderInfo headerInfo;
    private final ImmutableList<TableColumn> columns;
    private final ImmutableList<TableRow> rows;
    private final TableMetadata metadata;
    private final ImmutableMap<String, HeaderContext> headerContexts;

    Table(String id, String name, String sheetName, @Nullable String title, OutputFormat outputFormat,
          TableRegion region, HeaderInfo headerInfo, List<TableColumn> columns, List<TableRow> rows,
          TableMetadata metadata, Map<String, HeaderContext> headerContexts) {
        this.id = id;
        this.name = name;
        this.sheetName = sheetName;
        this.title = title;
        this.outputFormat = outputFormat;
        this.region = region;
        this.headerInfo = headerInfo;
        this.columns = ImmutableList.copyOf(columns);
        this.rows = ImmutableList.copyOf(rows);
        this.metadata = metadata;
        this.headerContexts = ImmutableMap.copyOf(headerContexts);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getSheetName() {
        return sheetName;
    }

    @Nullable
    public String getTitle() {
        return title;
    }

    public boolean hasTitle() {
        return title != null;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public TableRegion getRegion() {
        return region;
    }

    public HeaderInfo getHeaderInfo() {
        return headerInfo;
    }

    public List<TableColumn> getColumns() {
        return columns;
    }

    public List<TableRow> getRows() {
        return rows;
    }

    public TableMetadata getMetadata() {
        return metadata;
    }

    /**
     * Header contexts of the data cells keyed by coordinate, empty for compact tables.
     */
    public Map<String, HeaderContext> getHeaderContexts() {
        return headerContexts;
    }

    @Nullable
    public HeaderContext getHeaderContext(String coordinate) {
        return headerContexts.get(coordinate);
    }

    public String getDetectionMethod() {
        return metadata.getDetectionMethod();
    }

    @Nullable
    public TableColumn getColumn(int index) {
        for (TableColumn column : columns) {
            if (column.getIndex() == index) {
                return column;
            }
        }
        return null;
    }

    @Nullable
    public TableRow getRow(int index) {
        for (TableRow row : rows) {
            if (row.getIndex() == index) {
                return row;
            }
        }
        return null;
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject doc = new JsonObject();
        doc.addProperty("id", id);
        doc.addProperty("name", name);
        doc.addProperty("sheet", sheetName);
        if (title != null) {
            doc.addProperty("title", title);
        }
        doc.addProperty("format", outputFormat.name().toLowerCase());
        doc.add("region", region.toDocument());
        doc.add("headers", headerInfo.toDocument());
        JsonObject labels = new JsonObject();
        JsonArray colLabels = new JsonArray();
        columns.forEach(c -> colLabels.add(c.getLabel()));
        JsonArray rowLabels = new JsonArray();
        rows.forEach(r -> rowLabels.add(r.getLabel()));
        labels.add("cols", colLabels);
        labels.add("rows", rowLabels);
        doc.add("labels", labels);
        doc.add("meta", metadata.toDocument());
        if (detail && outputFormat == OutputFormat.VERBOSE) {
            JsonObject cells = new JsonObject();
            for (TableRow row : rows) {
                for (Map.Entry<String, Object> entry : row.getCells().entrySet()) {
                    cells.add(entry.getKey(), toJson(entry.getValue()));
                }
            }
            doc.add("cells", cells);
            JsonObject headers = new JsonObject();
            headerContexts.forEach((coordinate, context) -> headers.add(coordinate, context.toDocument()));
            doc.add("header_context", headers);
        }
        return doc;
    }

    private static JsonPrimitive toJson(Object value) {
        if (value instanceof Number) {
            return new JsonPrimitive((Number) value);
        } else if (value instanceof Boolean) {
            return new JsonPrimitive((Boolean) value);
        }
        return new JsonPrimitive(NumberUtil.formatValue(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Table table = (Table) o;
        return id.equals(table.id) && name.equals(table.name) && Objects.equals(sheetName, table.sheetName)
                && Objects.equals(title, table.title) && outputFormat == table.outputFormat
                && region.equals(table.region) && headerInfo.equals(table.headerInfo)
                && columns.equals(table.columns) && rows.equals(table.rows) && metadata.equals(table.metadata)
                && headerContexts.equals(table.headerContexts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, sheetName, title, outputFormat, region, headerInfo, columns, rows, metadata,
                headerContexts);
    }

    @Override
    public String toString() {
        return String.format("Table{%s, %s, %s}", id, region, metadata);
    }

}

package io.schemawatch.schema;

public record ColumnMetadata(String name, String dataType) {
}

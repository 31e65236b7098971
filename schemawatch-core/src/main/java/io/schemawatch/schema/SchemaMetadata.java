package io.schemawatch.schema;

import io.schemawatch.core.ObjectCounts;

import java.util.List;

/**
 * Structural metadata of one database as returned by a {@link io.schemawatch.spi.SchemaExtractor}.
 * Row data and descriptions are not part of it.
 */
public record SchemaMetadata(
        List<TableMetadata> tables,
        List<String> views,
        List<String> procedures,
        List<String> functions
) {
    public SchemaMetadata {
        tables = tables == null ? List.of() : List.copyOf(tables);
        views = views == null ? List.of() : List.copyOf(views);
        procedures = procedures == null ? List.of() : List.copyOf(procedures);
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public ObjectCounts counts() {
        return new ObjectCounts(tables.size(), views.size(), procedures.size(), functions.size());
    }
}

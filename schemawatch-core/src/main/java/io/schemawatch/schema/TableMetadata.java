package io.schemawatch.schema;

import java.util.List;

/**
 * @param name            qualified table name, e.g. {@code dbo.Customers}
 * @param constraintCount primary key, foreign key, unique and check constraints on the table
 */
public record TableMetadata(String name, List<ColumnMetadata> columns, int constraintCount) {
    public TableMetadata {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}

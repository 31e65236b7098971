package io.schemawatch.internal.jdbc;

import io.schemawatch.schema.ColumnMetadata;
import io.schemawatch.schema.SchemaMetadata;
import io.schemawatch.schema.TableMetadata;
import io.schemawatch.spi.DatabaseSession;
import io.schemawatch.spi.SchemaExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads tables, views, procedures and functions through {@link DatabaseMetaData}.
 *
 * <p>Objects in system schemas are skipped. Constraint counts cover the primary key, foreign
 * keys and unique indexes that do not merely back the primary key.
 */
public class JdbcMetadataSchemaExtractor implements SchemaExtractor {
    private static final Logger log = LoggerFactory.getLogger(JdbcMetadataSchemaExtractor.class);

    private static final Set<String> SYSTEM_SCHEMAS = Set.of(
            "information_schema", "sys", "pg_catalog", "pg_toast", "mysql", "performance_schema");

    @Override
    public SchemaMetadata extract(DatabaseSession session) throws SQLException {
        Connection conn = session.connection();
        DatabaseMetaData md = conn.getMetaData();
        String catalog = conn.getCatalog();

        List<TableMetadata> tables = new ArrayList<>();
        List<String> views = new ArrayList<>();

        try (ResultSet rs = md.getTables(catalog, null, "%", null)) {
            while (rs.next()) {
                String schema = rs.getString("TABLE_SCHEM");
                if (isSystemSchema(schema)) {
                    continue;
                }
                String name = rs.getString("TABLE_NAME");
                String type = rs.getString("TABLE_TYPE");

                if ("VIEW".equalsIgnoreCase(type)) {
                    views.add(qualify(schema, name));
                } else if ("TABLE".equalsIgnoreCase(type) || "BASE TABLE".equalsIgnoreCase(type)) {
                    tables.add(new TableMetadata(qualify(schema, name),
                            columns(md, catalog, schema, name),
                            constraintCount(md, catalog, schema, name)));
                }
            }
        }

        Set<String> functions = new TreeSet<>();
        try (ResultSet rs = md.getFunctions(catalog, null, "%")) {
            while (rs.next()) {
                String schema = rs.getString("FUNCTION_SCHEM");
                if (!isSystemSchema(schema)) {
                    functions.add(qualify(schema, stripVersion(rs.getString("FUNCTION_NAME"))));
                }
            }
        }

        Set<String> procedures = new TreeSet<>();
        try (ResultSet rs = md.getProcedures(catalog, null, "%")) {
            while (rs.next()) {
                String schema = rs.getString("PROCEDURE_SCHEM");
                if (isSystemSchema(schema)) {
                    continue;
                }
                String name = qualify(schema, stripVersion(rs.getString("PROCEDURE_NAME")));
                // some drivers list functions as procedures as well
                if (!functions.contains(name)) {
                    procedures.add(name);
                }
            }
        }

        log.debug("Extracted schema catalog={} tables={} views={} procedures={} functions={}",
                catalog, tables.size(), views.size(), procedures.size(), functions.size());
        return new SchemaMetadata(tables, views, new ArrayList<>(procedures), new ArrayList<>(functions));
    }

    private static List<ColumnMetadata> columns(DatabaseMetaData md, String catalog, String schema, String table)
            throws SQLException {
        String escape = md.getSearchStringEscape();
        List<ColumnMetadata> columns = new ArrayList<>();
        // getColumns takes LIKE patterns, so "_" in a name would match other tables
        try (ResultSet rs = md.getColumns(catalog, escapePattern(schema, escape), escapePattern(table, escape), "%")) {
            while (rs.next()) {
                if (!Objects.equals(schema, rs.getString("TABLE_SCHEM")) || !table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                columns.add(new ColumnMetadata(rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME")));
            }
        }
        return columns;
    }

    static String escapePattern(String name, String escape) {
        if (name == null || escape == null || escape.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_' || c == '%' || name.startsWith(escape, i)) {
                sb.append(escape);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static int constraintCount(DatabaseMetaData md, String catalog, String schema, String table)
            throws SQLException {
        Set<String> pkColumns = new TreeSet<>();
        try (ResultSet rs = md.getPrimaryKeys(catalog, schema, table)) {
            while (rs.next()) {
                pkColumns.add(rs.getString("COLUMN_NAME"));
            }
        }

        Set<String> foreignKeys = new LinkedHashSet<>();
        try (ResultSet rs = md.getImportedKeys(catalog, schema, table)) {
            while (rs.next()) {
                String fkName = rs.getString("FK_NAME");
                foreignKeys.add(fkName != null ? fkName : rs.getString("PKTABLE_NAME") + "." + rs.getString("FKCOLUMN_NAME"));
            }
        }

        Map<String, Set<String>> uniqueIndexes = new LinkedHashMap<>();
        try (ResultSet rs = md.getIndexInfo(catalog, schema, table, true, true)) {
            while (rs.next()) {
                String indexName = rs.getString("INDEX_NAME");
                String column = rs.getString("COLUMN_NAME");
                if (indexName == null || column == null) {
                    continue;
                }
                uniqueIndexes.computeIfAbsent(indexName, k -> new TreeSet<>()).add(column);
            }
        }
        long uniques = uniqueIndexes.values().stream().filter(cols -> !cols.equals(pkColumns)).count();

        return (pkColumns.isEmpty() ? 0 : 1) + foreignKeys.size() + (int) uniques;
    }

    private static boolean isSystemSchema(String schema) {
        return schema != null && SYSTEM_SCHEMAS.contains(schema.toLowerCase(Locale.ROOT));
    }

    private static String qualify(String schema, String name) {
        return schema == null || schema.isEmpty() ? name : schema + "." + name;
    }

    // SQL Server reports procedures as "name;1"
    private static String stripVersion(String name) {
        if (name == null) {
            return "";
        }
        int idx = name.indexOf(';');
        return idx > 0 ? name.substring(0, idx) : name;
    }
}

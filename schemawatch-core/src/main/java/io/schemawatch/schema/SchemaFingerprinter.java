package io.schemawatch.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Canonicalizes schema metadata and hashes it.
 *
 * <p>The canonical form only keeps structure: per table its name, the sorted {@code [name, type]}
 * column pairs and the constraint count; per view, procedure and function its name. Every list
 * is sorted, so the order in which the extractor returned objects never changes the fingerprint.
 */
public class SchemaFingerprinter {

    private final ObjectMapper objectMapper;

    public SchemaFingerprinter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public ObjectNode canonicalize(SchemaMetadata schema) {
        Objects.requireNonNull(schema, "schema must not be null");

        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode tables = root.putArray("tables");
        List<TableMetadata> sortedTables = new ArrayList<>(schema.tables());
        sortedTables.sort(Comparator.comparing(t -> nullToEmpty(t.name())));
        for (TableMetadata table : sortedTables) {
            ObjectNode t = tables.addObject();
            t.put("name", nullToEmpty(table.name()));

            ArrayNode columns = t.putArray("columns");
            table.columns().stream()
                    .sorted(Comparator.comparing((ColumnMetadata c) -> nullToEmpty(c.name()))
                            .thenComparing(c -> nullToEmpty(c.dataType())))
                    .forEach(c -> columns.addArray().add(nullToEmpty(c.name())).add(nullToEmpty(c.dataType())));

            t.put("constraints", table.constraintCount());
        }

        putSorted(root, "views", schema.views());
        putSorted(root, "procedures", schema.procedures());
        putSorted(root, "functions", schema.functions());
        return root;
    }

    /**
     * SHA-256 hex of the canonical form.
     */
    public String fingerprint(SchemaMetadata schema) {
        return fingerprint(canonicalize(schema));
    }

    public String fingerprint(JsonNode canonical) {
        Objects.requireNonNull(canonical, "canonical must not be null");
        try {
            byte[] bytes = objectMapper.writeValueAsString(canonical).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical schema", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void putSorted(ObjectNode root, String field, List<String> names) {
        ArrayNode arr = root.putArray(field);
        names.stream().map(SchemaFingerprinter::nullToEmpty).sorted().forEach(arr::add);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}

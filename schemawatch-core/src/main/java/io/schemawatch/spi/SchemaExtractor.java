package io.schemawatch.spi;

import io.schemawatch.schema.SchemaMetadata;

/**
 * Reads structural schema metadata over an open session.
 */
public interface SchemaExtractor {

    SchemaMetadata extract(DatabaseSession session) throws Exception;
}

package io.schemawatch.core;

import java.util.Locale;

/**
 * How a monitored database is authenticated against.
 */
public enum ConnectionMethod {
    CREDENTIALS,
    AZURE_AD,
    SERVICE_PRINCIPAL;

    public static ConnectionMethod fromCode(String code) {
        if (code == null || code.isBlank()) {
            return CREDENTIALS;
        }
        try {
            return ConnectionMethod.valueOf(code.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported connection method: " + code, e);
        }
    }
}

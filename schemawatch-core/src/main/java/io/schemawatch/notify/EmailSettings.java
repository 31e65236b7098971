package io.schemawatch.notify;

import java.util.List;

public record EmailSettings(
        boolean enabled,
        String smtpHost,
        int smtpPort,
        String username,
        String password,
        boolean startTls,
        String fromAddress,
        List<String> toAddresses
) {
    public static final int DEFAULT_SMTP_PORT = 587;

    public EmailSettings {
        toAddresses = toAddresses == null ? List.of() : List.copyOf(toAddresses);
        smtpPort = smtpPort <= 0 ? DEFAULT_SMTP_PORT : smtpPort;
    }

    public static EmailSettings disabled() {
        return new EmailSettings(false, null, DEFAULT_SMTP_PORT, null, null, true, null, List.of());
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
        return "EmailSettings[enabled=" + enabled + ", smtpHost=" + smtpHost + ", smtpPort=" + smtpPort
                + ", fromAddress=" + fromAddress + ", toAddresses=" + toAddresses + "]";
    }
}

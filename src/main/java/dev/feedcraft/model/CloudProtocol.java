package dev.feedcraft.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Notification protocols an rssCloud endpoint may advertise.
 */
public enum CloudProtocol {
    HTTP_POST("HTTP-POST"),
    XML_RPC("XML-RPC"),
    SOAP("SOAP 1.1", "soap");

    private final String label;
    private final List<String> aliases;

    CloudProtocol(String label, String... aliases) {
        this.label = label;
        this.aliases = List.of(aliases);
    }

    public String getLabel() {
        return label;
    }

    /**
     * Case-insensitive lookup by label or alias.
     */
    public static Optional<CloudProtocol> fromAttribute(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.label.toLowerCase(Locale.ROOT).equals(normalized)
                        || p.aliases.contains(normalized))
                .findFirst();
    }
}

package dev.feedcraft.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Media object attached to an item ({@code <enclosure>}).
 */
@Value
@Builder
public class Enclosure implements Validatable {

    @NonNull
    String url;

    /** Size in bytes. */
    long length;

    /** MIME type, from the {@code type} attribute. */
    @NonNull
    String mediaType;

    @Override
    public Optional<String> violation() {
        if (length < 0) {
            return Optional.of("Enclosure length must be a non-negative byte count.");
        }
        return Optional.empty();
    }
}

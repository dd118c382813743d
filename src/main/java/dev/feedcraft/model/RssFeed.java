package dev.feedcraft.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * A whole RSS 2.0 document: the {@code version} attribute of {@code <rss>} and its single channel.
 */
@Value
@Builder
public class RssFeed implements Validatable {

    public static final String SUPPORTED_VERSION = "2.0";

    @NonNull
    Channel channel;

    @NonNull
    @Builder.Default
    String version = SUPPORTED_VERSION;

    @Override
    public Optional<String> violation() {
        if (!SUPPORTED_VERSION.equals(version)) {
            return Optional.of("RSS 2.0 documents must declare version '" + SUPPORTED_VERSION + "'.");
        }
        return Optional.empty();
    }
}

package dev.feedcraft.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * rssCloud endpoint that lets subscribers register for change notifications ({@code <cloud>}).
 */
@Value
@Builder
public class Cloud implements Validatable {

    @NonNull
    String domain;

    int port;

    @NonNull
    String path;

    @NonNull
    String registerProcedure;

    /** Protocol exactly as declared in the feed. */
    @NonNull
    String protocol;

    public Optional<CloudProtocol> getProtocolType() {
        return CloudProtocol.fromAttribute(protocol);
    }

    @Override
    public Optional<String> violation() {
        if (getProtocolType().isEmpty()) {
            return Optional.of("Cloud protocol must be one of HTTP-POST, XML-RPC, or SOAP 1.1.");
        }
        return Optional.empty();
    }
}

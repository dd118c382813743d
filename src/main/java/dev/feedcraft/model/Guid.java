package dev.feedcraft.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Globally unique identifier of an item ({@code <guid>}).
 */
@Value
@Builder
public class Guid {

    @NonNull
    String value;

    /** True when {@link #value} is a permalink to the item; RSS 2.0 defaults it to true. */
    @Builder.Default
    boolean permaLink = true;
}

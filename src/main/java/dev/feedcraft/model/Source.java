package dev.feedcraft.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Channel an item was republished from ({@code <source url="...">name</source>}).
 */
@Value
@Builder
public class Source {

    @NonNull
    String name;

    @NonNull
    String url;
}

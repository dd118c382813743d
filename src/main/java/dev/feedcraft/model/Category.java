package dev.feedcraft.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Taxonomy location for a channel or an item ({@code <category>}).
 */
@Value
@Builder
public class Category {

    /** Forward-slash separated hierarchic location, e.g. {@code Grateful Dead/Live}. */
    @NonNull
    String value;

    /** Optional URI identifying the taxonomy. */
    String domain;

    public static Category of(String value) {
        return Category.builder().value(value).build();
    }
}

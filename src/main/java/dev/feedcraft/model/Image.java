package dev.feedcraft.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Channel image ({@code <image>}).
 */
@Value
@Builder
public class Image implements Validatable {

    public static final int DEFAULT_WIDTH = 88;
    public static final int DEFAULT_HEIGHT = 31;
    public static final int MAX_WIDTH = 144;
    public static final int MAX_HEIGHT = 400;

    /** URL of a GIF, JPEG or PNG. */
    @NonNull
    String url;

    /** Used as the ALT text when rendered. */
    @NonNull
    String title;

    /** Site the image links to. */
    @NonNull
    String link;

    @Builder.Default
    int width = DEFAULT_WIDTH;

    @Builder.Default
    int height = DEFAULT_HEIGHT;

    String description;

    @Override
    public Optional<String> violation() {
        if (width > MAX_WIDTH) {
            return Optional.of("Image width must not exceed " + MAX_WIDTH + " pixels.");
        }
        if (height > MAX_HEIGHT) {
            return Optional.of("Image height must not exceed " + MAX_HEIGHT + " pixels.");
        }
        return Optional.empty();
    }
}

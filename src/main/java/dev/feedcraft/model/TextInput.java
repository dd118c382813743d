package dev.feedcraft.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Text input box that can be displayed with the channel ({@code <textInput>}).
 */
@Value
@Builder
public class TextInput {

    /** Label of the Submit button. */
    @NonNull
    String title;

    @NonNull
    String description;

    /** Name of the text object in the input area. */
    @NonNull
    String name;

    /** URL of the script that processes the request. */
    @NonNull
    String link;
}

package dev.feedcraft.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * One entry of a channel ({@code <item>}). Every element is optional, but an item must carry at
 * least a title or a description.
 */
@Value
@Builder
public class Item implements Validatable {

    String title;
    String link;

    /** Synopsis or full content; may contain entity-encoded HTML. */
    String description;

    /** Email address of the author. */
    String author;

    @Singular
    List<Category> categories;

    /** URL of the comments page. */
    String comments;

    Enclosure enclosure;
    Guid guid;

    /** RFC 822 text as found in the feed; see {@link dev.feedcraft.util.RssDates}. */
    String pubDate;

    Source source;

    @Override
    public Optional<String> violation() {
        if (title == null && description == null) {
            return Optional.of("RSS items require at least a title or a description.");
        }
        return Optional.empty();
    }
}

package dev.feedcraft.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;

/**
 * Metadata and content of an RSS {@code <channel>}.
 */
@Value
@Builder
public class Channel implements Validatable {

    public static final int MAX_SKIP_HOURS = 24;
    public static final int MAX_SKIP_DAYS = 7;

    @NonNull
    String title;

    @NonNull
    String link;

    @NonNull
    String description;

    String language;
    String copyright;
    String managingEditor;
    String webMaster;
    String pubDate;
    String lastBuildDate;

    @Singular
    List<Category> categories;

    String generator;
    String docs;
    Cloud cloud;

    /** Minutes the channel may be cached before refreshing. */
    Integer ttl;

    Image image;

    /** PICS rating. */
    String rating;

    TextInput textInput;

    /** GMT hours (0-23) during which aggregators may skip the channel. */
    @Singular
    List<Integer> skipHours;

    @Singular
    List<DayOfWeek> skipDays;

    @Singular
    List<Item> items;

    /**
     * Checks the channel-level invariants in order: skip hours, skip days, ttl.
     * Items and nested structures are checked separately by the validation pass.
     */
    @Override
    public Optional<String> violation() {
        if (skipHours.size() > MAX_SKIP_HOURS) {
            return Optional.of("skipHours may contain at most " + MAX_SKIP_HOURS + " entries.");
        }
        for (Integer hour : skipHours) {
            if (hour == null || hour < 0 || hour > 23) {
                return Optional.of("Each skip hour must be between 0 and 23 inclusive.");
            }
        }
        if (skipDays.size() > MAX_SKIP_DAYS) {
            return Optional.of("skipDays may contain at most the seven days of the week.");
        }
        if (ttl != null && ttl < 0) {
            return Optional.of("ttl must be a non-negative number of minutes.");
        }
        return Optional.empty();
    }
}

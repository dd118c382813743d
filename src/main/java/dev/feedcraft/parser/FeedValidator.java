package dev.feedcraft.parser;

import dev.feedcraft.exception.FeedValidationException;
import dev.feedcraft.model.Channel;
import dev.feedcraft.model.Item;
import dev.feedcraft.model.RssFeed;

/**
 * Final invariant pass over an assembled feed.
 * <p>
 * Runs regardless of how the tree was built, so a hand-built {@link RssFeed} gets the same checks
 * as a parsed one. Stops at the first violation, in this order:
 * <ol>
 *   <li>feed version is {@code 2.0}</li>
 *   <li>skipHours: at most 24 entries, each 0-23</li>
 *   <li>skipDays: at most 7 entries</li>
 *   <li>ttl non-negative when present</li>
 *   <li>every item has a title or a description</li>
 *   <li>image, cloud and enclosures satisfy their own invariants</li>
 * </ol>
 * Unlike extraction, nothing here degrades: any violation rejects the whole feed.
 */
public class FeedValidator {

    /**
     * @throws FeedValidationException describing the first violated invariant
     */
    public void validate(RssFeed feed) {
        feed.validate();

        Channel channel = feed.getChannel();
        channel.validate();

        for (Item item : channel.getItems()) {
            item.validate();
        }

        if (channel.getImage() != null) {
            channel.getImage().validate();
        }
        if (channel.getCloud() != null) {
            channel.getCloud().validate();
        }
        for (Item item : channel.getItems()) {
            if (item.getEnclosure() != null) {
                item.getEnclosure().validate();
            }
        }
    }
}

package dev.feedcraft.parser;

import dev.feedcraft.exception.FeedValidationException;
import dev.feedcraft.model.Channel;
import dev.feedcraft.model.Cloud;
import dev.feedcraft.model.Enclosure;
import dev.feedcraft.model.Image;
import dev.feedcraft.model.Item;
import dev.feedcraft.model.RssFeed;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FeedValidator")
class FeedValidatorTest {

    private final FeedValidator validator = new FeedValidator();

    private static Channel.ChannelBuilder channel() {
        return Channel.builder().title("t").link("http://l").description("d");
    }

    private static RssFeed feed(Channel channel) {
        return RssFeed.builder().channel(channel).build();
    }

    @Test
    @DisplayName("should accept a minimal feed")
    void shouldAcceptMinimalFeed() {
        assertThatCode(() -> validator.validate(feed(channel().build()))).doesNotThrowAnyException();
    }

    @Nested
    @DisplayName("channel invariants")
    class ChannelInvariants {

        @Test
        @DisplayName("should reject a version other than 2.0")
        void shouldRejectVersion() {
            RssFeed feed = RssFeed.builder().channel(channel().build()).version("0.91").build();

            assertThatThrownBy(() -> validator.validate(feed))
                    .isInstanceOf(FeedValidationException.class)
                    .hasMessageContaining("2.0");
        }

        @Test
        @DisplayName("should reject more than 24 skip hours")
        void shouldRejectTooManyHours() {
            Channel channel = channel().skipHours(Collections.nCopies(25, 1)).build();

            assertThatThrownBy(() -> validator.validate(feed(channel)))
                    .isInstanceOf(FeedValidationException.class)
                    .hasMessageContaining("at most 24");
        }

        @Test
        @DisplayName("should reject skip hours outside 0-23")
        void shouldRejectHourOutOfRange() {
            Channel channel = channel().skipHour(24).build();

            assertThatThrownBy(() -> validator.validate(feed(channel)))
                    .isInstanceOf(FeedValidationException.class)
                    .hasMessageContaining("between 0 and 23");
        }

        @Test
        @DisplayName("should reject more than seven skip days")
        void shouldRejectTooManyDays() {
            Channel channel = channel().skipDays(Collections.nCopies(8, DayOfWeek.MONDAY)).build();

            assertThatThrownBy(() -> validator.validate(feed(channel)))
                    .isInstanceOf(FeedValidationException.class)
                    .hasMessageContaining("seven days");
        }

        @Test
        @DisplayName("should reject a negative ttl")
        void shouldRejectNegativeTtl() {
            Channel channel = channel().ttl(-1).build();

            assertThatThrownBy(() -> validator.validate(feed(channel)))
                    .isInstanceOf(FeedValidationException.class)
                    .hasMessageContaining("ttl");
        }

        @Test
        @DisplayName("should report the version before channel problems")
        void shouldReportFirstViolationInOrder() {
            RssFeed feed = RssFeed.builder()
                    .channel(channel().ttl(-5).skipHour(99).build())
                    .version("1.0")
                    .build();

            assertThatThrownBy(() -> validator.validate(feed)).hasMessageContaining("version");
        }
    }

    @Nested
    @DisplayName("items and nested structures")
    class ItemsAndStructures {

        @Test
        @DisplayName("should reject an item with neither title nor description")
        void shouldRejectEmptyItem() {
            Channel channel = channel().item(Item.builder().link("http://x").build()).build();

            assertThatThrownBy(() -> validator.validate(feed(channel)))
                    .isInstanceOf(FeedValidationException.class)
                    .hasMessageContaining("title or a description");
        }

        @Test
        @DisplayName("should reject a hand-built oversized image")
        void shouldRejectOversizedImage() {
            Image image = Image.builder().url("u").title("t").link("l").width(500).build();

            assertThatThrownBy(() -> validator.validate(feed(channel().image(image).build())))
                    .isInstanceOf(FeedValidationException.class)
                    .hasMessageContaining("width");
        }

        @Test
        @DisplayName("should reject a hand-built cloud with an unknown protocol")
        void shouldRejectBadCloud() {
            Cloud cloud = Cloud.builder().domain("d").port(80).path("/").registerProcedure("p").protocol("ftp").build();

            assertThatThrownBy(() -> validator.validate(feed(channel().cloud(cloud).build())))
                    .isInstanceOf(FeedValidationException.class)
                    .hasMessageContaining("protocol");
        }

        @Test
        @DisplayName("should reject a hand-built enclosure with a negative length")
        void shouldRejectNegativeEnclosure() {
            Item item = Item.builder()
                    .title("t")
                    .enclosure(Enclosure.builder().url("u").length(-10).mediaType("audio/mpeg").build())
                    .build();

            assertThatThrownBy(() -> validator.validate(feed(channel().item(item).build())))
                    .isInstanceOf(FeedValidationException.class)
                    .hasMessageContaining("non-negative");
        }
    }
}

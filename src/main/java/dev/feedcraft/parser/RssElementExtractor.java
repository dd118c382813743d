package dev.feedcraft.parser;

import dev.feedcraft.exception.MissingElementException;
import dev.feedcraft.model.Category;
import dev.feedcraft.model.Channel;
import dev.feedcraft.model.Cloud;
import dev.feedcraft.model.Enclosure;
import dev.feedcraft.model.Guid;
import dev.feedcraft.model.Image;
import dev.feedcraft.model.Item;
import dev.feedcraft.model.Source;
import dev.feedcraft.model.TextInput;
import dev.feedcraft.model.Validatable;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static dev.feedcraft.util.XmlUtil.attribute;
import static dev.feedcraft.util.XmlUtil.children;
import static dev.feedcraft.util.XmlUtil.firstChild;
import static dev.feedcraft.util.XmlUtil.text;

/**
 * Per-element extraction rules for RSS 2.0.
 * <p>
 * Failure policy is asymmetric:
 * <ul>
 *   <li>the channel skeleton (title, link, description) is required: a missing or empty element
 *       throws {@link MissingElementException}</li>
 *   <li>structured optionals (cloud, image, textInput, enclosure, guid, source) come back as
 *       {@link Optional#empty()} when a required part is missing, a number does not parse, or the
 *       structure fails its own invariant check; the rest of the channel still parses</li>
 *   <li>bounded lists (skipHours, skipDays) drop bad entries one by one</li>
 *   <li>items with neither title nor description are dropped</li>
 * </ul>
 * Keep that split when changing this class: channel- and item-level violations abort the parse in
 * {@link FeedValidator}, optional structures never do.
 * <p>
 * Stateless and safe to share between threads.
 */
@Slf4j
public class RssElementExtractor {

    private static final Pattern STRICT_INTEGER = Pattern.compile("[+-]?[0-9]+");

    private static final Set<String> FALSE_FLAGS = Set.of("false", "0", "no");

    /**
     * Build the channel from its {@code <channel>} element.
     *
     * @throws MissingElementException if title, link or description is missing or empty
     */
    public Channel channel(Element channel) {
        return Channel.builder()
                .title(requiredText(channel, "title"))
                .link(requiredText(channel, "link"))
                .description(requiredText(channel, "description"))
                .language(optionalText(channel, "language"))
                .copyright(optionalText(channel, "copyright"))
                .managingEditor(optionalText(channel, "managingEditor"))
                .webMaster(optionalText(channel, "webMaster"))
                .pubDate(optionalText(channel, "pubDate"))
                .lastBuildDate(optionalText(channel, "lastBuildDate"))
                .categories(categories(channel))
                .generator(optionalText(channel, "generator"))
                .docs(optionalText(channel, "docs"))
                .cloud(cloud(channel).orElse(null))
                .ttl(parseInteger(optionalText(channel, "ttl")).orElse(null))
                .image(image(channel).orElse(null))
                .rating(optionalText(channel, "rating"))
                .textInput(textInput(channel).orElse(null))
                .skipHours(skipHours(channel))
                .skipDays(skipDays(channel))
                .items(items(channel))
                .build();
    }

    public String requiredText(Element parent, String name) {
        String value = text(firstChild(parent, name));
        if (value == null) {
            throw new MissingElementException(name, "Missing required <" + name + "> element in RSS channel.");
        }
        return value;
    }

    /**
     * @return trimmed text of the first matching child; {@code null} when absent or empty
     */
    public String optionalText(Element parent, String name) {
        return text(firstChild(parent, name));
    }

    public List<Category> categories(Element parent) {
        List<Category> categories = new ArrayList<>();
        for (Element category : children(parent, "category")) {
            String value = text(category);
            if (value == null) {
                continue;
            }
            categories.add(Category.builder()
                    .value(value)
                    .domain(attribute(category, "domain"))
                    .build());
        }
        return categories;
    }

    public Optional<Cloud> cloud(Element channel) {
        Element cloud = firstChild(channel, "cloud");
        if (cloud == null) {
            return Optional.empty();
        }
        String domain = attribute(cloud, "domain");
        String path = attribute(cloud, "path");
        String registerProcedure = attribute(cloud, "registerProcedure");
        String protocol = attribute(cloud, "protocol");
        Optional<Integer> port = parseInteger(attribute(cloud, "port"));
        if (domain == null || path == null || registerProcedure == null || protocol == null || port.isEmpty()) {
            return dropped("cloud", "missing or malformed attribute");
        }
        return keepIfValid("cloud", Cloud.builder()
                .domain(domain)
                .port(port.get())
                .path(path)
                .registerProcedure(registerProcedure)
                .protocol(protocol)
                .build());
    }

    public Optional<Image> image(Element channel) {
        Element image = firstChild(channel, "image");
        if (image == null) {
            return Optional.empty();
        }
        String url = optionalText(image, "url");
        String title = optionalText(image, "title");
        String link = optionalText(image, "link");
        if (url == null || title == null || link == null) {
            return dropped("image", "url, title and link are required");
        }
        return keepIfValid("image", Image.builder()
                .url(url)
                .title(title)
                .link(link)
                .width(dimension(optionalText(image, "width"), Image.DEFAULT_WIDTH))
                .height(dimension(optionalText(image, "height"), Image.DEFAULT_HEIGHT))
                .description(optionalText(image, "description"))
                .build());
    }

    public Optional<TextInput> textInput(Element channel) {
        Element textInput = firstChild(channel, "textInput");
        if (textInput == null) {
            return Optional.empty();
        }
        String title = optionalText(textInput, "title");
        String description = optionalText(textInput, "description");
        String name = optionalText(textInput, "name");
        String link = optionalText(textInput, "link");
        if (title == null || description == null || name == null || link == null) {
            return dropped("textInput", "title, description, name and link are required");
        }
        return Optional.of(TextInput.builder()
                .title(title)
                .description(description)
                .name(name)
                .link(link)
                .build());
    }

    /**
     * Valid {@code <hour>} values (0-23) in document order; anything else is skipped.
     */
    public List<Integer> skipHours(Element channel) {
        List<Integer> hours = new ArrayList<>();
        Element skipHours = firstChild(channel, "skipHours");
        if (skipHours == null) {
            return hours;
        }
        for (Element hour : children(skipHours, "hour")) {
            Optional<Integer> value = parseInteger(text(hour));
            if (value.isPresent() && value.get() >= 0 && value.get() <= 23) {
                hours.add(value.get());
            } else {
                log.debug("Skipping invalid <hour> entry");
            }
        }
        return hours;
    }

    /**
     * Recognised English weekday names in document order; anything else is skipped.
     */
    public List<DayOfWeek> skipDays(Element channel) {
        List<DayOfWeek> days = new ArrayList<>();
        Element skipDays = firstChild(channel, "skipDays");
        if (skipDays == null) {
            return days;
        }
        for (Element day : children(skipDays, "day")) {
            Optional<DayOfWeek> value = parseWeekday(text(day));
            if (value.isPresent()) {
                days.add(value.get());
            } else {
                log.debug("Skipping unrecognised <day> entry");
            }
        }
        return days;
    }

    public List<Item> items(Element channel) {
        List<Item> items = new ArrayList<>();
        for (Element item : children(channel, "item")) {
            item(item).ifPresent(items::add);
        }
        return items;
    }

    /**
     * @return the item, or empty when it has neither a title nor a description
     */
    public Optional<Item> item(Element item) {
        String title = optionalText(item, "title");
        String description = optionalText(item, "description");
        if (title == null && description == null) {
            return dropped("item", "neither title nor description present");
        }
        return Optional.of(Item.builder()
                .title(title)
                .link(optionalText(item, "link"))
                .description(description)
                .author(optionalText(item, "author"))
                .categories(categories(item))
                .comments(optionalText(item, "comments"))
                .enclosure(enclosure(item).orElse(null))
                .guid(guid(item).orElse(null))
                .pubDate(optionalText(item, "pubDate"))
                .source(source(item).orElse(null))
                .build());
    }

    public Optional<Guid> guid(Element item) {
        Element guid = firstChild(item, "guid");
        if (guid == null) {
            return Optional.empty();
        }
        String value = text(guid);
        if (value == null) {
            return dropped("guid", "empty value");
        }
        return Optional.of(Guid.builder()
                .value(value)
                .permaLink(parsePermaLink(attribute(guid, "isPermaLink")))
                .build());
    }

    public Optional<Enclosure> enclosure(Element item) {
        Element enclosure = firstChild(item, "enclosure");
        if (enclosure == null) {
            return Optional.empty();
        }
        String url = attribute(enclosure, "url");
        String mediaType = attribute(enclosure, "type");
        Optional<Long> length = parseLong(attribute(enclosure, "length"));
        if (url == null || mediaType == null || length.isEmpty()) {
            return dropped("enclosure", "url, length and type are required");
        }
        return keepIfValid("enclosure", Enclosure.builder()
                .url(url)
                .length(length.get())
                .mediaType(mediaType)
                .build());
    }

    public Optional<Source> source(Element item) {
        Element source = firstChild(item, "source");
        if (source == null) {
            return Optional.empty();
        }
        String url = attribute(source, "url");
        String name = text(source);
        if (url == null || url.isEmpty() || name == null) {
            return dropped("source", "url and name are required");
        }
        return Optional.of(Source.builder().name(name).url(url).build());
    }

    /**
     * Strict base-10 integer. Signs are allowed; whitespace around the digits is trimmed;
     * anything else, including overflow, is empty.
     */
    static Optional<Integer> parseInteger(String text) {
        return parseLong(text)
                .filter(v -> v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE)
                .map(Long::intValue);
    }

    /**
     * Image width or height; absent, unparseable and zero values take the default.
     */
    static int dimension(String text, int defaultValue) {
        return parseInteger(text).filter(v -> v != 0).orElse(defaultValue);
    }

    static Optional<Long> parseLong(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (!STRICT_INTEGER.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * {@code false}, {@code 0} and {@code no} (any case) turn the flag off; anything else,
     * including an absent attribute, keeps the RSS default of {@code true}.
     */
    static boolean parsePermaLink(String flag) {
        return flag == null || !FALSE_FLAGS.contains(flag.toLowerCase(Locale.ROOT));
    }

    static Optional<DayOfWeek> parseWeekday(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String upper = text.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().equals(upper)) {
                return Optional.of(day);
            }
        }
        return Optional.empty();
    }

    private <T extends Validatable> Optional<T> keepIfValid(String element, T value) {
        Optional<String> violation = value.violation();
        if (violation.isPresent()) {
            return dropped(element, violation.get());
        }
        return Optional.of(value);
    }

    private static <T> Optional<T> dropped(String element, String reason) {
        log.debug("Dropping <{}>: {}", element, reason);
        return Optional.empty();
    }
}

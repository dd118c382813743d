package dev.feedcraft.config;

import dev.feedcraft.metrics.FeedParseMetrics;
import dev.feedcraft.parser.RssParser;
import dev.feedcraft.parser.SafeDocumentLoader;
import dev.feedcraft.service.FeedParsingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.time.ZoneOffset;

/**
 * Spring wiring for the loader, parser, metrics and service. Every bean backs off when the
 * application defines its own.
 * <p>
 * Properties:
 * <ul>
 *   <li>{@code feedcraft.rss.max-document-length}: largest accepted document in characters, 0 for no limit</li>
 *   <li>{@code feedcraft.rss.default-zone}: offset applied to item dates without a zone</li>
 * </ul>
 */
@AutoConfiguration
@Slf4j
public class RssParserConfig {

    @Bean
    @ConditionalOnMissingBean
    public SafeDocumentLoader safeDocumentLoader(
            @Value("${feedcraft.rss.max-document-length:" + SafeDocumentLoader.DEFAULT_MAX_DOCUMENT_LENGTH + "}")
            int maxDocumentLength) {
        return new SafeDocumentLoader(maxDocumentLength);
    }

    @Bean
    @ConditionalOnMissingBean
    public RssParser rssParser(SafeDocumentLoader safeDocumentLoader) {
        log.info("Configuring RSS parser (maxDocumentLength={})", safeDocumentLoader.getMaxDocumentLength());
        return new RssParser(safeDocumentLoader);
    }

    /**
     * Uses the application's {@link MeterRegistry} when present; otherwise meters go to a private
     * in-memory registry.
     */
    @Bean
    @ConditionalOnMissingBean
    public FeedParseMetrics feedParseMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new FeedParseMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public FeedParsingService feedParsingService(
            RssParser rssParser,
            FeedParseMetrics feedParseMetrics,
            @Value("${feedcraft.rss.default-zone:Z}") String defaultZone) {
        return new FeedParsingService(rssParser, feedParseMetrics, ZoneOffset.of(defaultZone));
    }
}

package com.screening.config;

import com.screening.engine.Classifier;
import com.screening.engine.ListSource;
import com.screening.engine.NameTokenMatcher;
import com.screening.engine.ScreeningEngine;
import com.screening.engine.SourceMatcher;
import com.screening.engine.TaxIdMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the screening pipeline: one matcher per list source, the classifier
 * with the configured hard-block sources, and the engine on top.
 */
@Configuration
@EnableConfigurationProperties(ScreeningProperties.class)
@Slf4j
public class ScreeningEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Classifier classifier(ScreeningProperties properties) {
        log.info("Hard-block sources: {}", properties.getHardBlockSources());
        return new Classifier(properties.getHardBlockSources());
    }

    @Bean
    public ScreeningEngine screeningEngine(ScreeningProperties properties, Classifier classifier, Clock clock) {
        return new ScreeningEngine(sourceMatchers(properties.getMaxEntriesPerSource()), classifier, clock);
    }

    public static List<SourceMatcher> sourceMatchers(int maxEntries) {
        List<SourceMatcher> matchers = new ArrayList<>();
        for (ListSource source : ListSource.values()) {
            matchers.add(source == ListSource.DEREGISTERED_ENTITY
                    ? new TaxIdMatcher(maxEntries)
                    : new NameTokenMatcher(source, maxEntries));
        }
        return matchers;
    }
}

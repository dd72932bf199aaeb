package io.fetch4j.core;

import io.fetch4j.Extractor;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public class ExtractorRegistry {

    private final Map<FetchStrategy, Extractor> extractorsByStrategy;

    public ExtractorRegistry(List<Extractor> extractors) {
        this.extractorsByStrategy = extractors.stream()
                .collect(Collectors.toUnmodifiableMap(
                        Extractor::strategy,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate Extractor for strategy: " + a.strategy());
                        }
                ));
    }

    public Extractor getRequired(FetchStrategy strategy) {
        Extractor extractor = extractorsByStrategy.get(strategy);
        if (extractor == null) {
            throw new IllegalStateException("No Extractor registered for strategy: " + strategy);
        }
        return extractor;
    }

    public boolean supports(FetchStrategy strategy) {
        return extractorsByStrategy.containsKey(strategy);
    }
}

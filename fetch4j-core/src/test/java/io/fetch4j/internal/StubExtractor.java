package io.fetch4j.internal;

import io.fetch4j.Extractor;
import io.fetch4j.core.ExtractionResult;
import io.fetch4j.core.FetchException;
import io.fetch4j.core.FetchStrategy;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extractor whose outcome per call is scripted by the test.
 */
class StubExtractor implements Extractor {

    @FunctionalInterface
    interface Behavior {
        ExtractionResult fetch(String target, int call) throws FetchException;
    }

    private final FetchStrategy strategy;
    private final Behavior behavior;
    private final AtomicInteger calls = new AtomicInteger();
    private final Map<String, AtomicInteger> callsByTarget = new ConcurrentHashMap<>();

    StubExtractor(FetchStrategy strategy, Behavior behavior) {
        this.strategy = strategy;
        this.behavior = behavior;
    }

    static StubExtractor succeeding(FetchStrategy strategy) {
        return new StubExtractor(strategy, (target, call) -> page(target, strategy));
    }

    static ExtractionResult page(String target, FetchStrategy strategy) {
        return ExtractionResult.success(target, "Title of " + target, "body", Map.of("links", List.of()), strategy);
    }

    @Override
    public FetchStrategy strategy() {
        return strategy;
    }

    @Override
    public ExtractionResult fetch(String target) throws FetchException {
        calls.incrementAndGet();
        int call = callsByTarget.computeIfAbsent(target, t -> new AtomicInteger()).incrementAndGet();
        return behavior.fetch(target, call);
    }

    int calls() {
        return calls.get();
    }

    int calls(String target) {
        AtomicInteger n = callsByTarget.get(target);
        return n == null ? 0 : n.get();
    }
}

package com.storefront.scraper.service.core;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * <h2>CategoryExtractor</h2>
 *
 * <p>Base class for the per-category heuristics (catalog, policies, FAQs…).
 * Subclasses implement {@link #doExtract(ExtractionRun)}; callers only ever
 * use {@link #extract(ExtractionRun)}, which guarantees the category fails
 * on its own:</p>
 *
 * <ul>
 *   <li>an exception thrown while assembling or running the pipeline,</li>
 *   <li>an error signal from the pipeline,</li>
 *   <li>an empty completion (page unavailable)</li>
 * </ul>
 *
 * <p>all end up as {@link #empty()}. The returned {@link Mono} always emits
 * exactly one value and never errors, which is what lets the engine join
 * eight of them without one taking the others down.</p>
 *
 * @param <R> raw result type of the category
 */
@Slf4j
public abstract class CategoryExtractor<R> {

    /**
     * @return short category name used in logs, e.g. {@code "faqs"}
     */
    public abstract String category();

    /**
     * Category logic. May error or complete empty; both are absorbed.
     *
     * @param run current run
     * @return raw records for this category
     */
    protected abstract Mono<R> doExtract(ExtractionRun run);

    /**
     * @return the value reported when nothing could be extracted
     */
    protected abstract R empty();

    /**
     * Runs {@link #doExtract(ExtractionRun)} with failure isolation.
     *
     * @param run current run
     * @return a {@link Mono} that emits one value and never errors
     */
    public Mono<R> extract(final ExtractionRun run) {
        return Mono.defer(() -> doExtract(run))
                .onErrorResume(ex -> {
                    log.error("Error extracting {} for {}: {}", category(), run.getBaseUrl(), ex.toString(), ex);
                    return Mono.fromSupplier(this::empty);
                })
                .switchIfEmpty(Mono.fromSupplier(this::empty));
    }
}

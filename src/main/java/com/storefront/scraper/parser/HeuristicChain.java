package com.storefront.scraper.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered list of heuristics sharing one signature
 * {@code (input) -> Optional<result>}. Strategies are tried in the order they
 * were added; the first non-empty result wins and the rest are not evaluated.
 *
 * <pre>{@code
 * HeuristicChain<Element, String> image = HeuristicChain.<Element, String>builder()
 *         .then(a -> srcOf(a.selectFirst("img")))
 *         .then(a -> srcOf(a.parent()))
 *         .build();
 * Optional<String> src = image.first(anchor);
 * }</pre>
 *
 * @param <I> input handed to every strategy
 * @param <R> result type
 */
public final class HeuristicChain<I, R> {

    private final List<Function<I, Optional<R>>> strategies;

    private HeuristicChain(final List<Function<I, Optional<R>>> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public static <I, R> Builder<I, R> builder() {
        return new Builder<>();
    }

    /**
     * @param input value passed to each strategy
     * @return the first strategy result that is present, or empty
     */
    public Optional<R> first(final I input) {
        for (Function<I, Optional<R>> strategy : strategies) {
            Optional<R> result = strategy.apply(input);
            if (result != null && result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    public static final class Builder<I, R> {

        private final List<Function<I, Optional<R>>> strategies = new ArrayList<>();

        private Builder() {
        }

        public Builder<I, R> then(final Function<I, Optional<R>> strategy) {
            strategies.add(strategy);
            return this;
        }

        public HeuristicChain<I, R> build() {
            return new HeuristicChain<>(strategies);
        }
    }
}

package com.gastrofeed.catalog.service.category;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Resolver that publishes each request as a {@link Pending} item and waits for whoever
 * subscribed to {@link #requests()} (a GUI dialog, a console prompt) to answer it.
 *
 * <p>Requests emitted before the first subscriber are buffered.
 */
public class QueuedCategoryResolver implements CategoryResolver {
    private static final Logger log = LoggerFactory.getLogger(QueuedCategoryResolver.class);

    private final Sinks.Many<Pending> sink = Sinks.many().multicast().onBackpressureBuffer();

    public Flux<Pending> requests() {
        return sink.asFlux();
    }

    @Override
    public Mono<String> resolve(CategoryResolutionRequest request) {
        return Mono.defer(() -> {
            Pending pending = new Pending(request);
            Sinks.EmitResult result = sink.tryEmitNext(pending);
            if (result.isFailure()) {
                log.warn("Could not queue category request for '{}': {}", request.rawCategory(), result);
                return Mono.empty();
            }
            return pending.answer();
        });
    }

    /**
     * One outstanding question. Answer it exactly once with {@link #complete} or
     * {@link #decline}.
     */
    public static class Pending {
        private final CategoryResolutionRequest request;
        private final Sinks.One<String> answer = Sinks.one();

        Pending(CategoryResolutionRequest request) {
            this.request = request;
        }

        public CategoryResolutionRequest getRequest() {
            return request;
        }

        public void complete(String category) {
            answer.tryEmitValue(category);
        }

        public void decline() {
            answer.tryEmitEmpty();
        }

        Mono<String> answer() {
            return answer.asMono();
        }
    }
}

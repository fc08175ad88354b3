package com.commerceforecast.analysis.backend;

import reactor.core.publisher.Mono;

/**
 * Text-generation service behind every analysis unit.
 *
 * <p>Implementations emit exactly one {@link GenerationResponse} or fail with a
 * {@link com.commerceforecast.common.exception.BackendException}. They are called
 * concurrently during the advisory stage and must be thread-safe.
 */
@FunctionalInterface
public interface GenerationBackend {

    Mono<GenerationResponse> generate(GenerationRequest request);
}

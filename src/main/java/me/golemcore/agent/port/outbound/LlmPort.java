package me.golemcore.agent.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Chat completion backend used by the tool loop. A request carries the
 * conversation and the tool schemas offered for this round; the answer is
 * either text, tool calls, or both.
 *
 * <p>
 * Transport and API failures surface as
 * {@link me.golemcore.agent.domain.exception.LlmProviderException}, either
 * completing the future exceptionally or signalled through the flux.
 */
public interface LlmPort {

    /**
     * Short provider name shown by {@code /model} and in logs.
     */
    String getProviderId();

    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Streams the answer as incremental chunks. Backends without native
     * streaming replay the complete {@link #chat} response as one finished
     * chunk, so callers can always consume a flux.
     */
    default Flux<LlmChunk> chatStream(LlmRequest request) {
        return Mono.fromFuture(() -> chat(request))
                .map(LlmChunk::completeOf)
                .flux();
    }

    /**
     * Whether {@link #chatStream} delivers text as it is generated rather than
     * in one piece.
     */
    default boolean supportsStreaming() {
        return false;
    }

    /**
     * Models a session may switch to with {@code /model <name>}. Empty means
     * any name is accepted.
     */
    default List<String> getSupportedModels() {
        return List.of();
    }

    boolean isAvailable();
}

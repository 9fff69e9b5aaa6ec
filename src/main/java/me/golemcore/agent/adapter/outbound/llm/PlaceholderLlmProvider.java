package me.golemcore.agent.adapter.outbound.llm;

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
import me.golemcore.agent.domain.model.LlmUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Provider {@code "none"}: answers every request with a fixed notice and never
 * calls tools, so a turn ends after one round. Used when no real backend is
 * configured.
 */
@Component
@Slf4j
public class PlaceholderLlmProvider implements LlmProvider {

    static final String PROVIDER_ID = "none";
    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] Request for model {} ignored, no provider configured", request.getModel());
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(PLACEHOLDER)
                .model(PROVIDER_ID)
                .finishReason(LlmChunk.FINISH_STOP)
                .usage(LlmUsage.of(0, 0))
                .build());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}

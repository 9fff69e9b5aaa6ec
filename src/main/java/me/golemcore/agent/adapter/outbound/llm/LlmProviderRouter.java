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
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The {@link LlmPort} the rest of the application sees. Picks one
 * {@link LlmProvider} by {@code agent.llm.provider} at startup and forwards
 * every call to it. An unknown provider name falls back to the placeholder
 * provider instead of failing startup, so the CLI still opens and slash
 * commands keep working.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmProviderRouter implements LlmPort {

    private final AgentProperties properties;
    private final List<LlmProvider> providers;

    private LlmProvider selected;

    @PostConstruct
    public void selectProvider() {
        Map<String, LlmProvider> byId = new LinkedHashMap<>();
        for (LlmProvider provider : providers) {
            byId.put(provider.getProviderId(), provider);
        }
        AgentProperties.LlmProperties settings = properties.getLlm();
        String wanted = settings.getProvider();
        selected = byId.get(wanted);
        if (selected == null) {
            selected = byId.getOrDefault(PlaceholderLlmProvider.PROVIDER_ID, new PlaceholderLlmProvider());
            log.warn("[LLM] Unknown provider '{}', known: {}; falling back to '{}'",
                    wanted, byId.keySet(), selected.getProviderId());
            return;
        }
        log.info("[LLM] Provider '{}' with model {}", wanted, settings.getModel());
        for (String problem : selected.checkSettings(settings)) {
            log.warn("[LLM] {}", problem);
        }
    }

    LlmProvider getSelected() {
        return selected;
    }

    @Override
    public String getProviderId() {
        return selected.getProviderId();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return selected.chat(request);
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return selected.chatStream(request);
    }

    @Override
    public boolean supportsStreaming() {
        return selected.supportsStreaming();
    }

    @Override
    public List<String> getSupportedModels() {
        return selected.getSupportedModels();
    }

    @Override
    public boolean isAvailable() {
        return selected.isAvailable();
    }
}

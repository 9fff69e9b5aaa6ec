package me.golemcore.agent.infrastructure.event;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ToolExecutionEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes tool lifecycle events to Spring {@code @EventListener} methods.
 *
 * <p>
 * Delivery is synchronous, so observers see the executions of a turn in the
 * order they happen. A failing listener is logged and never fails the tool
 * call that produced the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus {

    private final ApplicationEventPublisher eventPublisher;

    public void publish(ToolExecutionEvent event) {
        log.trace("[Events] {} {} ({})", event.toolName(), event.status(), event.executionId());
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("[Events] Listener failed for {} event of '{}': {}", event.status(), event.toolName(),
                    e.getMessage(), e);
        }
    }
}

package me.golemcore.agent.adapter.outbound.confirmation;

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

import me.golemcore.agent.domain.model.ConfirmationDecision;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.port.outbound.ConfirmationPort;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Approves every request. Used for headless runs where nobody can answer a
 * prompt.
 */
@Slf4j
public class AutoApproveConfirmationAdapter implements ConfirmationPort {

    @Override
    public CompletableFuture<ConfirmationDecision> requestConfirmation(ConfirmationRequest request) {
        log.info("[Confirmation] Auto-approving '{}': {}", request.toolId(), request.description());
        return CompletableFuture.completedFuture(ConfirmationDecision.APPROVED);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}

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

import me.golemcore.agent.domain.model.ConfirmationDecision;
import me.golemcore.agent.domain.model.ConfirmationRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Asks whoever drives the session whether a gated tool call may run. The
 * registry consults it after validation and only for tools the confirmation
 * policy marks as needing approval; a denial turns into a
 * {@code CONFIRMATION_DENIED} result without running the tool.
 */
public interface ConfirmationPort {

    /**
     * Completes with {@link ConfirmationDecision#APPROVED_FOR_SESSION} when the
     * user wants the whole confirmation group approved for the rest of the
     * session.
     */
    CompletableFuture<ConfirmationDecision> requestConfirmation(ConfirmationRequest request);

    /**
     * False when nobody can answer. Gated calls are then denied without asking.
     */
    boolean isAvailable();
}

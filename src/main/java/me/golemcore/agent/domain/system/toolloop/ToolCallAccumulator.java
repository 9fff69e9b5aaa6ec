package me.golemcore.agent.domain.system.toolloop;

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

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolCallDelta;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reassembles streamed tool calls from their fragments.
 *
 * <p>
 * A fragment belongs to the call with the same stream index; when the provider
 * omits the index, the call id is used instead, and a fragment carrying
 * neither continues the most recently opened call. Argument fragments are
 * concatenated strictly in arrival order and never parsed here. Calls are
 * returned in the order they were first seen.
 */
class ToolCallAccumulator {

    private static final String INDEX_KEY = "index:";
    private static final String ID_KEY = "id:";

    private final List<PendingCall> calls = new ArrayList<>();
    private final Map<String, PendingCall> callsByKey = new HashMap<>();
    private PendingCall lastOpened;

    void accept(ToolCallDelta delta) {
        PendingCall call = resolve(delta);
        if (delta.getId() != null && !delta.getId().isEmpty() && call.id == null) {
            call.id = delta.getId();
            callsByKey.putIfAbsent(ID_KEY + call.id, call);
        }
        if (delta.getName() != null && !delta.getName().isEmpty() && call.name == null) {
            call.name = delta.getName();
        }
        if (delta.getArgumentsFragment() != null) {
            call.arguments.append(delta.getArgumentsFragment());
        }
    }

    boolean isEmpty() {
        return calls.isEmpty();
    }

    /**
     * Freezes every open call. Calls without an id get a generated one so the
     * result message can still be correlated.
     */
    List<Message.ToolCall> finish() {
        List<Message.ToolCall> finished = new ArrayList<>(calls.size());
        for (PendingCall call : calls) {
            finished.add(Message.ToolCall.builder()
                    .id(call.id != null ? call.id : "call_" + UUID.randomUUID().toString().replace("-", ""))
                    .name(call.name)
                    .arguments(call.arguments.toString())
                    .build());
        }
        calls.clear();
        callsByKey.clear();
        lastOpened = null;
        return finished;
    }

    private PendingCall resolve(ToolCallDelta delta) {
        String key;
        if (delta.getIndex() != null) {
            key = INDEX_KEY + delta.getIndex();
        } else if (delta.getId() != null && !delta.getId().isEmpty()) {
            key = ID_KEY + delta.getId();
        } else if (lastOpened != null) {
            return lastOpened;
        } else {
            key = INDEX_KEY + 0;
        }
        PendingCall call = callsByKey.get(key);
        if (call == null) {
            call = new PendingCall();
            callsByKey.put(key, call);
            calls.add(call);
        }
        lastOpened = call;
        return call;
    }

    private static final class PendingCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}

package me.golemcore.agent.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Incremental piece of a streaming response. Any field may be absent; a chunk
 * with a finish reason closes the response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmChunk {

    public static final String FINISH_STOP = "stop";
    public static final String FINISH_TOOL_CALLS = "tool_calls";

    private String text;
    private List<ToolCallDelta> toolCallDeltas;
    private String finishReason;
    private LlmUsage usage;
    private boolean done;

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean hasToolCallDeltas() {
        return toolCallDeltas != null && !toolCallDeltas.isEmpty();
    }

    public boolean isFinished() {
        return done || finishReason != null;
    }

    /**
     * Replays a complete response as a single closing chunk. Each tool call
     * becomes one delta carrying its full arguments.
     */
    public static LlmChunk completeOf(LlmResponse response) {
        List<ToolCallDelta> deltas = new ArrayList<>();
        if (response.hasToolCalls()) {
            for (int i = 0; i < response.getToolCalls().size(); i++) {
                Message.ToolCall call = response.getToolCalls().get(i);
                deltas.add(ToolCallDelta.builder()
                        .index(i)
                        .id(call.getId())
                        .name(call.getName())
                        .argumentsFragment(call.getArguments())
                        .build());
            }
        }
        String finish = response.getFinishReason();
        if (finish == null) {
            finish = deltas.isEmpty() ? FINISH_STOP : FINISH_TOOL_CALLS;
        }
        return LlmChunk.builder()
                .text(response.getContent())
                .toolCallDeltas(deltas)
                .finishReason(finish)
                .usage(response.getUsage())
                .done(true)
                .build();
    }
}

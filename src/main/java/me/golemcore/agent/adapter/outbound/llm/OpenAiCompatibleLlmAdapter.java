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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.exception.LlmProviderException;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolCallDelta;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter for OpenAI-compatible chat completions APIs using OkHttp.
 *
 * <p>
 * Works with any endpoint that speaks the {@code /chat/completions} protocol
 * (xAI, OpenAI, local inference servers, proxies). Tools are advertised as
 * functions with {@code tool_choice: auto}.
 *
 * <p>
 * Streaming reads the server-sent event stream line by line:
 *
 * <pre>
 * data: {"choices":[{"index":0,"delta":{"content":"Hel"}}]}
 * data: {"choices":[{"index":0,"delta":{"tool_calls":[{"index":0,"function":{"arguments":"{\"pa"}}]}}]}
 * data: [DONE]
 * </pre>
 *
 * Each data frame becomes one {@link LlmChunk}; tool call fragments are passed
 * through unassembled. Cancelling the subscription cancels the HTTP call.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code agent.llm.base-url} - Base URL of the API
 * <li>{@code agent.llm.api-key} - API key for authentication (optional for
 * local servers)
 * </ul>
 *
 * <p>
 * Provider ID: {@code "openai"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiCompatibleLlmAdapter implements LlmProvider {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE = "[DONE]";
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final AgentProperties properties;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    @Override
    public String getProviderId() {
        return "openai";
    }

    @Override
    public List<String> checkSettings(AgentProperties.LlmProperties settings) {
        List<String> problems = new ArrayList<>();
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            problems.add("No API key configured (agent.llm.api-key), requests are sent without authorization");
        }
        if (!isAvailable()) {
            problems.add("No base URL configured (agent.llm.base-url)");
        }
        return problems;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            Request httpRequest = buildHttpRequest(request, false);
            try (Response response = okHttpClient.newCall(httpRequest).execute()) {
                ResponseBody body = response.body();
                String text = body != null ? body.string() : "";
                if (!response.isSuccessful()) {
                    throw apiError(response.code(), text);
                }
                return convertResponse(objectMapper.readValue(text, ChatCompletionResponse.class));
            } catch (IOException e) {
                log.error("Provider request failed", e);
                throw new LlmProviderException("Provider API error: " + e.getMessage(), -1, e);
            }
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.<LlmChunk>create(sink -> {
            Call call = okHttpClient.newCall(buildHttpRequest(request, true));
            sink.onCancel(call::cancel);
            try (Response response = call.execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful()) {
                    sink.error(apiError(response.code(), body != null ? body.string() : ""));
                    return;
                }
                if (body != null) {
                    readEvents(body.source(), sink);
                }
                sink.complete();
            } catch (IOException e) {
                if (call.isCanceled()) {
                    log.debug("Provider stream cancelled");
                    sink.complete();
                    return;
                }
                log.error("Provider stream failed", e);
                sink.error(new LlmProviderException("Provider API error: " + e.getMessage(), -1, e));
            } catch (LlmProviderException e) {
                log.error("Provider stream failed: {}", e.getMessage());
                sink.error(e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public List<String> getSupportedModels() {
        return List.copyOf(properties.getLlm().getModels());
    }

    @Override
    public boolean isAvailable() {
        String baseUrl = properties.getLlm().getBaseUrl();
        return baseUrl != null && !baseUrl.isBlank();
    }

    // ==================== streaming ====================

    private void readEvents(BufferedSource source, FluxSink<LlmChunk> sink) throws IOException {
        while (!sink.isCancelled()) {
            String line = source.readUtf8Line();
            if (line == null) {
                return;
            }
            if (!line.startsWith(SSE_DATA_PREFIX)) {
                continue;
            }
            String data = line.substring(SSE_DATA_PREFIX.length()).strip();
            if (data.isEmpty()) {
                continue;
            }
            if (SSE_DONE.equals(data)) {
                return;
            }
            sink.next(parseChunk(data));
        }
    }

    LlmChunk parseChunk(String data) {
        StreamChunk frame;
        try {
            frame = objectMapper.readValue(data, StreamChunk.class);
        } catch (JsonProcessingException e) {
            throw new LlmProviderException("Provider API error: malformed stream frame: "
                    + e.getOriginalMessage(), -1, e);
        }

        LlmChunk.LlmChunkBuilder chunk = LlmChunk.builder();
        if (frame.getUsage() != null) {
            chunk.usage(toUsage(frame.getUsage()));
        }
        if (frame.getChoices() != null && !frame.getChoices().isEmpty()) {
            StreamChoice choice = frame.getChoices().get(0);
            chunk.finishReason(choice.getFinishReason());
            ApiMessage delta = choice.getDelta();
            if (delta != null) {
                chunk.text(delta.getContent());
                if (delta.getToolCalls() != null && !delta.getToolCalls().isEmpty()) {
                    List<ToolCallDelta> deltas = new ArrayList<>(delta.getToolCalls().size());
                    for (ApiToolCall toolCall : delta.getToolCalls()) {
                        ApiFunction function = toolCall.getFunction();
                        deltas.add(ToolCallDelta.builder()
                                .index(toolCall.getIndex())
                                .id(toolCall.getId())
                                .name(function != null ? function.getName() : null)
                                .argumentsFragment(function != null ? function.getArguments() : null)
                                .build());
                    }
                    chunk.toolCallDeltas(deltas);
                }
            }
        }
        return chunk.build();
    }

    // ==================== request / response mapping ====================

    private Request buildHttpRequest(LlmRequest request, boolean stream) {
        AgentProperties.LlmProperties llm = properties.getLlm();
        String json;
        try {
            json = objectMapper.writeValueAsString(buildRequest(request, stream));
        } catch (JsonProcessingException e) {
            throw new LlmProviderException("Failed to serialize provider request: " + e.getOriginalMessage(), e);
        }

        String baseUrl = llm.getBaseUrl().endsWith("/")
                ? llm.getBaseUrl().substring(0, llm.getBaseUrl().length() - 1)
                : llm.getBaseUrl();
        Request.Builder builder = new Request.Builder()
                .url(baseUrl + "/chat/completions")
                .post(RequestBody.create(json, JSON));
        if (llm.getApiKey() != null && !llm.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + llm.getApiKey());
        }
        if (stream) {
            builder.header("Accept", "text/event-stream");
        }
        return builder.build();
    }

    ChatCompletionRequest buildRequest(LlmRequest request, boolean stream) {
        AgentProperties.LlmProperties llm = properties.getLlm();
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null && !request.getModel().isBlank()
                ? request.getModel()
                : llm.getModel());
        apiRequest.setTemperature(request.getTemperature() != null ? request.getTemperature() : llm.getTemperature());
        apiRequest.setMaxTokens(request.getMaxTokens() != null ? request.getMaxTokens() : llm.getMaxTokens());
        apiRequest.setStream(stream);

        List<ApiMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            ApiMessage system = new ApiMessage();
            system.setRole(Message.ROLE_SYSTEM);
            system.setContent(request.getSystemPrompt());
            messages.add(system);
        }
        for (Message message : request.getMessages()) {
            messages.add(toApiMessage(message));
        }
        apiRequest.setMessages(messages);

        if (request.getTools() != null && !request.getTools().isEmpty()) {
            apiRequest.setTools(request.getTools().stream()
                    .map(tool -> {
                        ApiToolFunction function = new ApiToolFunction();
                        function.setName(tool.getName());
                        function.setDescription(tool.getDescription());
                        function.setParameters(tool.getInputSchema());
                        ApiTool apiTool = new ApiTool();
                        apiTool.setType("function");
                        apiTool.setFunction(function);
                        return apiTool;
                    })
                    .toList());
            apiRequest.setToolChoice("auto");
        }
        return apiRequest;
    }

    private ApiMessage toApiMessage(Message message) {
        ApiMessage apiMessage = new ApiMessage();
        apiMessage.setRole(message.getRole());
        apiMessage.setContent(message.getContent());
        if (message.hasToolCalls()) {
            apiMessage.setToolCalls(message.getToolCalls().stream()
                    .map(toolCall -> {
                        ApiFunction function = new ApiFunction();
                        function.setName(toolCall.getName());
                        function.setArguments(toolCall.getArguments() == null || toolCall.getArguments().isBlank()
                                ? "{}"
                                : toolCall.getArguments());
                        ApiToolCall apiToolCall = new ApiToolCall();
                        apiToolCall.setId(toolCall.getId());
                        apiToolCall.setType("function");
                        apiToolCall.setFunction(function);
                        return apiToolCall;
                    })
                    .toList());
        }
        if (message.getToolCallId() != null) {
            apiMessage.setToolCallId(message.getToolCallId());
        }
        return apiMessage;
    }

    private LlmResponse convertResponse(ChatCompletionResponse apiResponse) {
        if (apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()) {
            return LlmResponse.builder()
                    .content("")
                    .finishReason("error")
                    .build();
        }

        ChatChoice choice = apiResponse.getChoices().get(0);
        ApiMessage message = choice.getMessage();

        List<Message.ToolCall> toolCalls = null;
        if (message != null && message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            toolCalls = message.getToolCalls().stream()
                    .map(toolCall -> Message.ToolCall.builder()
                            .id(toolCall.getId())
                            .name(toolCall.getFunction() != null ? toolCall.getFunction().getName() : null)
                            .arguments(toolCall.getFunction() != null ? toolCall.getFunction().getArguments() : null)
                            .build())
                    .toList();
        }

        return LlmResponse.builder()
                .content(message != null ? message.getContent() : null)
                .toolCalls(toolCalls)
                .usage(apiResponse.getUsage() != null ? toUsage(apiResponse.getUsage()) : null)
                .model(apiResponse.getModel())
                .finishReason(choice.getFinishReason())
                .build();
    }

    private static LlmUsage toUsage(ApiUsage usage) {
        return LlmUsage.builder()
                .inputTokens(usage.getPromptTokens())
                .outputTokens(usage.getCompletionTokens())
                .totalTokens(usage.getTotalTokens())
                .build();
    }

    private static LlmProviderException apiError(int status, String body) {
        String detail = body == null ? "" : body.strip();
        if (detail.length() > MAX_ERROR_BODY_CHARS) {
            detail = detail.substring(0, MAX_ERROR_BODY_CHARS) + "...";
        }
        return new LlmProviderException("Provider API error: HTTP " + status
                + (detail.isEmpty() ? "" : " - " + detail), status, null);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        @JsonProperty("tool_choice")
        private String toolChoice;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        private boolean stream;
    }

    @Data
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    public static class StreamChunk {
        private String id;
        private String model;
        private List<StreamChoice> choices;
        private ApiUsage usage;
    }

    @Data
    public static class StreamChoice {
        private int index;
        private ApiMessage delta;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiToolCall {
        private Integer index;
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiFunction {
        private String name;
        private String arguments;
    }

    @Data
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}

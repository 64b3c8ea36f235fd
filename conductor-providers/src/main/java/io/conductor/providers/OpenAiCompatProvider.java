package io.conductor.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.conductor.core.concurrent.CancellationSignal;
import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.LlmResponse;
import io.conductor.core.model.MessageRole;
import io.conductor.core.model.ModelInfo;
import io.conductor.core.model.ToolCall;
import io.conductor.core.model.Usage;
import io.conductor.core.provider.LlmProvider;
import io.conductor.core.provider.ProviderException;
import io.conductor.core.tool.ToolDefinition;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat completions against any OpenAI-compatible endpoint (OpenAI, OpenRouter, local servers).
 * Tool results are carried inside assistant text, so history is sent as plain role/content pairs.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;
    private final long retryDelayMs;
    private volatile ModelInfo currentModel;
    private volatile List<ModelInfo> availableModels;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, ModelInfo model, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, model, extraHeaders, 3, 250);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        ModelInfo model,
        Map<String, String> extraHeaders,
        int maxAttempts,
        long retryDelayMs
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.currentModel = Objects.requireNonNull(model, "model must not be null");
        this.availableModels = List.of(model);
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelayMs = Math.max(0, retryDelayMs);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Loads the model catalog. Fails when the API key is missing or the catalog is unreachable.
     */
    @Override
    public void initialize() throws IOException {
        requireApiKey();
        fetchAvailableModels();
    }

    @Override
    public ModelInfo currentModel() {
        return currentModel;
    }

    @Override
    public List<ModelInfo> availableModels() {
        return availableModels;
    }

    @Override
    public boolean hasValidApiKey() {
        return !apiKey.isBlank();
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public LlmResponse send(List<ChatMessage> messages, String systemPrompt, CancellationSignal cancellation)
        throws IOException {
        return complete(payload(toWireMessages(messages, systemPrompt), List.of(), false), null, cancellation);
    }

    @Override
    public LlmResponse sendStreaming(
        List<ChatMessage> messages,
        String systemPrompt,
        Consumer<String> onChunk,
        CancellationSignal cancellation
    ) throws IOException {
        return complete(payload(toWireMessages(messages, systemPrompt), List.of(), true), onChunk, cancellation);
    }

    @Override
    public LlmResponse sendWithTools(
        List<ChatMessage> messages,
        List<ToolDefinition> tools,
        String systemPrompt,
        CancellationSignal cancellation
    ) throws IOException {
        return complete(payload(toWireMessages(messages, systemPrompt), tools, false), null, cancellation);
    }

    @Override
    public LlmResponse sendWithToolsStreaming(
        List<ChatMessage> messages,
        List<ToolDefinition> tools,
        String systemPrompt,
        Consumer<String> onChunk,
        CancellationSignal cancellation
    ) throws IOException {
        return complete(payload(toWireMessages(messages, systemPrompt), tools, true), onChunk, cancellation);
    }

    @Override
    public LlmResponse sendWithImage(String message, byte[] image, String systemPrompt, CancellationSignal cancellation)
        throws IOException {
        if (!supportsVision()) {
            throw new ProviderException(name, "model " + currentModel.id() + " does not accept images");
        }
        List<Map<String, Object>> wire = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            wire.add(wireMessage("system", systemPrompt));
        }
        Map<String, Object> imageUrl = new LinkedHashMap<>();
        imageUrl.put("url", "data:" + ImageTypes.detect(image) + ";base64," + Base64.getEncoder().encodeToString(image));
        List<Map<String, Object>> parts = List.of(
            Map.of("type", "text", "text", message == null ? "" : message),
            Map.of("type", "image_url", "image_url", imageUrl)
        );
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("role", "user");
        user.put("content", parts);
        wire.add(user);
        return complete(payload(wire, List.of(), false), null, cancellation);
    }

    /**
     * Queries {@code GET /models}. Context length and image input are taken from the entry when
     * the vendor reports them; otherwise the configured model's values apply.
     */
    @Override
    public List<ModelInfo> fetchAvailableModels() throws IOException {
        requireApiKey();
        HttpUrl url = apiBase.newBuilder().addPathSegment("models").build();
        Request.Builder builder = new Request.Builder().url(url).get();
        applyHeaders(builder);
        try (Response response = client.newCall(builder.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new ProviderException(name, "HTTP " + response.code() + " listing models", response.code(), null);
            }
            JsonNode root = readJson(bodyText(response));
            ModelInfo configured = currentModel;
            List<ModelInfo> models = new ArrayList<>();
            for (JsonNode item : root.path("data")) {
                String id = item.path("id").asText("");
                if (id.isBlank()) {
                    continue;
                }
                int context = item.path("context_length").asInt(configured.maxContextLength());
                boolean vision = configured.supportsVision() && id.equals(configured.id());
                for (JsonNode modality : item.path("architecture").path("input_modalities")) {
                    vision |= "image".equals(modality.asText());
                }
                models.add(new ModelInfo(id, item.path("name").asText(id), context, configured.supportsToolCalls(), vision));
            }
            if (models.isEmpty()) {
                models.add(configured);
            }
            availableModels = List.copyOf(models);
            LOG.debug("Provider {} lists {} models", name, models.size());
            return availableModels;
        }
    }

    @Override
    public boolean setModel(String modelId) {
        for (ModelInfo model : availableModels) {
            if (model.id().equals(modelId)) {
                currentModel = model;
                LOG.info("Provider {} now uses model {}", name, modelId);
                return true;
            }
        }
        return false;
    }

    private LlmResponse complete(Map<String, Object> payload, Consumer<String> onChunk, CancellationSignal cancellation)
        throws IOException {
        requireApiKey();
        Request request = buildRequest(payload);
        long delayMs = retryDelayMs;
        for (int attempt = 1; ; attempt++) {
            cancellation.throwIfCancelled();
            Call call = client.newCall(request);
            StreamState stream = new StreamState(onChunk);
            try (CancellationSignal.Registration registration = cancellation.onCancel(call::cancel);
                 Response response = call.execute()) {
                if (!response.isSuccessful()) {
                    String errorBody = bodyText(response);
                    boolean retryable = response.code() == 429 || response.code() >= 500;
                    if (retryable && attempt < maxAttempts) {
                        LOG.debug("Provider {} returned HTTP {}, retrying (attempt {})", name, response.code(), attempt);
                        sleep(delayMs);
                        delayMs = Math.min(delayMs * 2, 2000);
                        continue;
                    }
                    throw new ProviderException(name, "HTTP " + response.code() + " " + errorBody, response.code(), null);
                }

                ResponseBody body = response.body();
                if (body == null) {
                    throw new ProviderException(name, "empty response body");
                }
                String contentType = response.header("Content-Type", "");
                if (contentType.contains("text/event-stream")) {
                    return parseSse(body.source(), stream);
                }
                LlmResponse parsed = parseJson(body.string());
                stream.accept(parsed.content());
                return parsed;
            } catch (ProviderException e) {
                throw e;
            } catch (IOException e) {
                if (cancellation.isCancelled()) {
                    CancellationException cancelled = new CancellationException("request to " + name + " cancelled");
                    cancelled.initCause(e);
                    throw cancelled;
                }
                if (!stream.emitted() && attempt < maxAttempts) {
                    LOG.debug("Provider {} request failed, retrying (attempt {})", name, attempt, e);
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new ProviderException(name, e.getMessage() == null ? "request failed" : e.getMessage(), e);
            }
        }
    }

    private Map<String, Object> payload(List<Map<String, Object>> messages, List<ToolDefinition> tools, boolean stream) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", currentModel.id());
        payload.put("messages", messages);
        payload.put("stream", stream);
        if (stream) {
            payload.put("stream_options", Map.of("include_usage", true));
        }
        if (tools != null && !tools.isEmpty()) {
            payload.put("tools", toWireTools(tools));
            payload.put("tool_choice", "auto");
        }
        return payload;
    }

    private Request buildRequest(Map<String, Object> payload) throws IOException {
        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("chat").addPathSegment("completions").build())
            .post(body)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json, text/event-stream");
        applyHeaders(builder);
        return builder.build();
    }

    private void applyHeaders(Request.Builder builder) {
        builder.header("Authorization", "Bearer " + apiKey);
        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages, String systemPrompt) {
        List<Map<String, Object>> wire = new ArrayList<>();
        boolean overrideSystem = systemPrompt != null && !systemPrompt.isBlank();
        if (overrideSystem) {
            wire.add(wireMessage("system", systemPrompt));
        }
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM && overrideSystem) {
                continue;
            }
            if (message.role() == MessageRole.TOOL) {
                String tool = message.toolName() == null ? "tool" : message.toolName();
                wire.add(wireMessage("user", "Tool " + tool + " returned:\n" + message.content()));
                continue;
            }
            wire.add(wireMessage(message.role().wireName(), message.content()));
        }
        return wire;
    }

    private Map<String, Object> wireMessage(String role, String content) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", role);
        row.put("content", content);
        return row;
    }

    private List<Map<String, Object>> toWireTools(List<ToolDefinition> tools) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.name());
            function.put("description", tool.description());
            function.put("parameters", tool.parameters());
            wire.add(Map.of("type", "function", "function", function));
        }
        return wire;
    }

    private LlmResponse parseJson(String body) throws IOException {
        JsonNode root = readJson(body);
        JsonNode message = root.path("choices").path(0).path("message");
        String content = message.path("content").asText("");
        List<ToolCall> toolCalls = parseToolCalls(message.path("tool_calls"));
        return response(root.path("model").asText(currentModel.id()), content, toolCalls, usage(root.path("usage")));
    }

    private LlmResponse parseSse(BufferedSource source, StreamState stream) throws IOException {
        StringBuilder content = new StringBuilder();
        Map<String, ToolCallBuffer> toolBuffers = new LinkedHashMap<>();
        Map<Integer, String> toolIdsByIndex = new LinkedHashMap<>();
        Usage usage = Usage.empty();
        String model = currentModel.id();

        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || line.isBlank() || !line.startsWith("data:")) {
                continue;
            }
            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                break;
            }

            JsonNode event = readJson(payload);
            if (event.hasNonNull("usage")) {
                usage = usage(event.path("usage"));
            }
            if (event.hasNonNull("model")) {
                model = event.path("model").asText(model);
            }
            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.hasNonNull("content")) {
                    String chunk = delta.path("content").asText("");
                    content.append(chunk);
                    stream.accept(chunk);
                }
                collectToolCalls(delta.path("tool_calls"), toolBuffers, toolIdsByIndex);
            }
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        for (Map.Entry<String, ToolCallBuffer> entry : toolBuffers.entrySet()) {
            toolCalls.add(new ToolCall(entry.getKey(), entry.getValue().name, entry.getValue().arguments.toString()));
        }
        return response(model, content.toString(), toolCalls, usage);
    }

    private LlmResponse response(String model, String content, List<ToolCall> toolCalls, Usage usage) {
        LlmResponse response = toolCalls.isEmpty()
            ? LlmResponse.of(name, model, content)
            : LlmResponse.withToolCalls(name, model, content, toolCalls);
        return response.withUsage(usage);
    }

    private List<ToolCall> parseToolCalls(JsonNode node) throws IOException {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode item : node) {
            JsonNode function = item.path("function");
            JsonNode arguments = function.path("arguments");
            String raw = arguments.isTextual() ? arguments.asText("{}") : mapper.writeValueAsString(arguments);
            toolCalls.add(new ToolCall(item.path("id").asText(""), function.path("name").asText(""), raw));
        }
        return toolCalls;
    }

    private void collectToolCalls(
        JsonNode toolCallsNode,
        Map<String, ToolCallBuffer> buffers,
        Map<Integer, String> toolIdsByIndex
    ) {
        if (toolCallsNode == null || !toolCallsNode.isArray()) {
            return;
        }
        for (JsonNode toolCall : toolCallsNode) {
            int index = toolCall.path("index").asInt(-1);
            String id = toolCall.path("id").asText("");
            if (!id.isBlank() && index >= 0) {
                toolIdsByIndex.put(index, id);
            }
            if (id.isBlank() && index >= 0 && toolIdsByIndex.containsKey(index)) {
                id = toolIdsByIndex.get(index);
            }
            if (id.isBlank()) {
                id = "call_" + Math.max(index, 0);
            }

            ToolCallBuffer buffer = buffers.computeIfAbsent(id, ignored -> new ToolCallBuffer());
            JsonNode function = toolCall.path("function");
            String toolName = function.path("name").asText("");
            if (!toolName.isBlank()) {
                buffer.name = toolName;
            }
            buffer.arguments.append(function.path("arguments").asText(""));
        }
    }

    private Usage usage(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return Usage.empty();
        }
        int prompt = usage.path("prompt_tokens").asInt(0);
        int completion = usage.path("completion_tokens").asInt(0);
        return new Usage(prompt, completion, usage.path("total_tokens").asInt(prompt + completion));
    }

    private JsonNode readJson(String body) throws ProviderException {
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new ProviderException(name, "unreadable response: " + e.getMessage(), e);
        }
    }

    private String bodyText(Response response) throws IOException {
        ResponseBody body = response.body();
        return body == null ? "" : body.string();
    }

    private void requireApiKey() throws ProviderException {
        if (apiKey.isBlank()) {
            throw new ProviderException(name, "missing API key");
        }
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class ToolCallBuffer {
        private String name = "";
        private final StringBuilder arguments = new StringBuilder();
    }

    private static final class StreamState {
        private final Consumer<String> onChunk;
        private boolean emitted;

        private StreamState(Consumer<String> onChunk) {
            this.onChunk = onChunk;
        }

        void accept(String chunk) {
            if (onChunk == null || chunk == null || chunk.isEmpty()) {
                return;
            }
            emitted = true;
            onChunk.accept(chunk);
        }

        boolean emitted() {
            return emitted;
        }
    }
}

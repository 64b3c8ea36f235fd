package io.conductor.providers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conductor.core.concurrent.CancellationSignal;
import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.LlmResponse;
import io.conductor.core.model.ModelInfo;
import io.conductor.core.provider.ProviderException;
import io.conductor.core.tool.ToolDefinition;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private static final ModelInfo MODEL = new ModelInfo("gpt-4.1", "GPT 4.1", 128000, true, true);

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseJsonCompletionResponse() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "model": "gpt-4.1-2025-04-14",
                  "choices": [
                    { "message": { "content": "hello from json" } }
                  ],
                  "usage": { "prompt_tokens": 30, "completion_tokens": 12, "total_tokens": 42 }
                }
                """));

        OpenAiCompatProvider provider = provider(server.url("/v1").toString(), Map.of("X-App", "conductor"));

        LlmResponse response = provider.send(List.of(ChatMessage.user("hi")), "", CancellationSignal.none());

        assertThat(response.content()).isEqualTo("hello from json");
        assertThat(response.providerName()).isEqualTo("openrouter");
        assertThat(response.modelName()).isEqualTo("gpt-4.1-2025-04-14");
        assertThat(response.usage().promptTokens()).isEqualTo(30);
        assertThat(response.usage().totalTokens()).isEqualTo(42);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("X-App")).isEqualTo("conductor");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"stream\":false");
        assertThat(body).contains("\"model\":\"gpt-4.1\"");
    }

    @Test
    void shouldStreamSseChunksAndCollectToolCalls() throws Exception {
        String sse = """
            data: {"choices":[{"delta":{"content":"hello "}}]}

            data: {"choices":[{"delta":{"content":"world"}}]}

            data: {"choices":[{"delta":{"tool_calls":[{"id":"call_1","index":0,"function":{"name":"echo","arguments":"{\\"text\\":"}}]}}]}

            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"\\"hi\\"}"}}]}}]}

            data: {"choices":[],"usage":{"prompt_tokens":10,"completion_tokens":3,"total_tokens":13}}

            data: [DONE]

            """;
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody(sse));

        OpenAiCompatProvider provider = provider(server.url("/v1/").toString(), Map.of());
        List<String> chunks = new ArrayList<>();

        LlmResponse response = provider.sendWithToolsStreaming(
            List.of(ChatMessage.user("hi")),
            List.of(new ToolDefinition("echo", "Echo text back", null)),
            "",
            chunks::add,
            CancellationSignal.none()
        );

        assertThat(chunks).containsExactly("hello ", "world");
        assertThat(response.content()).isEqualTo("hello world");
        assertThat(response.toolCalls()).hasSize(1);
        assertThat(response.toolCalls().get(0).id()).isEqualTo("call_1");
        assertThat(response.toolCalls().get(0).name()).isEqualTo("echo");
        assertThat(response.toolCalls().get(0).arguments()).isEqualTo("{\"text\":\"hi\"}");
        assertThat(response.usage().totalTokens()).isEqualTo(13);

        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body).contains("\"stream\":true");
        assertThat(body).contains("\"tool_choice\":\"auto\"");
        assertThat(body).contains("\"type\":\"function\"");
        assertThat(body).contains("\"name\":\"echo\"");
    }

    @Test
    void shouldReplaceSystemMessagesWithExplicitSystemPrompt() throws Exception {
        server.enqueue(jsonAnswer("ok"));
        OpenAiCompatProvider provider = provider(server.url("/v1").toString(), Map.of());

        provider.send(
            List.of(ChatMessage.system("old prompt"), ChatMessage.user("hi"), ChatMessage.tool("clock", "12:00")),
            "new prompt",
            CancellationSignal.none()
        );

        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body).contains("new prompt");
        assertThat(body).doesNotContain("old prompt");
        assertThat(body).contains("Tool clock returned:");
    }

    @Test
    void shouldRetryServerErrorsBeforeSucceeding() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(jsonAnswer("second time lucky"));
        OpenAiCompatProvider provider = provider(server.url("/v1").toString(), Map.of());

        LlmResponse response = provider.send(List.of(ChatMessage.user("hi")), "", CancellationSignal.none());

        assertThat(response.content()).isEqualTo("second time lucky");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldFailWithStatusCodeOnClientError() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));
        OpenAiCompatProvider provider = provider(server.url("/v1").toString(), Map.of());

        assertThatThrownBy(() -> provider.send(List.of(ChatMessage.user("hi")), "", CancellationSignal.none()))
            .isInstanceOfSatisfying(ProviderException.class, e -> {
                assertThat(e.statusCode()).isEqualTo(401);
                assertThat(e.providerName()).isEqualTo("openrouter");
                assertThat(e.getMessage()).contains("bad key");
            });
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectCallsWithoutApiKey() {
        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "", server.url("/v1").toString(), MODEL, Map.of());

        assertThat(provider.hasValidApiKey()).isFalse();
        assertThatThrownBy(() -> provider.send(List.of(ChatMessage.user("hi")), "", CancellationSignal.none()))
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("missing API key");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldNotCallVendorWhenAlreadyCancelled() {
        OpenAiCompatProvider provider = provider(server.url("/v1").toString(), Map.of());
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();

        assertThatThrownBy(() -> provider.send(List.of(ChatMessage.user("hi")), "", cancellation))
            .isInstanceOf(CancellationException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldAbortInFlightCallWhenCancelled() throws Exception {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        OpenAiCompatProvider provider = provider(server.url("/v1").toString(), Map.of());
        CancellationSignal cancellation = new CancellationSignal();
        Thread canceller = new Thread(() -> {
            try {
                server.takeRequest();
                cancellation.cancel();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();
        long started = System.nanoTime();

        assertThatThrownBy(() -> provider.send(List.of(ChatMessage.user("hi")), "", cancellation))
            .isInstanceOf(CancellationException.class);

        canceller.join(5000);
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(30));
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldSendImageAsDataUrl() throws Exception {
        server.enqueue(jsonAnswer("a cat"));
        OpenAiCompatProvider provider = provider(server.url("/v1").toString(), Map.of());
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A};

        LlmResponse response = provider.sendWithImage("what is this?", png, "", CancellationSignal.none());

        assertThat(response.content()).isEqualTo("a cat");
        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body).contains("data:image/png;base64,");
        assertThat(body).contains("what is this?");
    }

    @Test
    void shouldRefuseImagesWhenModelLacksVision() {
        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openai",
            "sk-test",
            server.url("/v1").toString(),
            ModelInfo.of("text-only", 4096),
            Map.of()
        );

        assertThatThrownBy(() -> provider.sendWithImage("hi", new byte[] {1, 2, 3, 4}, "", CancellationSignal.none()))
            .isInstanceOf(ProviderException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldFetchModelCatalogAndSwitchModel() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "data": [
                    { "id": "gpt-4.1", "context_length": 128000 },
                    { "id": "gpt-4.2", "context_length": 256000,
                      "architecture": { "input_modalities": ["text", "image"] } }
                  ]
                }
                """));
        OpenAiCompatProvider provider = provider(server.url("/v1").toString(), Map.of());

        List<ModelInfo> models = provider.fetchAvailableModels();

        assertThat(models).extracting(ModelInfo::id).containsExactly("gpt-4.1", "gpt-4.2");
        assertThat(models.get(1).maxContextLength()).isEqualTo(256000);
        assertThat(models.get(1).supportsVision()).isTrue();
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/models");

        assertThat(provider.setModel("gpt-4.2")).isTrue();
        assertThat(provider.currentModel().id()).isEqualTo("gpt-4.2");
        assertThat(provider.setModel("unknown")).isFalse();
        assertThat(provider.currentModel().id()).isEqualTo("gpt-4.2");
    }

    private OpenAiCompatProvider provider(String base, Map<String, String> headers) {
        return new OpenAiCompatProvider("openrouter", "sk-test", base, MODEL, headers, 3, 1);
    }

    private MockResponse jsonAnswer(String content) {
        return new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"" + content + "\"}}]}");
    }
}

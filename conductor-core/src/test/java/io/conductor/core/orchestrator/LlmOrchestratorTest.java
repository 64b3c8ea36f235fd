package io.conductor.core.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conductor.core.MutableClock;
import io.conductor.core.concurrent.CancellationSignal;
import io.conductor.core.conversation.ConversationRepository;
import io.conductor.core.conversation.InMemoryConversationRepository;
import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.Conversation;
import io.conductor.core.model.LlmResponse;
import io.conductor.core.model.MessageRole;
import io.conductor.core.model.ModelInfo;
import io.conductor.core.model.ToolCall;
import io.conductor.core.model.Usage;
import io.conductor.core.prompt.StaticSystemPromptProvider;
import io.conductor.core.provider.ProviderRegistry;
import io.conductor.core.provider.StubLlmProvider;
import io.conductor.core.tool.Tool;
import io.conductor.core.tool.ToolContext;
import io.conductor.core.tool.ToolRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

class LlmOrchestratorTest {
    private static final String PROMPT = "You are a test assistant.";

    private final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    private final InMemoryConversationRepository repository = new InMemoryConversationRepository();
    private final ToolRegistry tools = new ToolRegistry();

    @Test
    void shouldServeFromBackupWhenActiveProviderFails() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a").thenFail("timeout");
        StubLlmProvider b = new StubLlmProvider("b");
        LlmOrchestrator orchestrator = orchestrator(a, b);

        LlmResponse response = orchestrator.sendMessage("hi", null);

        assertThat(response.providerName()).isEqualTo("b");
        assertThat(response.degraded()).isFalse();
        assertThat(response.content()).isEqualTo("reply from b");
        assertThat(orchestrator.failoverController().failureRecord("a")).isPresent();
        assertThat(orchestrator.activeProvider()).contains(b);
    }

    @Test
    void shouldReturnDegradedResponseWhenBackupFailsToo() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a").alwaysFail();
        StubLlmProvider b = new StubLlmProvider("b").alwaysFail();
        LlmOrchestrator orchestrator = orchestrator(a, b);

        LlmResponse response = orchestrator.sendMessage("hi", null);

        assertThat(response.degraded()).isTrue();
        assertThat(response.providerName()).isEqualTo(LlmResponse.SYSTEM_PROVIDER);
        assertThat(response.content()).isEqualTo(LlmOrchestrator.DEGRADED_MESSAGE);
        assertThat(response.conversationId()).isNotBlank();
        assertThat(a.sends()).isEqualTo(1);
        assertThat(b.sends()).isEqualTo(1);

        assertThatThrownBy(() -> orchestrator.sendMessage("again", null))
            .isInstanceOf(NoProviderAvailableException.class);
    }

    @Test
    void shouldRecoverOnceBackoffWindowElapses() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a").thenFail("timeout");
        LlmOrchestrator orchestrator = orchestrator(a);

        assertThat(orchestrator.sendMessage("hi", null).degraded()).isTrue();
        clock.advance(OrchestratorSettings.defaults().backoff().plusSeconds(1));

        assertThat(orchestrator.sendMessage("hi again", null).providerName()).isEqualTo("a");
    }

    @Test
    void shouldFailWhenNoProviderIsConfigured() {
        LlmOrchestrator orchestrator = orchestrator();

        assertThatThrownBy(() -> orchestrator.sendMessage("hi", null))
            .isInstanceOf(NoProviderAvailableException.class);
    }

    @Test
    void shouldSeedNewConversationWithSystemPromptAndPersistExchange() throws Exception {
        LlmOrchestrator orchestrator = orchestrator(new StubLlmProvider("a"));

        LlmResponse response = orchestrator.sendMessage("hello", null);

        Conversation stored = repository.get(response.conversationId()).orElseThrow();
        assertThat(stored.messages()).extracting(ChatMessage::role)
            .containsExactly(MessageRole.SYSTEM, MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(stored.messages().get(0).content()).isEqualTo(PROMPT);
        assertThat(stored.messages().get(2).content()).isEqualTo("reply from a");
    }

    @Test
    void shouldContinueExistingConversation() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a");
        LlmOrchestrator orchestrator = orchestrator(a);
        String id = orchestrator.createConversation("class-7");

        orchestrator.sendMessage("first", id);
        LlmResponse second = orchestrator.sendMessage("second", id);

        assertThat(second.conversationId()).isEqualTo(id);
        assertThat(a.lastHistory()).extracting(ChatMessage::content)
            .containsExactly(PROMPT, "first", "reply from a", "second");
        Conversation stored = orchestrator.getConversationHistory(id).orElseThrow();
        assertThat(stored.classId()).isEqualTo("class-7");
        assertThat(stored.messages()).hasSize(5);
    }

    @Test
    void shouldStartNewConversationForUnknownIdOnPlainSend() throws Exception {
        LlmOrchestrator orchestrator = orchestrator(new StubLlmProvider("a"));

        LlmResponse response = orchestrator.sendMessage("hello", "does-not-exist");

        assertThat(response.conversationId()).isNotEqualTo("does-not-exist");
        assertThat(repository.get(response.conversationId())).isPresent();
    }

    @Test
    void shouldAppendExplicitHistory() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a");
        LlmOrchestrator orchestrator = orchestrator(a);
        List<ChatMessage> history = List.of(
            ChatMessage.user("what is 2+2?"),
            ChatMessage.assistant("4"),
            ChatMessage.user("and times 3?")
        );

        orchestrator.sendMessages(history, null, null, CancellationSignal.none());

        assertThat(a.lastHistory()).extracting(ChatMessage::content)
            .containsExactly(PROMPT, "what is 2+2?", "4", "and times 3?");
    }

    @Test
    void shouldTrimHistoryToModelBudget() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a").withModel(ModelInfo.of("small", 1040));
        LlmOrchestrator orchestrator = orchestrator(a);
        List<ChatMessage> history = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            history.add(ChatMessage.user(i + "x".repeat(39)));
        }

        LlmResponse response = orchestrator.sendMessages(history, null, null, CancellationSignal.none());

        assertThat(a.lastHistory()).hasSize(2);
        assertThat(a.lastHistory().get(0).role()).isEqualTo(MessageRole.SYSTEM);
        assertThat(a.lastHistory().get(1)).isEqualTo(history.get(9));
        assertThat(repository.get(response.conversationId()).orElseThrow().messages()).hasSize(12);
    }

    @Test
    void shouldEstimateUsageWhenProviderReportsNone() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a")
            .thenAnswer(LlmResponse.of("a", "a-model", "first"))
            .thenAnswer(LlmResponse.of("a", "a-model", "second").withUsage(Usage.of(11, 7)));
        LlmOrchestrator orchestrator = orchestrator(a);

        assertThat(orchestrator.sendMessage("hello", null).usage().totalTokens()).isPositive();
        assertThat(orchestrator.sendMessage("hello", null).usage()).isEqualTo(Usage.of(11, 7));
    }

    @Test
    void shouldSendToolDefinitionsAndRunRequestedTools() throws Exception {
        tools.register(new WeatherTool());
        StubLlmProvider a = new StubLlmProvider("a").thenAnswer(LlmResponse.withToolCalls(
            "a",
            "a-model",
            "Let me check.",
            List.of(new ToolCall("call_1", "get_weather", "{\"location\":\"Paris\"}"))
        ));
        LlmOrchestrator orchestrator = orchestrator(a);

        LlmResponse response = orchestrator.sendMessageWithTools("weather in Paris?", null, null, CancellationSignal.none());

        assertThat(a.lastTools()).extracting(definition -> definition.name()).containsExactly("get_weather");
        assertThat(response.content()).contains("Tool: get_weather").contains("18C in Paris");
        Conversation stored = repository.get(response.conversationId()).orElseThrow();
        assertThat(stored.messages().get(stored.messages().size() - 1).content()).contains("18C in Paris");
    }

    @Test
    void shouldRejectToolSendForUnknownConversation() {
        LlmOrchestrator orchestrator = orchestrator(new StubLlmProvider("a"));

        assertThatThrownBy(() -> orchestrator.sendMessageWithTools("hi", "missing", null, CancellationSignal.none()))
            .isInstanceOf(ConversationNotFoundException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void shouldForwardChunksAndAnnounceFailoverWhenStreaming() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a").thenFail("connection reset");
        StubLlmProvider b = new StubLlmProvider("b").streaming("Hel", "lo").thenAnswer(LlmResponse.of("b", "b-model", ""));
        LlmOrchestrator orchestrator = orchestrator(a, b);
        List<String> chunks = new ArrayList<>();

        LlmResponse response = orchestrator.sendMessagesStreaming(
            List.of(ChatMessage.user("hi")), null, null, chunks::add, CancellationSignal.none());

        assertThat(chunks).containsExactly(String.format(LlmOrchestrator.FAILOVER_NOTICE, "b"), "Hel", "lo");
        assertThat(response.content()).isEqualTo("Hello");
        assertThat(response.providerName()).isEqualTo("b");
    }

    @Test
    void shouldStreamToolResultsAsFinalChunk() throws Exception {
        tools.register(new WeatherTool());
        StubLlmProvider a = new StubLlmProvider("a")
            .streaming("Checking. ", "```tool get_weather\nlocation: Paris\n```")
            .thenAnswer(LlmResponse.of("a", "a-model", ""));
        LlmOrchestrator orchestrator = orchestrator(a);
        String id = orchestrator.createConversation(null);
        List<String> chunks = new ArrayList<>();

        LlmResponse response = orchestrator.sendMessageWithToolsStreaming(
            "weather?", id, null, chunks::add, CancellationSignal.none());

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(2)).isEqualTo("\n\n**Tool Result:**\n```json\n18C in Paris\n```");
        assertThat(String.join("", chunks)).isEqualTo(response.content());
    }

    @Test
    void shouldEmitApologyWhenStreamingDegrades() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a").alwaysFail();
        LlmOrchestrator orchestrator = orchestrator(a);
        List<String> chunks = new ArrayList<>();

        LlmResponse response = orchestrator.sendMessagesStreaming(
            List.of(ChatMessage.user("hi")), null, null, chunks::add, CancellationSignal.none());

        assertThat(response.degraded()).isTrue();
        assertThat(chunks).containsExactly(LlmOrchestrator.DEGRADED_MESSAGE);
    }

    @Test
    void shouldStoreStreamedTextWhenFinalContentDiffers() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a").streaming("Hel", "lo").thenAnswer("Hello there, final");
        LlmOrchestrator orchestrator = orchestrator(a);
        List<String> chunks = new ArrayList<>();

        LlmResponse response = orchestrator.sendMessagesStreaming(
            List.of(ChatMessage.user("hi")), null, null, chunks::add, CancellationSignal.none());

        assertThat(response.content()).isEqualTo("Hello");
        Conversation stored = repository.get(response.conversationId()).orElseThrow();
        assertThat(stored.messages().get(stored.messages().size() - 1).content()).isEqualTo("Hello");
    }

    @Test
    void shouldAppendStructuredToolResultToStreamedText() throws Exception {
        tools.register(new WeatherTool());
        StubLlmProvider a = new StubLlmProvider("a")
            .streaming("Let me ", "check.")
            .thenAnswer(LlmResponse.withToolCalls(
                "a",
                "a-model",
                "Checking the weather.",
                List.of(new ToolCall("call_1", "get_weather", "{\"location\":\"Paris\"}"))
            ));
        LlmOrchestrator orchestrator = orchestrator(a);
        String id = orchestrator.createConversation(null);
        List<String> chunks = new ArrayList<>();

        LlmResponse response = orchestrator.sendMessageWithToolsStreaming(
            "weather?", id, null, chunks::add, CancellationSignal.none());

        String expected = "Let me check.\n\nTool: get_weather\nResult: 18C in Paris";
        assertThat(chunks).containsExactly("Let me ", "check.", "\n\nTool: get_weather\nResult: 18C in Paris");
        assertThat(response.content()).isEqualTo(expected);
        Conversation stored = orchestrator.getConversationHistory(id).orElseThrow();
        assertThat(stored.messages().get(stored.messages().size() - 1).content()).isEqualTo(expected);
    }

    @Test
    void shouldRouteImageToVisionCapableProvider() throws Exception {
        StubLlmProvider text = new StubLlmProvider("text");
        StubLlmProvider vision = new StubLlmProvider("vision")
            .withModel(new ModelInfo("vision-model", "Vision", 8192, false, true));
        LlmOrchestrator orchestrator = orchestrator(text, vision);
        byte[] image = {1, 2, 3};

        LlmResponse response = orchestrator.sendMessageWithImage("what is this?", image, null, null, CancellationSignal.none());

        assertThat(response.providerName()).isEqualTo("vision");
        assertThat(vision.lastImage()).isEqualTo(image);
        assertThat(text.sends()).isZero();
    }

    @Test
    void shouldFailImageSendWithoutVisionProvider() {
        LlmOrchestrator orchestrator = orchestrator(new StubLlmProvider("text"));

        assertThatThrownBy(() -> orchestrator.sendMessageWithImage("what?", new byte[] {1}, null, null, CancellationSignal.none()))
            .isInstanceOf(NoVisionProviderException.class);
    }

    @Test
    void shouldUseManuallySelectedProvider() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a");
        StubLlmProvider b = new StubLlmProvider("b");
        LlmOrchestrator orchestrator = orchestrator(a, b);

        assertThat(orchestrator.setActiveProvider("B")).isTrue();
        assertThat(orchestrator.setActiveProvider("nope")).isFalse();

        assertThat(orchestrator.sendMessage("hi", null).providerName()).isEqualTo("b");
        assertThat(orchestrator.getProvider("A")).contains(a);
        assertThat(orchestrator.getProvider("c")).isEmpty();
    }

    @Test
    void shouldKeepCurrentProviderWhenSelectingOneWithoutCredentials() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a");
        StubLlmProvider b = new StubLlmProvider("b").withoutCredentials();
        LlmOrchestrator orchestrator = orchestrator(a, b);

        assertThat(orchestrator.setActiveProvider("b")).isFalse();

        assertThat(orchestrator.sendMessage("hi", null).providerName()).isEqualTo("a");
        assertThat(b.sends()).isZero();
    }

    @Test
    void shouldActivatePreferredProviderOnStart() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a");
        StubLlmProvider b = new StubLlmProvider("b");
        ProviderRegistry registry = registry(a, b);
        OrchestratorSettings settings = new OrchestratorSettings(1000, 8192, null, "b", false, null, null);
        LlmOrchestrator orchestrator = new LlmOrchestrator(
            registry, repository, new StaticSystemPromptProvider(PROMPT), tools, settings, clock);

        orchestrator.start();

        assertThat(orchestrator.activeProvider()).contains(b);
    }

    @Test
    void shouldNotPersistCancelledSend() throws Exception {
        LlmOrchestrator orchestrator = orchestrator(new StubLlmProvider("a"));
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThatThrownBy(() -> orchestrator.sendMessage("hi", null, null, signal))
            .isInstanceOf(CancellationException.class);
        assertThat(repository.list()).isEmpty();
    }

    @Test
    void shouldStopWithoutFailoverWhenCancelledMidRequest() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a").cancellingOnSend();
        StubLlmProvider b = new StubLlmProvider("b");
        LlmOrchestrator orchestrator = orchestrator(a, b);
        CancellationSignal signal = new CancellationSignal();

        assertThatThrownBy(() -> orchestrator.sendMessage("hi", null, null, signal))
            .isInstanceOf(CancellationException.class);

        assertThat(a.sends()).isEqualTo(1);
        assertThat(b.sends()).isZero();
        assertThat(orchestrator.failoverController().failureRecord("a")).isEmpty();
        assertThat(orchestrator.activeProvider()).contains(a);
        assertThat(repository.list()).isEmpty();
    }

    @Test
    void shouldNotEmitFailoverNoticeWhenStreamCancelledMidRequest() throws Exception {
        StubLlmProvider a = new StubLlmProvider("a").cancellingOnSend();
        StubLlmProvider b = new StubLlmProvider("b");
        LlmOrchestrator orchestrator = orchestrator(a, b);
        CancellationSignal signal = new CancellationSignal();
        List<String> chunks = new ArrayList<>();

        assertThatThrownBy(() -> orchestrator.sendMessagesStreaming(
            List.of(ChatMessage.user("hi")), null, null, chunks::add, signal))
            .isInstanceOf(CancellationException.class);

        assertThat(chunks).isEmpty();
        assertThat(b.sends()).isZero();
        assertThat(orchestrator.failoverController().failureRecord("a")).isEmpty();
        assertThat(repository.list()).isEmpty();
    }

    @Test
    void shouldReturnResponseWhenPersistenceFails() throws Exception {
        ProviderRegistry registry = registry(new StubLlmProvider("a"));
        LlmOrchestrator orchestrator = new LlmOrchestrator(
            registry,
            new FailingRepository(),
            new StaticSystemPromptProvider(PROMPT),
            tools,
            OrchestratorSettings.defaults().withRefreshEnabled(false),
            clock
        );
        orchestrator.start();

        LlmResponse response = orchestrator.sendMessage("hi", null);

        assertThat(response.content()).isEqualTo("reply from a");
    }

    @Test
    void shouldDeleteConversation() throws Exception {
        LlmOrchestrator orchestrator = orchestrator(new StubLlmProvider("a"));
        String id = orchestrator.createConversation(null);

        assertThat(orchestrator.deleteConversation(id)).isTrue();
        assertThat(orchestrator.getConversationHistory(id)).isEmpty();
        assertThat(orchestrator.deleteConversation(id)).isFalse();
    }

    @Test
    void shouldRefreshModelsThroughOrchestrator() {
        StubLlmProvider a = new StubLlmProvider("a")
            .withModel(ModelInfo.of("gpt-4-turbo", 128000))
            .withNextCatalog(List.of(ModelInfo.of("gpt-4-turbo", 128000), ModelInfo.of("gpt-4-turbo-latest", 128000)));
        LlmOrchestrator orchestrator = orchestrator(a);

        assertThat(orchestrator.refreshModelsForProvider("a")).isTrue();
        assertThat(a.currentModel().id()).isEqualTo("gpt-4-turbo");

        assertThat(orchestrator.refreshModels()).isTrue();
        assertThat(a.currentModel().id()).isEqualTo("gpt-4-turbo-latest");
        assertThat(orchestrator.providers()).singleElement()
            .satisfies(snapshot -> assertThat(snapshot.modelId()).isEqualTo("gpt-4-turbo-latest"));
    }

    private LlmOrchestrator orchestrator(StubLlmProvider... providers) {
        LlmOrchestrator orchestrator = new LlmOrchestrator(
            registry(providers),
            repository,
            new StaticSystemPromptProvider(PROMPT),
            tools,
            OrchestratorSettings.defaults().withRefreshEnabled(false),
            clock
        );
        orchestrator.start();
        return orchestrator;
    }

    private ProviderRegistry registry(StubLlmProvider... providers) {
        ProviderRegistry registry = new ProviderRegistry();
        for (StubLlmProvider provider : providers) {
            registry.register(provider);
        }
        return registry;
    }

    private static final class WeatherTool implements Tool {
        @Override
        public String name() {
            return "get_weather";
        }

        @Override
        public String description() {
            return "Current weather for a location";
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            return "18C in " + input.get("location");
        }
    }

    private static final class FailingRepository implements ConversationRepository {
        @Override
        public Optional<Conversation> get(String id) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public String add(Conversation conversation) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public void update(Conversation conversation) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public boolean delete(String id) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public List<Conversation> list() throws IOException {
            throw new IOException("disk full");
        }
    }
}

package io.conductor.core.orchestrator;

import io.conductor.core.concurrent.CancellationSignal;
import io.conductor.core.context.ConversationTrimmer;
import io.conductor.core.context.TokenEstimator;
import io.conductor.core.conversation.ConversationRepository;
import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.Conversation;
import io.conductor.core.model.LlmResponse;
import io.conductor.core.model.ModelInfo;
import io.conductor.core.model.Usage;
import io.conductor.core.prompt.SystemPrompt;
import io.conductor.core.prompt.SystemPromptProvider;
import io.conductor.core.provider.FailoverController;
import io.conductor.core.provider.LlmProvider;
import io.conductor.core.provider.ProviderRegistry;
import io.conductor.core.provider.ProviderSnapshot;
import io.conductor.core.tool.ToolCallProcessor;
import io.conductor.core.tool.ToolDefinition;
import io.conductor.core.tool.ToolRegistry;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for every chat operation. A send resolves the conversation, appends the caller's
 * input, trims the history to the active model's budget, calls the active provider with one
 * failover retry, runs tool requests found in the answer and persists the result.
 *
 * <p>Provider failures are recovered here: the caller receives either a normal response or a
 * {@linkplain LlmResponse#degraded() degraded} one. Only exhaustion is thrown, as an
 * {@link OrchestrationException}. Cancellation surfaces as {@link CancellationException} and
 * leaves the stored conversation untouched.
 */
public final class LlmOrchestrator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LlmOrchestrator.class);
    static final String DEGRADED_MESSAGE =
        "I'm sorry, I'm having trouble reaching a language model right now. Please try again in a few minutes.";
    static final String FAILOVER_NOTICE = "\n\n[Switching to backup provider %s...]\n\n";

    private final ProviderRegistry registry;
    private final FailoverController failover;
    private final ConversationRepository repository;
    private final SystemPromptProvider prompts;
    private final ToolRegistry tools;
    private final ToolCallProcessor toolProcessor;
    private final ConversationTrimmer trimmer;
    private final ModelRefreshScheduler refreshScheduler;
    private final OrchestratorSettings settings;
    private final Clock clock;

    public LlmOrchestrator(
        ProviderRegistry registry,
        ConversationRepository repository,
        SystemPromptProvider prompts,
        ToolRegistry tools,
        OrchestratorSettings settings,
        Clock clock
    ) {
        this.registry = registry;
        this.repository = repository;
        this.prompts = prompts;
        this.tools = tools;
        this.settings = settings;
        this.clock = clock;
        this.failover = new FailoverController(registry, clock, settings.backoff());
        this.toolProcessor = new ToolCallProcessor(tools);
        this.trimmer = new ConversationTrimmer();
        this.refreshScheduler = new ModelRefreshScheduler(registry, settings.refreshInitialDelay(), settings.refreshInterval());
    }

    /**
     * Initializes every provider, selects the active one and starts the model refresh schedule.
     */
    public void start() {
        registry.initializeAll();
        String preferred = settings.preferredProvider();
        if (preferred.isBlank() || !failover.setActive(preferred)) {
            failover.selectActive();
        }
        if (settings.refreshEnabled()) {
            refreshScheduler.start();
        }
    }

    @Override
    public void close() {
        refreshScheduler.close();
    }

    public LlmResponse sendMessage(String message, String conversationId) throws OrchestrationException {
        return sendMessage(message, conversationId, null, CancellationSignal.none());
    }

    public LlmResponse sendMessage(
        String message,
        String conversationId,
        String systemPrompt,
        CancellationSignal cancellation
    ) throws OrchestrationException {
        return sendMessages(List.of(ChatMessage.user(message)), conversationId, systemPrompt, cancellation);
    }

    /**
     * Sends an explicit history. The messages are appended to the conversation, which is created
     * when {@code conversationId} is null or unknown.
     */
    public LlmResponse sendMessages(
        List<ChatMessage> messages,
        String conversationId,
        String systemPrompt,
        CancellationSignal cancellation
    ) throws OrchestrationException {
        Conversation conversation = openConversation(conversationId, false);
        conversation.appendAll(messages, clock.instant());
        return complete(
            conversation,
            provider -> true,
            (provider, history) -> provider.send(history, systemPrompt, cancellation),
            null,
            cancellation
        );
    }

    public LlmResponse sendMessagesStreaming(
        List<ChatMessage> messages,
        String conversationId,
        String systemPrompt,
        Consumer<String> onChunk,
        CancellationSignal cancellation
    ) throws OrchestrationException {
        Conversation conversation = openConversation(conversationId, false);
        conversation.appendAll(messages, clock.instant());
        StreamAccumulator stream = new StreamAccumulator(onChunk);
        return complete(
            conversation,
            provider -> true,
            (provider, history) -> provider.sendStreaming(history, systemPrompt, stream, cancellation),
            stream,
            cancellation
        );
    }

    /**
     * Sends with the registered tool definitions. A non-null {@code conversationId} must name an
     * existing conversation.
     */
    public LlmResponse sendMessageWithTools(
        String message,
        String conversationId,
        String systemPrompt,
        CancellationSignal cancellation
    ) throws OrchestrationException {
        Conversation conversation = openConversation(conversationId, true);
        conversation.append(ChatMessage.user(message), clock.instant());
        List<ToolDefinition> definitions = tools.definitions();
        return complete(
            conversation,
            provider -> true,
            (provider, history) -> provider.sendWithTools(history, definitions, systemPrompt, cancellation),
            null,
            cancellation
        );
    }

    public LlmResponse sendMessageWithToolsStreaming(
        String message,
        String conversationId,
        String systemPrompt,
        Consumer<String> onChunk,
        CancellationSignal cancellation
    ) throws OrchestrationException {
        Conversation conversation = openConversation(conversationId, true);
        conversation.append(ChatMessage.user(message), clock.instant());
        List<ToolDefinition> definitions = tools.definitions();
        StreamAccumulator stream = new StreamAccumulator(onChunk);
        return complete(
            conversation,
            provider -> true,
            (provider, history) -> provider.sendWithToolsStreaming(history, definitions, systemPrompt, stream, cancellation),
            stream,
            cancellation
        );
    }

    /**
     * Sends a message with an image. Requires an eligible vision-capable provider; the stored
     * conversation records the text of the message only.
     */
    public LlmResponse sendMessageWithImage(
        String message,
        byte[] image,
        String conversationId,
        String systemPrompt,
        CancellationSignal cancellation
    ) throws OrchestrationException {
        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("image must not be empty");
        }
        if (failover.eligible(LlmProvider::supportsVision).isEmpty()) {
            LOG.error("No vision-capable provider available");
            throw new NoVisionProviderException("No vision-capable provider is available");
        }
        Conversation conversation = openConversation(conversationId, false);
        conversation.append(ChatMessage.user(message), clock.instant());
        return complete(
            conversation,
            LlmProvider::supportsVision,
            (provider, history) -> provider.sendWithImage(message, image, systemPrompt, cancellation),
            null,
            cancellation
        );
    }

    public String createConversation(String classId) throws IOException {
        Conversation conversation = Conversation.start(defaultPrompt(), classId, clock);
        return repository.add(conversation);
    }

    public boolean deleteConversation(String conversationId) throws IOException {
        return repository.delete(conversationId);
    }

    public Optional<Conversation> getConversationHistory(String conversationId) throws IOException {
        return repository.get(conversationId);
    }

    public List<Conversation> listConversations() throws IOException {
        return repository.list();
    }

    public boolean setActiveProvider(String name) {
        return failover.setActive(name);
    }

    public Optional<LlmProvider> getProvider(String name) {
        return registry.find(name);
    }

    public Optional<LlmProvider> activeProvider() {
        return failover.activeProvider();
    }

    public List<ProviderSnapshot> providers() {
        return failover.snapshot();
    }

    public boolean refreshModels() {
        return refreshScheduler.refreshAll();
    }

    public boolean refreshModelsForProvider(String name) {
        return refreshScheduler.refreshProvider(name);
    }

    FailoverController failoverController() {
        return failover;
    }

    private LlmResponse complete(
        Conversation conversation,
        Predicate<LlmProvider> requirement,
        ProviderCall call,
        StreamAccumulator stream,
        CancellationSignal cancellation
    ) throws OrchestrationException {
        cancellation.throwIfCancelled();
        LlmProvider provider = firstProvider(requirement);

        List<ChatMessage> history = trimFor(provider, conversation);
        LlmResponse response;
        try {
            response = call.send(provider, history);
        } catch (Exception e) {
            rethrowIfCancelled(e, cancellation);
            LOG.warn("Provider {} failed, trying failover", provider.name(), e);
            failover.markFailed(provider);
            Optional<LlmProvider> substitute = failover.eligible(requirement);
            if (substitute.isEmpty()) {
                LOG.warn("No substitute provider available after {} failed", provider.name());
                response = degraded(stream);
            } else {
                provider = substitute.get();
                history = trimFor(provider, conversation);
                if (stream != null) {
                    stream.notice(String.format(FAILOVER_NOTICE, provider.name()));
                }
                try {
                    response = call.send(provider, history);
                } catch (Exception retryFailure) {
                    rethrowIfCancelled(retryFailure, cancellation);
                    LOG.warn("Backup provider {} failed as well", provider.name(), retryFailure);
                    failover.markFailed(provider);
                    response = degraded(stream);
                }
            }
        }

        cancellation.throwIfCancelled();
        if (!response.degraded()) {
            LOG.debug("Provider {} answered with model {}", response.providerName(), response.modelName());
            response = processTools(response, stream, cancellation);
            if (response.usage().isEmpty()) {
                response = response.withUsage(Usage.of(
                    TokenEstimator.estimate(history),
                    TokenEstimator.estimate(response.content())
                ));
            }
        }

        cancellation.throwIfCancelled();
        conversation.append(response.message(), clock.instant());
        persist(conversation);
        return response.withConversationId(conversation.id());
    }

    private LlmProvider firstProvider(Predicate<LlmProvider> requirement) throws NoProviderAvailableException {
        if (registry.isEmpty()) {
            LOG.error("No provider configured");
            throw new NoProviderAvailableException("No LLM provider is configured");
        }
        Optional<LlmProvider> provider = failover.eligible(requirement);
        if (provider.isEmpty()) {
            LOG.error("No provider available: every configured provider is backing off or unusable");
            throw new NoProviderAvailableException("No LLM provider is available");
        }
        return provider.get();
    }

    private List<ChatMessage> trimFor(LlmProvider provider, Conversation conversation) {
        ModelInfo model = provider.currentModel();
        int context = model == null || model.maxContextLength() <= 0
            ? settings.defaultContextLength()
            : model.maxContextLength();
        int budget = Math.max(0, context - settings.responseReserveTokens());
        return trimmer.trim(conversation.messages(), budget);
    }

    /**
     * When streaming, the stored and returned content is what the caller actually saw: the
     * streamed text plus any tool results emitted as a final chunk. Inline results rewritten into
     * the middle of the text are the exception; the processed content is kept as is.
     */
    private LlmResponse processTools(LlmResponse response, StreamAccumulator stream, CancellationSignal cancellation) {
        LlmResponse processed = toolProcessor.process(response, cancellation);
        if (stream == null) {
            return processed;
        }
        String streamed = stream.text();
        String original = response.content();
        String content = processed.content();
        if (streamed.isEmpty() || content.startsWith(streamed)) {
            stream.accept(content.substring(streamed.length()));
            return processed;
        }
        if (!content.startsWith(original)) {
            return processed;
        }
        stream.accept(content.substring(original.length()));
        return processed.withContent(stream.text());
    }

    private LlmResponse degraded(StreamAccumulator stream) {
        if (stream != null) {
            stream.accept(DEGRADED_MESSAGE);
        }
        return LlmResponse.degraded(DEGRADED_MESSAGE);
    }

    private Conversation openConversation(String conversationId, boolean mustExist) throws ConversationNotFoundException {
        if (conversationId != null && !conversationId.isBlank()) {
            Optional<Conversation> existing;
            try {
                existing = repository.get(conversationId);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load conversation " + conversationId, e);
            }
            if (existing.isPresent()) {
                return existing.get();
            }
            if (mustExist) {
                throw new ConversationNotFoundException(conversationId);
            }
            LOG.debug("Conversation {} not found, starting a new one", conversationId);
        }
        return Conversation.start(defaultPrompt(), null, clock);
    }

    private void persist(Conversation conversation) {
        try {
            if (repository.get(conversation.id()).isPresent()) {
                repository.update(conversation);
            } else {
                repository.add(conversation);
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to persist conversation {}", conversation.id(), e);
        }
    }

    private String defaultPrompt() {
        try {
            SystemPrompt prompt = prompts.defaultPrompt();
            return prompt == null ? "" : prompt.content();
        } catch (IOException e) {
            LOG.warn("Failed to load default system prompt", e);
            return "";
        }
    }

    private static void rethrowIfCancelled(Exception failure, CancellationSignal cancellation) {
        if (failure instanceof CancellationException cancelled) {
            throw cancelled;
        }
        if (cancellation.isCancelled()) {
            CancellationException cancelled = new CancellationException("operation cancelled");
            cancelled.initCause(failure);
            throw cancelled;
        }
    }

    @FunctionalInterface
    private interface ProviderCall {
        LlmResponse send(LlmProvider provider, List<ChatMessage> history) throws IOException;
    }

    /**
     * Forwards every chunk to the caller and keeps the text of the current attempt.
     */
    private static final class StreamAccumulator implements Consumer<String> {
        private final Consumer<String> downstream;
        private final StringBuilder buffer = new StringBuilder();

        private StreamAccumulator(Consumer<String> downstream) {
            this.downstream = downstream == null ? chunk -> { } : downstream;
        }

        @Override
        public synchronized void accept(String chunk) {
            if (chunk == null || chunk.isEmpty()) {
                return;
            }
            buffer.append(chunk);
            downstream.accept(chunk);
        }

        synchronized void notice(String text) {
            buffer.setLength(0);
            downstream.accept(text);
        }

        synchronized String text() {
            return buffer.toString();
        }
    }
}

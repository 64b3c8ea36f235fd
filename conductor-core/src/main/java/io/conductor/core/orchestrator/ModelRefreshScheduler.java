package io.conductor.core.orchestrator;

import io.conductor.core.model.ModelInfo;
import io.conductor.core.provider.LlmProvider;
import io.conductor.core.provider.ProviderRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically re-fetches every credentialed provider's model catalog and moves each provider to
 * the newest model of its current family. Runs are single-flight: a run requested while another
 * is in progress is dropped.
 */
public final class ModelRefreshScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ModelRefreshScheduler.class);
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMinutes(2);
    public static final Duration DEFAULT_INTERVAL = Duration.ofHours(24);

    private static final Pattern VERSION_SEGMENT = Pattern.compile("-\\d+(?:\\.\\d+)?(?=-|$)");
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final String LATEST = "latest";

    private final ProviderRegistry registry;
    private final Duration initialDelay;
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean();
    private ScheduledExecutorService executor;

    public ModelRefreshScheduler(ProviderRegistry registry) {
        this(registry, DEFAULT_INITIAL_DELAY, DEFAULT_INTERVAL);
    }

    public ModelRefreshScheduler(ProviderRegistry registry, Duration initialDelay, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.registry = registry;
        this.initialDelay = initialDelay == null || initialDelay.isNegative() ? Duration.ZERO : initialDelay;
        this.interval = interval;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "model-refresh");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleAtFixedRate(this::scheduledRun, initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Model refresh scheduled every {} (first run in {})", interval, initialDelay);
    }

    public synchronized boolean isStarted() {
        return executor != null;
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        executor = null;
        LOG.info("Model refresh stopped");
    }

    /**
     * Refreshes every credentialed provider and applies same-family upgrades. Returns false when
     * another run was already in progress and this request was dropped.
     */
    public boolean refreshAll() {
        if (!running.compareAndSet(false, true)) {
            LOG.info("Model refresh already in progress, skipping");
            return false;
        }
        try {
            LOG.info("Refreshing models for all credentialed providers");
            for (LlmProvider provider : registry.all()) {
                if (!provider.hasValidApiKey()) {
                    continue;
                }
                try {
                    List<ModelInfo> catalog = provider.fetchAvailableModels();
                    LOG.info("Refreshed {} models for provider {}", catalog.size(), provider.name());
                    upgrade(provider, catalog);
                } catch (Exception e) {
                    LOG.warn("Model refresh failed for provider {}", provider.name(), e);
                }
            }
            LOG.info("Model refresh completed");
            return true;
        } finally {
            running.set(false);
        }
    }

    /**
     * Re-fetches one provider's catalog without changing its selected model.
     */
    public boolean refreshProvider(String name) {
        Optional<LlmProvider> found = registry.find(name);
        if (found.isEmpty()) {
            LOG.warn("Provider not found for model refresh: {}", name);
            return false;
        }
        LlmProvider provider = found.get();
        if (!provider.hasValidApiKey()) {
            LOG.warn("Cannot refresh models for provider without valid API key: {}", provider.name());
            return false;
        }
        try {
            List<ModelInfo> catalog = provider.fetchAvailableModels();
            LOG.info("Refreshed {} models for provider {}", catalog.size(), provider.name());
            return true;
        } catch (Exception e) {
            LOG.warn("Model refresh failed for provider {}", provider.name(), e);
            return false;
        }
    }

    /**
     * Model family of an identifier: vendor prefix, {@code -latest} and numeric version segments
     * removed. {@code openai/gpt-4-turbo-2024-04-09} and {@code gpt-4-turbo-latest} both map to
     * {@code gpt-turbo}.
     */
    static String baseName(String modelId) {
        String name = modelId == null ? "" : modelId.trim().toLowerCase(Locale.ROOT);
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = name.replace("-" + LATEST, "");
        return VERSION_SEGMENT.matcher(name).replaceAll("");
    }

    /**
     * Orders identifiers by their numeric segments, left to right. {@code 3.10} is newer than
     * {@code 3.5}; an identifier with extra trailing segments (a date suffix) is newer.
     */
    static int compareVersions(String left, String right) {
        List<Long> a = numbers(left);
        List<Long> b = numbers(right);
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int compared = Long.compare(a.get(i), b.get(i));
            if (compared != 0) {
                return compared;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    static Optional<ModelInfo> findUpgrade(ModelInfo current, List<ModelInfo> catalog) {
        if (current == null || catalog == null || catalog.isEmpty()) {
            return Optional.empty();
        }
        String family = baseName(current.id());
        List<ModelInfo> sameFamily = catalog.stream()
            .filter(model -> !model.id().equalsIgnoreCase(current.id()))
            .filter(model -> baseName(model.id()).equals(family))
            .toList();
        if (sameFamily.isEmpty()) {
            return Optional.empty();
        }

        if (!isLatest(current.id())) {
            Optional<ModelInfo> latest = sameFamily.stream()
                .filter(model -> isLatest(model.id()) && model.covers(current))
                .findFirst();
            if (latest.isPresent()) {
                return latest;
            }
        }

        ModelInfo best = null;
        for (ModelInfo candidate : sameFamily) {
            if (isLatest(candidate.id()) || !candidate.covers(current)) {
                continue;
            }
            if (best == null || compareVersions(candidate.id(), best.id()) > 0) {
                best = candidate;
            }
        }
        if (best != null && compareVersions(best.id(), current.id()) > 0) {
            return Optional.of(best);
        }
        return Optional.empty();
    }

    private void scheduledRun() {
        try {
            refreshAll();
        } catch (RuntimeException e) {
            LOG.warn("Scheduled model refresh failed", e);
        }
    }

    private void upgrade(LlmProvider provider, List<ModelInfo> catalog) {
        ModelInfo current = provider.currentModel();
        Optional<ModelInfo> upgrade = findUpgrade(current, catalog);
        if (upgrade.isEmpty()) {
            return;
        }
        String target = upgrade.get().id();
        if (provider.setModel(target)) {
            LOG.info("Upgraded provider {} from model {} to {}", provider.name(), current.id(), target);
        } else {
            LOG.warn("Provider {} rejected model upgrade to {}", provider.name(), target);
        }
    }

    private static boolean isLatest(String modelId) {
        return modelId.toLowerCase(Locale.ROOT).contains(LATEST);
    }

    private static List<Long> numbers(String modelId) {
        List<Long> numbers = new ArrayList<>();
        if (modelId == null) {
            return numbers;
        }
        Matcher matcher = NUMBER.matcher(modelId);
        while (matcher.find()) {
            try {
                numbers.add(Long.parseLong(matcher.group()));
            } catch (NumberFormatException e) {
                numbers.add(Long.MAX_VALUE);
            }
        }
        return numbers;
    }
}

package io.conductor.core.provider;

import io.conductor.core.model.ModelInfo;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns active-provider selection and failure bookkeeping. Every read-then-write runs under one
 * lock that is held only for the decision itself, never across a provider call.
 */
public final class FailoverController {
    private static final Logger LOG = LoggerFactory.getLogger(FailoverController.class);
    public static final Duration DEFAULT_BACKOFF = Duration.ofMinutes(5);

    private final ProviderRegistry registry;
    private final Clock clock;
    private final Duration backoff;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, FailureRecord> failures = new HashMap<>();
    private LlmProvider active;
    private boolean pinned;

    public FailoverController(ProviderRegistry registry, Clock clock) {
        this(registry, clock, DEFAULT_BACKOFF);
    }

    public FailoverController(ProviderRegistry registry, Clock clock, Duration backoff) {
        this.registry = registry;
        this.clock = clock;
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be >= 0");
        }
        this.backoff = backoff;
    }

    public Duration backoff() {
        return backoff;
    }

    /**
     * Re-runs active selection: an initialized, credentialed provider that is not backing off;
     * then any credentialed provider that is not backing off; then the first configured provider
     * that is not backing off.
     */
    public Optional<LlmProvider> selectActive() {
        lock.lock();
        try {
            pinned = false;
            return Optional.ofNullable(selectLocked(clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current active provider. Selection runs lazily when nothing eligible is active, so providers
     * whose failure records went stale become eligible again without an expiry sweep. A provider
     * chosen through {@link #setActive(String)} stays pinned until it fails.
     */
    public Optional<LlmProvider> activeProvider() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (active == null || (!pinned && !isEligible(active, now))) {
                selectLocked(now);
            }
            return Optional.ofNullable(active);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a failure for {@code provider}. If it was the active provider, selection runs again
     * immediately. Returns the active provider after the update.
     */
    public Optional<LlmProvider> markFailed(LlmProvider provider) {
        lock.lock();
        try {
            Instant now = clock.instant();
            failures.put(ProviderRegistry.normalize(provider.name()), new FailureRecord(provider.name(), now));
            LOG.warn("Provider {} marked failed; ineligible for {}", provider.name(), backoff);
            if (active == null || sameProvider(active, provider)) {
                pinned = false;
                selectLocked(now);
            }
            return Optional.ofNullable(active);
        } finally {
            lock.unlock();
        }
    }

    /**
     * First eligible provider that is not the active one.
     */
    public Optional<LlmProvider> fallback() {
        return fallback(provider -> true);
    }

    public Optional<LlmProvider> fallback(Predicate<LlmProvider> filter) {
        lock.lock();
        try {
            Instant now = clock.instant();
            for (LlmProvider provider : registry.all()) {
                if (active != null && sameProvider(active, provider)) {
                    continue;
                }
                if (isEligible(provider, now) && filter.test(provider)) {
                    return Optional.of(provider);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * First eligible provider matching {@code filter}, preferring the active provider.
     */
    public Optional<LlmProvider> eligible(Predicate<LlmProvider> filter) {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (active == null) {
                selectLocked(now);
            }
            if (active != null && isEligible(active, now) && filter.test(active)) {
                return Optional.of(active);
            }
            for (LlmProvider provider : registry.all()) {
                if (isEligible(provider, now) && filter.test(provider)) {
                    return Optional.of(provider);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Manual override: activates the named provider even when it is backing off and clears its
     * failure record. A provider without usable credentials is refused.
     */
    public boolean setActive(String name) {
        Optional<LlmProvider> provider = registry.find(name);
        if (provider.isEmpty()) {
            LOG.warn("Provider not found: {}", name);
            return false;
        }
        if (!provider.get().hasValidApiKey()) {
            LOG.warn("Provider {} has no valid API key, keeping current selection", provider.get().name());
            return false;
        }
        lock.lock();
        try {
            failures.remove(ProviderRegistry.normalize(provider.get().name()));
            active = provider.get();
            pinned = true;
            LOG.info("Active provider set to {}", active.name());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isBackingOff(LlmProvider provider) {
        lock.lock();
        try {
            return isBackingOffLocked(provider, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public Optional<FailureRecord> failureRecord(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(failures.get(ProviderRegistry.normalize(name)));
        } finally {
            lock.unlock();
        }
    }

    public ProviderStatus status(String name) {
        Optional<LlmProvider> provider = registry.find(name);
        if (provider.isEmpty()) {
            return ProviderStatus.UNKNOWN;
        }
        lock.lock();
        try {
            return statusLocked(provider.get(), clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public List<ProviderSnapshot> snapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<ProviderSnapshot> snapshots = new ArrayList<>();
            for (LlmProvider provider : registry.all()) {
                FailureRecord failure = failures.get(ProviderRegistry.normalize(provider.name()));
                ModelInfo model = provider.currentModel();
                snapshots.add(new ProviderSnapshot(
                    provider.name(),
                    statusLocked(provider, now),
                    provider.hasValidApiKey(),
                    model == null ? "" : model.id(),
                    provider.supportsStreaming(),
                    provider.supportsToolCalls(),
                    provider.supportsVision(),
                    failure == null ? null : failure.age(now)
                ));
            }
            return snapshots;
        } finally {
            lock.unlock();
        }
    }

    private LlmProvider selectLocked(Instant now) {
        List<LlmProvider> providers = registry.all();
        LlmProvider selected = firstMatching(providers,
            provider -> registry.isInitialized(provider) && isEligible(provider, now));
        if (selected == null) {
            selected = firstMatching(providers, provider -> isEligible(provider, now));
        }
        if (selected == null) {
            selected = firstMatching(providers, provider -> !isBackingOffLocked(provider, now));
        }

        LlmProvider previous = active;
        active = selected;
        if (selected == null) {
            if (!providers.isEmpty()) {
                LOG.warn("No eligible provider: all {} providers are backing off", providers.size());
            }
        } else if (previous == null || !sameProvider(previous, selected)) {
            LOG.info("Active provider set to {}", selected.name());
        }
        return selected;
    }

    private LlmProvider firstMatching(List<LlmProvider> providers, Predicate<LlmProvider> predicate) {
        for (LlmProvider provider : providers) {
            if (predicate.test(provider)) {
                return provider;
            }
        }
        return null;
    }

    private boolean isEligible(LlmProvider provider, Instant now) {
        return provider.hasValidApiKey() && !isBackingOffLocked(provider, now);
    }

    private boolean isBackingOffLocked(LlmProvider provider, Instant now) {
        FailureRecord record = failures.get(ProviderRegistry.normalize(provider.name()));
        return record != null && record.isLive(now, backoff);
    }

    private ProviderStatus statusLocked(LlmProvider provider, Instant now) {
        if (active != null && sameProvider(active, provider)) {
            return ProviderStatus.ACTIVE;
        }
        if (isBackingOffLocked(provider, now)) {
            return ProviderStatus.FAILED;
        }
        return registry.isInitialized(provider) ? ProviderStatus.INITIALIZED : ProviderStatus.UNKNOWN;
    }

    private boolean sameProvider(LlmProvider left, LlmProvider right) {
        return ProviderRegistry.normalize(left.name()).equals(ProviderRegistry.normalize(right.name()));
    }
}

package com.knowledge.extraction.invoke;

import com.knowledge.extraction.cache.NoOpResponseCache;
import com.knowledge.extraction.cache.ResponseCache;
import com.knowledge.extraction.core.model.CascadeAttempt;
import com.knowledge.extraction.core.model.CascadeAttempt.Outcome;
import com.knowledge.extraction.core.model.ModelDescriptor;
import com.knowledge.extraction.llm.GenerationOptions;
import com.knowledge.extraction.llm.LLMProvider;
import com.knowledge.extraction.llm.LLMResponse;
import com.knowledge.extraction.llm.LLMTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls one model with a hard timeout and records the attempt.
 *
 * <p>Calls run on the invoker's own pool so that a call exceeding its timeout can be
 * cancelled (interrupting the provider) without tying up the chunk worker that asked
 * for it. There are no retries: falling back is the cascade's job. Every call, cached
 * or not, emits exactly one {@link CascadeAttempt} to the registered listeners.</p>
 */
public class ModelInvoker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ModelInvoker.class);

    private final LLMProvider provider;
    private final ResponseCache cache;
    private final ExecutorService executor;
    private final List<CascadeAttemptListener> listeners = new CopyOnWriteArrayList<>();

    public ModelInvoker(LLMProvider provider) {
        this(provider, new NoOpResponseCache());
    }

    public ModelInvoker(LLMProvider provider, ResponseCache cache) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.executor = Executors.newCachedThreadPool(new InvokerThreadFactory());
    }

    public void addListener(CascadeAttemptListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    public void removeListener(CascadeAttemptListener listener) {
        listeners.remove(listener);
    }

    /**
     * Calls the model once.
     *
     * @param model     the model to call
     * @param prompt    the prompt
     * @param chunkId   chunk the call is made for
     * @param cascadeId identifier of the cascade run the call belongs to
     * @return the outcome; never throws for provider failures
     */
    public InvocationResult invoke(ModelDescriptor model, String prompt, String chunkId, String cascadeId) {
        Objects.requireNonNull(model, "model is required");
        Objects.requireNonNull(prompt, "prompt is required");

        Optional<String> cached = cache.get(model.modelId(), prompt);
        if (cached.isPresent()) {
            log.debug("invoke.cached model={} chunkId={}", model.modelId(), chunkId);
            return emit(new InvocationResult(Outcome.CACHED, cached.get(), 0, model.modelId(), model.rank()),
                    chunkId, cascadeId);
        }

        GenerationOptions options = GenerationOptions.from(model);
        long start = System.nanoTime();
        Future<LLMResponse> future = executor.submit(() -> provider.generate(model.modelId(), prompt, options));
        InvocationResult result;
        try {
            LLMResponse response = future.get(model.timeout().toMillis(), TimeUnit.MILLISECONDS);
            result = new InvocationResult(Outcome.SUCCESS, response.text(), elapsedMs(start),
                    model.modelId(), model.rank());
            cache.put(model.modelId(), prompt, response.text());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("invoke.timeout model={} rank={} chunkId={} timeoutMs={}",
                    model.modelId(), model.rank(), chunkId, model.timeout().toMillis());
            result = failure(Outcome.TIMEOUT, start, model);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            Outcome outcome = cause instanceof LLMTimeoutException ? Outcome.TIMEOUT : Outcome.TRANSPORT_ERROR;
            log.warn("invoke.failed model={} rank={} chunkId={} outcome={} error={}",
                    model.modelId(), model.rank(), chunkId, outcome, cause.toString());
            result = failure(outcome, start, model);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.debug("invoke.cancelled model={} chunkId={}", model.modelId(), chunkId);
            result = failure(Outcome.CANCELLED, start, model);
        }
        return emit(result, chunkId, cascadeId);
    }

    /**
     * Records a run of the deterministic rank-3 fallback so that it is counted like a model call.
     */
    public void recordFallbackAttempt(String fallbackName, long latencyMs, String chunkId, String cascadeId) {
        publish(new CascadeAttempt(ModelDescriptor.FALLBACK_RANK, fallbackName, latencyMs, true,
                chunkId, cascadeId, Outcome.SUCCESS, Instant.now()));
    }

    private InvocationResult emit(InvocationResult result, String chunkId, String cascadeId) {
        publish(new CascadeAttempt(result.rank(), result.modelId(), result.latencyMs(), result.isSuccess(),
                chunkId, cascadeId, result.outcome(), Instant.now()));
        return result;
    }

    private void publish(CascadeAttempt attempt) {
        for (CascadeAttemptListener listener : listeners) {
            try {
                listener.onAttempt(attempt);
            } catch (RuntimeException e) {
                log.warn("Cascade attempt listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }

    private static InvocationResult failure(Outcome outcome, long start, ModelDescriptor model) {
        return new InvocationResult(outcome, null, elapsedMs(start), model.modelId(), model.rank());
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class InvokerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "model-invoker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

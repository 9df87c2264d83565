package com.example.ResearchGraph.service;

import com.example.ResearchGraph.common.convention.errorcode.RagErrorCode;
import com.example.ResearchGraph.common.convention.exception.ServiceException;
import com.example.ResearchGraph.config.RagProperties;
import com.example.ResearchGraph.model.AskResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Lets identical concurrent cache misses in this process share a single generation.
 *
 * <p>The first caller for a key runs the work; callers arriving while it runs wait
 * for the same result (or the same exception), for at most
 * {@code rag.cache.single-flight-wait}. A waiting caller that is interrupted stops
 * waiting. Nothing is shared across processes, so duplicate generations are still
 * possible there.</p>
 */
@Component
@RequiredArgsConstructor
public class InFlightAnswers {

    private static final Logger log = LoggerFactory.getLogger(InFlightAnswers.class);

    private final ConcurrentHashMap<String, CompletableFuture<AskResponse>> inFlight = new ConcurrentHashMap<>();

    private final RagProperties properties;

    public AskResponse join(String key, Supplier<AskResponse> work) {
        CompletableFuture<AskResponse> mine = new CompletableFuture<>();
        CompletableFuture<AskResponse> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("Joining in-flight generation for key={}", key);
            return await(key, existing);
        }

        try {
            AskResponse response = work.get();
            mine.complete(response);
            return response;
        } catch (RuntimeException | Error ex) {
            mine.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private AskResponse await(String key, CompletableFuture<AskResponse> future) {
        Duration maxWait = properties.getCache().getSingleFlightWait();
        try {
            return future.get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Interrupted while waiting for an in-flight answer", ex,
                    RagErrorCode.SERVICE_ERROR);
        } catch (TimeoutException ex) {
            log.warn("Gave up waiting {}ms for in-flight generation key={}", maxWait.toMillis(), key);
            throw new ServiceException("Timed out waiting for an in-flight answer", ex,
                    RagErrorCode.SERVICE_ERROR);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (ex.getCause() instanceof Error error) {
                throw error;
            }
            throw new ServiceException(null, ex.getCause(), RagErrorCode.SERVICE_ERROR);
        }
    }
}

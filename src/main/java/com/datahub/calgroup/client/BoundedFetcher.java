package com.datahub.calgroup.client;

import com.datahub.calgroup.exception.HubTransportException;
import com.datahub.calgroup.exception.SyncException;
import com.datahub.calgroup.model.dto.HubRequest;
import com.datahub.calgroup.model.dto.HubResponse;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs hub API requests on the fetch pool with a cap on how many are in flight.
 *
 * A request takes a slot from a semaphore bulkhead before it touches the network
 * and hands it back when the call returns, whatever the outcome. Requests that
 * find no free slot wait in a FIFO queue without holding a pool thread, and are
 * dispatched as slots come back. The per-request timeout starts at dispatch.
 * A concurrency of 0 disables the cap.
 */
@Slf4j
@Component
public class BoundedFetcher {

    private final RestTemplate restTemplate;
    private final ExecutorService executor;
    private final Bulkhead bulkhead;
    private final Duration defaultTimeout;
    private final Duration slotWait;
    private final Queue<PendingFetch> waiting = new ConcurrentLinkedQueue<>();

    public BoundedFetcher(@Qualifier("hubRestTemplate") RestTemplate restTemplate,
                          @Qualifier("hubFetchExecutor") ExecutorService executor,
                          @Value("${calgroup.hub.concurrency:10}") int concurrency,
                          @Value("${calgroup.hub.request-timeout-seconds:60}") long timeoutSeconds,
                          @Value("${calgroup.hub.slot-wait-seconds:600}") long slotWaitSeconds) {
        if (concurrency < 0) {
            throw new IllegalArgumentException("concurrency must be >= 0, got " + concurrency);
        }
        this.restTemplate = restTemplate;
        this.executor = executor;
        this.defaultTimeout = Duration.ofSeconds(timeoutSeconds);
        this.slotWait = Duration.ofSeconds(slotWaitSeconds);
        if (concurrency > 0) {
            // zero wait: permissions are only ever tried, queued requests wait in 'waiting'
            this.bulkhead = Bulkhead.of("hubFetch", BulkheadConfig.custom()
                    .maxConcurrentCalls(concurrency)
                    .maxWaitDuration(Duration.ZERO)
                    .build());
            log.info("Hub fetches limited to {} concurrent requests", concurrency);
        } else {
            this.bulkhead = null;
            log.info("Hub fetch concurrency is unbounded");
        }
    }

    /**
     * Starts the request and returns immediately. The future fails with a
     * {@link SyncException} on timeout, transport error or error status.
     * Cancelling it before a slot is free drops the request from the queue.
     */
    public CompletableFuture<HubResponse> fetchAsync(HubRequest request) {
        PendingFetch fetch = new PendingFetch(request);
        if (bulkhead == null) {
            dispatch(fetch);
            return fetch.result;
        }
        waiting.add(fetch);
        fetch.result.whenComplete((response, error) -> {
            if (error != null) {
                waiting.remove(fetch);
            }
        });
        CompletableFuture.delayedExecutor(slotWait.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            if (waiting.remove(fetch)) {
                fetch.result.completeExceptionally(
                        new HubTransportException("No hub fetch slot became free for " + request.url()
                                + " within " + slotWait.toSeconds() + "s"));
            }
        });
        drain();
        return fetch.result;
    }

    /**
     * Requests waiting for a slot.
     */
    public int queuedRequests() {
        return waiting.size();
    }

    /**
     * Slots currently free, or -1 when concurrency is unbounded.
     */
    public int availableSlots() {
        return bulkhead != null ? bulkhead.getMetrics().getAvailableConcurrentCalls() : -1;
    }

    /**
     * Waits for a future produced by this fetcher and unwraps its failure.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SyncException syncException) {
                throw syncException;
            }
            throw new HubTransportException("Hub request failed: " + cause.getMessage(), cause);
        }
    }

    private void drain() {
        while (!waiting.isEmpty()) {
            if (!bulkhead.tryAcquirePermission()) {
                return;
            }
            PendingFetch next = waiting.poll();
            if (next == null || next.result.isDone()) {
                bulkhead.releasePermission();
                continue;
            }
            dispatch(next);
        }
    }

    private void dispatch(PendingFetch fetch) {
        HubRequest request = fetch.request;
        Duration timeout = request.timeout() != null ? request.timeout() : defaultTimeout;
        CompletableFuture<HubResponse> call;
        try {
            call = CompletableFuture.supplyAsync(() -> {
                try {
                    return exchange(request);
                } finally {
                    // the slot stays taken until the network call returns, even after a timeout
                    onCallFinished();
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            if (bulkhead != null) {
                bulkhead.releasePermission();
            }
            fetch.result.completeExceptionally(
                    new HubTransportException("Hub fetch pool rejected request to " + request.url(), e));
            return;
        }
        call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((response, error) -> {
                    if (error == null) {
                        fetch.result.complete(response);
                    } else {
                        fetch.result.completeExceptionally(translate(error, request, timeout));
                    }
                });
    }

    private void onCallFinished() {
        if (bulkhead != null) {
            bulkhead.onComplete();
            drain();
        }
    }

    private HubResponse exchange(HubRequest request) {
        HttpEntity<Void> entity = new HttpEntity<>(request.headers());
        try {
            ResponseEntity<String> response = restTemplate.exchange(request.url(), HttpMethod.GET, entity, String.class);
            return new HubResponse(request.url(), response.getStatusCode().value(), response.getBody());
        } catch (HttpStatusCodeException e) {
            throw new HubTransportException("Hub returned " + e.getStatusCode().value() + " for " + request.url(), e);
        } catch (RestClientException e) {
            throw new HubTransportException("Hub request to " + request.url() + " failed: " + e.getMessage(), e);
        }
    }

    private static SyncException translate(Throwable error, HubRequest request, Duration timeout) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof SyncException syncException) {
            return syncException;
        }
        if (cause instanceof TimeoutException) {
            return new HubTransportException(
                    "Hub request to " + request.url() + " timed out after " + timeout.toMillis() + "ms", cause);
        }
        return new HubTransportException("Hub request to " + request.url() + " failed: " + cause.getMessage(), cause);
    }

    private static final class PendingFetch {

        private final HubRequest request;
        private final CompletableFuture<HubResponse> result = new CompletableFuture<>();

        private PendingFetch(HubRequest request) {
            this.request = request;
        }
    }
}

package cz.vut.fit.whoisradar.client;

import cz.vut.fit.whoisradar.Common;
import cz.vut.fit.whoisradar.client.transport.TransportChannel;
import cz.vut.fit.whoisradar.client.transport.TransportException;
import cz.vut.fit.whoisradar.client.transport.TransportRequest;
import cz.vut.fit.whoisradar.models.LookupResult;
import io.vertx.core.Future;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * Performs a WHOIS lookup that follows referrals.
 * <p>
 * The lookup starts at the server given in the {@link WhoisOptions}. Each hop sends the query (in the dialect
 * of the server) and repeats the attempt while the response is blank, up to {@link WhoisOptions#maxRetries()}
 * times. If the response refers to another server, that server is queried next; otherwise, the lookup ends and
 * the fields are extracted from the last response.
 * <p>
 * There is no limit on the number of hops. Only a server that refers to itself ends the lookup; two servers
 * referring to each other are followed indefinitely.
 *
 * @author WhoisRadar contributors
 */
public class RecursiveResolver {
    public static final String COMPONENT_NAME = "resolver";
    private static final Logger Logger = Common.getComponentLogger(RecursiveResolver.class);

    private final TransportChannel _channel;

    public RecursiveResolver(@NotNull TransportChannel channel) {
        _channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Performs the lookup and waits for its result. Must not be called on a Vert.x event loop thread.
     * <p>
     * If the calling thread is interrupted, the lookup is cancelled, the interrupt flag is restored and a
     * {@link CancellationException} is thrown.
     *
     * @param query   The domain name or IP address to look up.
     * @param options The lookup parameters.
     * @return The result of the lookup.
     * @throws TransportException if a server could not be reached and
     *                            {@link WhoisOptions#rethrowTransportErrors()} is set.
     */
    @NotNull
    public LookupResult resolve(@NotNull String query, @NotNull WhoisOptions options) throws TransportException {
        final var signal = new CancellationSignal();
        return await(resolveAsync(query, options, signal), signal);
    }

    /**
     * Performs the lookup without blocking the calling thread (given a non-blocking {@link TransportChannel}).
     *
     * @param query   The domain name or IP address to look up.
     * @param options The lookup parameters.
     * @param signal  A signal that cancels the lookup. Once it fires, no further attempt is made and the
     *                returned future fails with a {@link CancellationException}.
     * @return A future of the result. It fails with a {@link TransportException} if a server could not be
     * reached and {@link WhoisOptions#rethrowTransportErrors()} is set.
     */
    @NotNull
    public Future<LookupResult> resolveAsync(@NotNull String query, @NotNull WhoisOptions options,
                                             @NotNull CancellationSignal signal) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(signal, "signal");

        final var servers = new ArrayList<String>();
        servers.add(options.server());
        Logger.debug("Looking up {} starting at {}:{}", query, options.server(), options.port());
        return hop(query, options, signal, servers, options.port());
    }

    private Future<LookupResult> hop(String query, WhoisOptions options, CancellationSignal signal,
                                     List<String> servers, int port) {
        if (signal.isCancelled())
            return Future.failedFuture(CancellationSignal.cancelled("Lookup of " + query));

        final var server = servers.get(servers.size() - 1);
        final var request = new TransportRequest(server, port, QueryStatementBuilder.build(server, query),
                options.encoding(), options.timeoutSeconds(), options.rethrowTransportErrors());
        Logger.debug("[{}] Hop {}: sending '{}'", request, servers.size(), request.queryLine());

        return this.fetch(request, signal, options.maxRetries(), 1)
                .compose(response -> {
                    final var referral = ReferralDetector.detect(response, server);
                    if (referral.isEmpty()) {
                        Logger.debug("[{}] No further referral, {} server(s) queried", request, servers.size());
                        return Future.succeededFuture(ResponseFieldExtractor.toResult(servers, response));
                    }

                    final var next = referral.get();
                    Logger.debug("[{}] Referred to {}:{}", request, next.host(), next.port());
                    servers.add(next.host());
                    return hop(query, options, signal, servers, next.port());
                });
    }

    /**
     * Sends the request until the response is not blank or the attempts run out. A failed attempt counts as
     * a blank response unless it is the last one.
     */
    private Future<String> fetch(TransportRequest request, CancellationSignal signal, int maxRetries, int attempt) {
        if (attempt > maxRetries) {
            Logger.warn("[{}] No attempts allowed, using an empty response", request);
            return Future.succeededFuture("");
        }
        if (signal.isCancelled())
            return Future.failedFuture(CancellationSignal.cancelled("Query to " + request));

        final boolean last = attempt >= maxRetries;
        return _channel.send(request, signal)
                .recover(e -> {
                    if (e instanceof CancellationException || signal.isCancelled())
                        return Future.failedFuture(e);

                    if (!last) {
                        Logger.debug("[{}] Attempt {}/{} failed: {}", request, attempt, maxRetries, e.getMessage());
                        return Future.succeededFuture("");
                    }

                    if (request.rethrow())
                        return Future.failedFuture(e);

                    Logger.warn("[{}] Last attempt failed: {}", request, e.getMessage());
                    return Future.succeededFuture("");
                })
                .compose(response -> {
                    if (!Common.isBlank(response))
                        return Future.succeededFuture(response);

                    if (last) {
                        Logger.warn("[{}] No response after {} attempt(s)", request, attempt);
                        return Future.succeededFuture(response == null ? "" : response);
                    }

                    Logger.debug("[{}] Blank response on attempt {}/{}, retrying", request, attempt, maxRetries);
                    return this.fetch(request, signal, maxRetries, attempt + 1);
                });
    }

    /**
     * Waits for a future on the calling thread and unwraps its failure.
     */
    static <T> T await(@NotNull Future<T> future, @NotNull CancellationSignal signal) throws TransportException {
        try {
            return future.toCompletionStage().toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            signal.cancel();
            throw CancellationSignal.cancelled("Interrupted lookup");
        } catch (ExecutionException e) {
            final var cause = e.getCause();
            if (cause instanceof TransportException transportException)
                throw transportException;
            if (cause instanceof RuntimeException runtimeException)
                throw runtimeException;
            if (cause instanceof Error error)
                throw error;
            throw new IllegalStateException("Lookup failed", cause);
        }
    }
}

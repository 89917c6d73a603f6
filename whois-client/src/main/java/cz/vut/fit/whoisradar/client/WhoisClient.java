package cz.vut.fit.whoisradar.client;

import cz.vut.fit.whoisradar.Common;
import cz.vut.fit.whoisradar.WhoisConfig;
import cz.vut.fit.whoisradar.client.transport.SocketTransportChannel;
import cz.vut.fit.whoisradar.client.transport.TransportChannel;
import cz.vut.fit.whoisradar.client.transport.TransportException;
import cz.vut.fit.whoisradar.client.transport.TransportRequest;
import cz.vut.fit.whoisradar.client.transport.VertxTransportChannel;
import cz.vut.fit.whoisradar.models.LookupResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.io.Closeable;
import java.util.Objects;
import java.util.Properties;

/**
 * The entry point of the WHOIS client library.
 * <p>
 * A client created by {@link #blocking(Properties)} performs the network I/O on the calling thread. A client
 * created by one of the {@code nonBlocking} factories runs it on Vert.x event loops; its blocking methods only
 * wait for the result. Both kinds offer both APIs.
 * <p>
 * Instances are thread-safe and keep no state between lookups.
 *
 * @author WhoisRadar contributors
 */
public class WhoisClient implements Closeable {
    public static final String COMPONENT_NAME = "client";
    private static final Logger Logger = Common.getComponentLogger(WhoisClient.class);

    private final TransportChannel _channel;
    private final RecursiveResolver _resolver;
    @Nullable
    private final Vertx _ownedVertx;

    private WhoisClient(@NotNull TransportChannel channel, @Nullable Vertx ownedVertx) {
        _channel = Objects.requireNonNull(channel, "channel");
        _resolver = new RecursiveResolver(channel);
        _ownedVertx = ownedVertx;
    }

    public WhoisClient(@NotNull TransportChannel channel) {
        this(channel, null);
    }

    /**
     * Creates a client that blocks the calling thread, with the transport delays taken from
     * {@link WhoisConfig} properties.
     */
    public static WhoisClient blocking(@NotNull Properties properties) {
        return new WhoisClient(new SocketTransportChannel(cooldownMs(properties), pacingMs(properties)));
    }

    /**
     * Creates a non-blocking client on the given Vert.x instance. The instance is not closed with the client.
     */
    public static WhoisClient nonBlocking(@NotNull Vertx vertx, @NotNull Properties properties) {
        return new WhoisClient(new VertxTransportChannel(vertx, cooldownMs(properties), pacingMs(properties)));
    }

    /**
     * Creates a non-blocking client with its own Vert.x instance, which is closed with the client.
     */
    public static WhoisClient nonBlocking(@NotNull Properties properties) {
        final long cooldownMs = cooldownMs(properties);
        final long pacingMs = pacingMs(properties);
        final var vertx = Vertx.vertx();
        return new WhoisClient(new VertxTransportChannel(vertx, cooldownMs, pacingMs), vertx);
    }

    /**
     * Looks up the query with the default options, starting at {@value WhoisConfig#SERVER_DEFAULT}.
     *
     * @see RecursiveResolver#resolve(String, WhoisOptions)
     */
    @NotNull
    public LookupResult resolve(@NotNull String query) throws TransportException {
        return this.resolve(query, WhoisOptions.defaults());
    }

    /**
     * Looks up the query, following referrals, and waits for the result.
     *
     * @see RecursiveResolver#resolve(String, WhoisOptions)
     */
    @NotNull
    public LookupResult resolve(@NotNull String query, @NotNull WhoisOptions options) throws TransportException {
        return _resolver.resolve(query, options);
    }

    /**
     * Looks up the query, following referrals.
     *
     * @see RecursiveResolver#resolveAsync(String, WhoisOptions, CancellationSignal)
     */
    @NotNull
    public Future<LookupResult> resolveAsync(@NotNull String query, @NotNull WhoisOptions options,
                                             @NotNull CancellationSignal signal) {
        return _resolver.resolveAsync(query, options, signal);
    }

    /**
     * Sends the query to a single server on port 43 with the default options.
     *
     * @see #rawQuery(String, WhoisOptions)
     */
    @NotNull
    public String rawQuery(@NotNull String query, @NotNull String server) throws TransportException {
        return this.rawQuery(query, WhoisOptions.defaults().withServer(server));
    }

    /**
     * Sends the query as it is to the server given in the options and returns its response. One attempt is
     * made; referrals are not followed and no fields are extracted.
     *
     * @param query   The query line, without the line terminator.
     * @param options The server, port, charset and timeout to use.
     * @return The response; empty if the server could not be reached and rethrowing is disabled.
     * @throws TransportException if the server could not be reached and
     *                            {@link WhoisOptions#rethrowTransportErrors()} is set.
     */
    @NotNull
    public String rawQuery(@NotNull String query, @NotNull WhoisOptions options) throws TransportException {
        final var signal = new CancellationSignal();
        return RecursiveResolver.await(this.rawQueryAsync(query, options, signal), signal);
    }

    /**
     * The asynchronous variant of {@link #rawQuery(String, WhoisOptions)}.
     */
    @NotNull
    public Future<String> rawQueryAsync(@NotNull String query, @NotNull WhoisOptions options,
                                        @NotNull CancellationSignal signal) {
        Objects.requireNonNull(query, "query");
        final var request = new TransportRequest(options.server(), options.port(), query, options.encoding(),
                options.timeoutSeconds(), options.rethrowTransportErrors());
        Logger.debug("[{}] Raw query: {}", request, query);
        return _channel.send(request, signal);
    }

    @Override
    public void close() {
        if (_ownedVertx == null)
            return;

        _ownedVertx.close()
                .onFailure(e -> Logger.warn("Failed to close Vert.x", e));
    }

    private static long cooldownMs(Properties properties) {
        return parseDelay(properties, WhoisConfig.COOLDOWN_MS_CONFIG, WhoisConfig.COOLDOWN_MS_DEFAULT);
    }

    private static long pacingMs(Properties properties) {
        return parseDelay(properties, WhoisConfig.PACING_MS_CONFIG, WhoisConfig.PACING_MS_DEFAULT);
    }

    private static long parseDelay(Properties properties, String key, String defaultValue) {
        try {
            return Long.parseLong(properties.getProperty(key, defaultValue).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value of " + key + ": " + e.getMessage(), e);
        }
    }
}

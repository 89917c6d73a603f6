package cz.vut.fit.whoisradar.client.transport;

import cz.vut.fit.whoisradar.Common;
import cz.vut.fit.whoisradar.client.CancellationSignal;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetClientOptions;
import io.vertx.core.net.NetSocket;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link TransportChannel} built on the Vert.x {@link NetClient}. No thread is ever blocked: the cooldown
 * after a failed connection and the pacing between chunks are Vert.x timers, and the response is collected
 * by socket handlers on the event loop.
 * <p>
 * When the {@link CancellationSignal} fires, the connection in progress is closed and the returned future
 * fails with a {@link CancellationException}.
 *
 * @author WhoisRadar contributors
 */
public class VertxTransportChannel implements TransportChannel {
    public static final String COMPONENT_NAME = "vertx";
    private static final Logger Logger = Common.getComponentLogger(VertxTransportChannel.class);

    private final Vertx _vertx;
    private final long _cooldownMs;
    private final long _pacingMs;

    public VertxTransportChannel(@NotNull Vertx vertx, long cooldownMs, long pacingMs) {
        if (cooldownMs < 0 || pacingMs < 0)
            throw new IllegalArgumentException("Negative delay");

        _vertx = Objects.requireNonNull(vertx, "vertx");
        _cooldownMs = cooldownMs;
        _pacingMs = pacingMs;
    }

    public VertxTransportChannel(@NotNull Vertx vertx) {
        this(vertx, DEFAULT_COOLDOWN_MS, DEFAULT_PACING_MS);
    }

    @Override
    public @NotNull Future<String> send(@NotNull TransportRequest request, @NotNull CancellationSignal signal) {
        if (signal.isCancelled())
            return Future.failedFuture(CancellationSignal.cancelled("Query to " + request));

        final var clientOptions = new NetClientOptions()
                .setConnectTimeout(request.timeoutMillis())
                .setIdleTimeoutUnit(TimeUnit.SECONDS)
                .setReadIdleTimeout(request.timeoutSeconds());
        final var client = _vertx.createNetClient(clientOptions);

        final Promise<String> promise = Promise.promise();
        final var socketRef = new AtomicReference<NetSocket>();

        final var registration = signal.register(() -> {
            Logger.debug("[{}] Cancelled", request);
            if (promise.tryFail(CancellationSignal.cancelled("Query to " + request))) {
                final var socket = socketRef.get();
                if (socket != null)
                    socket.close();
            }
        });

        Logger.trace("[{}] Connecting", request);
        client.connect(request.port(), request.host())
                .onSuccess(socket -> {
                    socketRef.set(socket);
                    if (promise.future().isComplete()) {
                        // Cancelled while connecting
                        socket.close();
                        return;
                    }
                    exchange(socket, request, promise);
                })
                .onFailure(e -> failure(request, new TransportException(request.host(), request.port(), e), promise));

        final var future = promise.future();
        future.onComplete(ar -> {
            registration.unregister();
            client.close();
        });
        return future;
    }

    private void exchange(NetSocket socket, TransportRequest request, Promise<String> promise) {
        final var response = Buffer.buffer();
        // All handlers run on the connection's event loop
        final var state = new ExchangeState();

        socket.handler(chunk -> {
            response.appendBuffer(chunk);
            Logger.trace("[{}] Received {} bytes", request, chunk.length());
            if (_pacingMs > 0) {
                state.paused = true;
                socket.pause();
                _vertx.setTimer(_pacingMs, id -> {
                    state.paused = false;
                    socket.resume();
                });
            }
        });
        // Reading stops when the server closes the connection or when the idle timeout closes it.
        // The end event is delivered after the chunks queued while the socket was paused.
        socket.endHandler(v -> complete(request, response, state, promise));
        socket.closeHandler(v -> {
            if (!state.paused)
                complete(request, response, state, promise);
        });
        socket.exceptionHandler(e -> {
            Logger.debug("[{}] Reading stopped after {} bytes: {}", request, response.length(), e.getMessage());
            socket.close();
        });

        // Bounds the single write; the read idle timeout bounds every read
        final long writeTimer = request.timeoutSeconds() > 0
                ? _vertx.setTimer(request.timeoutMillis(), id -> {
                    if (promise.future().isComplete())
                        return;

                    state.writeFailed = true;
                    socket.close();
                    failure(request, new TransportException(request.host(), request.port(),
                            "Write timed out (%d s)".formatted(request.timeoutSeconds())), promise);
                })
                : -1;

        socket.write(Buffer.buffer((request.queryLine() + CRLF).getBytes(request.encoding())))
                .onComplete(ar -> {
                    if (writeTimer >= 0)
                        _vertx.cancelTimer(writeTimer);
                })
                .onSuccess(v -> Logger.trace("[{}] Query sent: {}", request, request.queryLine()))
                .onFailure(e -> {
                    if (promise.future().isComplete() || state.writeFailed)
                        return;

                    state.writeFailed = true;
                    socket.close();
                    failure(request, new TransportException(request.host(), request.port(), e), promise);
                });
    }

    private static void complete(TransportRequest request, Buffer response, ExchangeState state,
                                 Promise<String> promise) {
        if (state.writeFailed)
            return;

        if (promise.tryComplete(response.toString(request.encoding())))
            Logger.trace("[{}] Response complete, {} bytes", request, response.length());
    }

    private void failure(TransportRequest request, TransportException e, Promise<String> promise) {
        final Runnable complete = () -> {
            if (request.rethrow()) {
                promise.tryFail(e);
            } else {
                Logger.debug("[{}] {}", request, e.getMessage());
                promise.tryComplete("");
            }
        };

        if (_cooldownMs > 0) {
            _vertx.setTimer(_cooldownMs, id -> complete.run());
        } else {
            complete.run();
        }
    }

    private static final class ExchangeState {
        boolean paused;
        boolean writeFailed;
    }
}

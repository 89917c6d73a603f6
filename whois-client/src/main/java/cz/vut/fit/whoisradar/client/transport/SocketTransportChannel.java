package cz.vut.fit.whoisradar.client.transport;

import cz.vut.fit.whoisradar.Common;
import cz.vut.fit.whoisradar.client.CancellationSignal;
import io.vertx.core.Future;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;

/**
 * A {@link TransportChannel} that uses a plain blocking {@link Socket}. The calling thread is blocked for
 * the whole exchange, including the cooldown after a failed connection and the pacing between chunks.
 * An exchange in progress cannot be cancelled; only the timeouts bound it.
 *
 * @author WhoisRadar contributors
 */
public class SocketTransportChannel implements TransportChannel {
    public static final String COMPONENT_NAME = "socket";
    private static final Logger Logger = Common.getComponentLogger(SocketTransportChannel.class);

    private final long _cooldownMs;
    private final long _pacingMs;

    public SocketTransportChannel(long cooldownMs, long pacingMs) {
        if (cooldownMs < 0 || pacingMs < 0)
            throw new IllegalArgumentException("Negative delay");

        _cooldownMs = cooldownMs;
        _pacingMs = pacingMs;
    }

    public SocketTransportChannel() {
        this(DEFAULT_COOLDOWN_MS, DEFAULT_PACING_MS);
    }

    /**
     * Creates the socket used for a single exchange. Overridable so that tests can supply their own.
     */
    protected Socket buildSocket() throws IOException {
        return new Socket();
    }

    @Override
    public @NotNull Future<String> send(@NotNull TransportRequest request, @NotNull CancellationSignal signal) {
        if (signal.isCancelled())
            return Future.failedFuture(CancellationSignal.cancelled("Query to " + request));

        try {
            return Future.succeededFuture(exchange(request));
        } catch (TransportException e) {
            return Future.failedFuture(e);
        }
    }

    /**
     * Performs the exchange on the calling thread.
     *
     * @param request The exchange to perform.
     * @return The decoded response; empty if the server could not be reached and rethrowing is disabled.
     * @throws TransportException if the server could not be reached and {@link TransportRequest#rethrow()} is set.
     */
    public String exchange(@NotNull TransportRequest request) throws TransportException {
        Socket socket = null;
        try {
            Logger.trace("[{}] Connecting", request);
            socket = this.buildSocket();
            socket.connect(new InetSocketAddress(request.host(), request.port()), request.timeoutMillis());
            socket.setSoTimeout(request.timeoutMillis());

            final var out = socket.getOutputStream();
            out.write((request.queryLine() + CRLF).getBytes(request.encoding()));
            out.flush();
            Logger.trace("[{}] Query sent: {}", request, request.queryLine());
        } catch (SocketTimeoutException e) {
            close(socket, request);
            return failure(request, new TransportException(request.host(), request.port(),
                    "Connection timed out (%d s)".formatted(request.timeoutSeconds())));
        } catch (IOException | IllegalArgumentException e) {
            // Unresolvable hosts end up here, too
            close(socket, request);
            return failure(request, new TransportException(request.host(), request.port(), e));
        }

        try {
            return readResponse(socket, request);
        } finally {
            close(socket, request);
        }
    }

    private String readResponse(Socket socket, TransportRequest request) {
        final var buffer = new byte[BUFFER_SIZE];
        final var response = new ByteArrayOutputStream();

        try {
            final var in = socket.getInputStream();
            int read;
            do {
                read = in.read(buffer);
                if (read > 0) {
                    response.write(buffer, 0, read);
                    Logger.trace("[{}] Received {} bytes", request, read);
                    pause(_pacingMs);
                }
                // An empty read only ends the response once something has been received
            } while (read > 0 || (read == 0 && response.size() == 0));
        } catch (IOException e) {
            // Partial data beats none
            Logger.debug("[{}] Reading stopped after {} bytes: {}", request, response.size(), e.getMessage());
        }

        return response.toString(request.encoding());
    }

    private String failure(TransportRequest request, TransportException e) throws TransportException {
        pause(_cooldownMs);

        if (request.rethrow())
            throw e;

        Logger.debug("[{}] {}", request, e.getMessage());
        return "";
    }

    private void pause(long millis) {
        if (millis <= 0)
            return;

        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Logger.debug("Interrupted while waiting");
            Thread.currentThread().interrupt();
        }
    }

    private static void close(@Nullable Socket socket, TransportRequest request) {
        if (socket == null)
            return;

        try {
            socket.close();
        } catch (IOException e) {
            Logger.debug("[{}] Cannot close socket: {}", request, e.getMessage());
        }
    }
}

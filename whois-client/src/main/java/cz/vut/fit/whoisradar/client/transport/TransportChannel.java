package cz.vut.fit.whoisradar.client.transport;

import cz.vut.fit.whoisradar.client.CancellationSignal;
import io.vertx.core.Future;
import org.jetbrains.annotations.NotNull;

/**
 * Performs a single WHOIS exchange over a bare TCP connection: connect, send the query line terminated
 * by CRLF, read until the server closes the connection and decode the bytes.
 * <p>
 * Implementations differ in how they wait. {@link SocketTransportChannel} blocks the calling thread and
 * returns an already completed future; {@link VertxTransportChannel} never blocks and completes the
 * future on a Vert.x event loop.
 *
 * @author WhoisRadar contributors
 */
public interface TransportChannel {
    /**
     * The pause after a failed connection attempt, unless configured otherwise.
     */
    long DEFAULT_COOLDOWN_MS = 200;

    /**
     * The pause after every received chunk, unless configured otherwise.
     */
    long DEFAULT_PACING_MS = 100;

    /**
     * The size of the receive buffer.
     */
    int BUFFER_SIZE = 8192;

    /**
     * The line terminator appended to every query.
     */
    String CRLF = "\r\n";

    /**
     * Sends the query and reads the whole response.
     *
     * @param request The exchange to perform.
     * @param signal  A signal that aborts the exchange when fired. Implementations that cannot abort an
     *                operation in progress only check it before they start.
     * @return A future of the decoded response. It fails with a {@link TransportException} when the server
     * cannot be reached and {@link TransportRequest#rethrow()} is set, and with a
     * {@link java.util.concurrent.CancellationException} when the signal fires. A failure while reading
     * the response is not reported; the data received until then is returned.
     */
    @NotNull
    Future<String> send(@NotNull TransportRequest request, @NotNull CancellationSignal signal);
}

package cz.vut.fit.whoisradar.client.transport;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * A single WHOIS exchange to perform: one query line sent to one server.
 *
 * @param host           The WHOIS server host name or address.
 * @param port           The TCP port of the server.
 * @param queryLine      The query line, without the terminating CRLF.
 * @param encoding       The charset used to encode the query and decode the response.
 * @param timeoutSeconds The connect timeout and the timeout of every read/write operation.
 * @param rethrow        If true, a failure to connect or to send the query is reported as a
 *                       {@link TransportException}; otherwise, it results in an empty response.
 */
public record TransportRequest(@NotNull String host,
                               int port,
                               @NotNull String queryLine,
                               @NotNull Charset encoding,
                               int timeoutSeconds,
                               boolean rethrow) {
    public TransportRequest {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(queryLine, "queryLine");
        Objects.requireNonNull(encoding, "encoding");
        if (port < 1 || port > 65535)
            throw new IllegalArgumentException("Port out of range: " + port);
        if (timeoutSeconds < 0)
            throw new IllegalArgumentException("Negative timeout: " + timeoutSeconds);
    }

    /**
     * Returns the timeout in milliseconds, as used by the socket APIs.
     */
    public int timeoutMillis() {
        return (int) Math.min((long) timeoutSeconds * 1000L, Integer.MAX_VALUE);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}

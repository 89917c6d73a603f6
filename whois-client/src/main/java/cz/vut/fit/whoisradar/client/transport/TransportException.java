package cz.vut.fit.whoisradar.client.transport;

import java.io.IOException;

/**
 * Signals that a WHOIS server could not be reached or that the query could not be sent to it.
 */
public class TransportException extends IOException {
    private final String _host;
    private final int _port;

    public TransportException(String host, int port, Throwable cause) {
        super("Cannot query %s:%d: %s".formatted(host, port, cause.getMessage()), cause);
        _host = host;
        _port = port;
    }

    public TransportException(String host, int port, String message) {
        super("Cannot query %s:%d: %s".formatted(host, port, message));
        _host = host;
        _port = port;
    }

    public String getHost() {
        return _host;
    }

    public int getPort() {
        return _port;
    }
}

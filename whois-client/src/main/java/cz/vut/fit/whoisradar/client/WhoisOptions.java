package cz.vut.fit.whoisradar.client;

import cz.vut.fit.whoisradar.WhoisConfig;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Properties;

/**
 * The parameters of a WHOIS lookup.
 *
 * @param server                 The server that receives the first query.
 * @param port                   The TCP port of the first server. Referred servers use the port named in the
 *                               referral, or 43.
 * @param encoding               The charset of the queries and the responses.
 * @param timeoutSeconds         The connect timeout and the timeout of every read/write operation. Zero means
 *                               no timeout.
 * @param maxRetries             The maximum number of attempts to get a non-blank response from one server.
 * @param rethrowTransportErrors If true, a transport error of the last attempt is propagated to the caller;
 *                               otherwise, the server's response is considered empty.
 *
 * @author WhoisRadar contributors
 */
public record WhoisOptions(@NotNull String server,
                           int port,
                           @NotNull Charset encoding,
                           int timeoutSeconds,
                           int maxRetries,
                           boolean rethrowTransportErrors) {

    public static final String DEFAULT_SERVER = WhoisConfig.SERVER_DEFAULT;
    public static final int DEFAULT_PORT = 43;
    public static final Charset DEFAULT_ENCODING = StandardCharsets.US_ASCII;
    public static final int DEFAULT_TIMEOUT_SECONDS = 600;
    public static final int DEFAULT_MAX_RETRIES = 10;

    private static final WhoisOptions DEFAULTS = new WhoisOptions(DEFAULT_SERVER, DEFAULT_PORT, DEFAULT_ENCODING,
            DEFAULT_TIMEOUT_SECONDS, DEFAULT_MAX_RETRIES, false);

    public WhoisOptions {
        // A missing server means the bootstrap server
        if (server == null || server.isBlank())
            server = DEFAULT_SERVER;
        else
            server = server.trim();

        encoding = Objects.requireNonNullElse(encoding, DEFAULT_ENCODING);

        if (port < 1 || port > 65535)
            throw new IllegalArgumentException("Port out of range: " + port);
        if (timeoutSeconds < 0)
            throw new IllegalArgumentException("Negative timeout: " + timeoutSeconds);
    }

    public static WhoisOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Builds the options from {@link WhoisConfig} properties. Missing keys take the default values.
     *
     * @param properties The properties.
     * @return The options.
     * @throws IllegalArgumentException if a value is invalid.
     */
    public static WhoisOptions fromProperties(@NotNull Properties properties) {
        try {
            return new WhoisOptions(
                    properties.getProperty(WhoisConfig.SERVER_CONFIG, WhoisConfig.SERVER_DEFAULT),
                    Integer.parseInt(properties.getProperty(WhoisConfig.PORT_CONFIG, WhoisConfig.PORT_DEFAULT).trim()),
                    Charset.forName(properties.getProperty(WhoisConfig.ENCODING_CONFIG,
                            WhoisConfig.ENCODING_DEFAULT).trim()),
                    Integer.parseInt(properties.getProperty(WhoisConfig.TIMEOUT_S_CONFIG,
                            WhoisConfig.TIMEOUT_S_DEFAULT).trim()),
                    Integer.parseInt(properties.getProperty(WhoisConfig.RETRIES_CONFIG,
                            WhoisConfig.RETRIES_DEFAULT).trim()),
                    Boolean.parseBoolean(properties.getProperty(WhoisConfig.RETHROW_CONFIG,
                            WhoisConfig.RETHROW_DEFAULT).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in the WHOIS configuration: " + e.getMessage(), e);
        }
    }

    public WhoisOptions withServer(String server) {
        return new WhoisOptions(server, port, encoding, timeoutSeconds, maxRetries, rethrowTransportErrors);
    }

    public WhoisOptions withPort(int port) {
        return new WhoisOptions(server, port, encoding, timeoutSeconds, maxRetries, rethrowTransportErrors);
    }

    public WhoisOptions withEncoding(Charset encoding) {
        return new WhoisOptions(server, port, encoding, timeoutSeconds, maxRetries, rethrowTransportErrors);
    }

    public WhoisOptions withTimeoutSeconds(int timeoutSeconds) {
        return new WhoisOptions(server, port, encoding, timeoutSeconds, maxRetries, rethrowTransportErrors);
    }

    public WhoisOptions withMaxRetries(int maxRetries) {
        return new WhoisOptions(server, port, encoding, timeoutSeconds, maxRetries, rethrowTransportErrors);
    }

    public WhoisOptions withRethrowTransportErrors(boolean rethrowTransportErrors) {
        return new WhoisOptions(server, port, encoding, timeoutSeconds, maxRetries, rethrowTransportErrors);
    }
}

package cz.vut.fit.whoisradar;

/**
 * The configuration keys, descriptions and default values for the WHOIS client.
 *
 * @author WhoisRadar contributors
 */
@SuppressWarnings("ALL")
public class WhoisConfig {
    /* --- Lookup --- */
    public static final String SERVER_CONFIG = "whois.server";
    public static final String SERVER_DOC = "The bootstrap WHOIS server where every lookup starts.";
    public static final String SERVER_DEFAULT = "whois.iana.org";

    public static final String PORT_CONFIG = "whois.port";
    public static final String PORT_DOC = "The TCP port of the bootstrap WHOIS server.";
    public static final String PORT_DEFAULT = "43";

    public static final String ENCODING_CONFIG = "whois.encoding";
    public static final String ENCODING_DOC = "The charset used to encode the query and to decode the responses.";
    public static final String ENCODING_DEFAULT = "US-ASCII";

    public static final String TIMEOUT_S_CONFIG = "whois.timeout";
    public static final String TIMEOUT_S_DOC =
            "The connect timeout and the timeout of every single read or write operation (seconds).";
    public static final String TIMEOUT_S_DEFAULT = "600";

    public static final String RETRIES_CONFIG = "whois.retries";
    public static final String RETRIES_DOC = "The maximum number of attempts to get a response from a single server.";
    public static final String RETRIES_DEFAULT = "10";

    public static final String RETHROW_CONFIG = "whois.rethrow";
    public static final String RETHROW_DOC = "If true, a transport error of the last attempt is propagated to the caller " +
            "instead of being replaced with an empty response.";
    public static final String RETHROW_DEFAULT = "false";

    /* --- Transport --- */
    public static final String COOLDOWN_MS_CONFIG = "whois.transport.cooldown";
    public static final String COOLDOWN_MS_DOC = "The pause after a failed connection attempt (milliseconds).";
    public static final String COOLDOWN_MS_DEFAULT = "200";

    public static final String PACING_MS_CONFIG = "whois.transport.pacing";
    public static final String PACING_MS_DOC = "The pause after every received chunk of a response (milliseconds).";
    public static final String PACING_MS_DEFAULT = "100";
}

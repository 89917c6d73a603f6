package cz.vut.fit.whoisradar.client;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Builds the query line sent to a WHOIS server. Most servers take the bare query; a few expect a command.
 */
public final class QueryStatementBuilder {
    private QueryStatementBuilder() {
    }

    /**
     * Returns the query line for the given server.
     *
     * @param server The server that will receive the query.
     * @param query  The domain name or IP address to look up.
     * @return The line to send, without the line terminator.
     */
    @NotNull
    public static String build(@NotNull String server, @NotNull String query) {
        return switch (server.toLowerCase(Locale.ROOT)) {
            case "whois.internic.net", "whois.verisign-grs.com" -> "domain " + query;
            // Otherwise ARIN replies "Query terms are ambiguous" for some addresses
            case "whois.arin.net" -> "n + " + query;
            default -> query;
        };
    }
}

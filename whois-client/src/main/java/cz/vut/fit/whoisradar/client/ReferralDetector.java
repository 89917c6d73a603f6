package cz.vut.fit.whoisradar.client;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the referral to a more authoritative server in a WHOIS response.
 * <p>
 * The patterns are tried in a fixed order, each over the whole response; the first pattern that matches
 * decides, using its first match that has a host. The order matters for real-world responses and must not
 * be changed. The value of a label must be on the same line as the label.
 * <ol>
 *     <li>{@code ReferralServer: whois://host[:port]} (ARIN)</li>
 *     <li>{@code [Registrar ]Whois Server: host[:port]} (gTLD registries and registrars)</li>
 *     <li>{@code refer: host[:port]} (IANA)</li>
 *     <li>{@code whois: host[:port]} (IANA)</li>
 *     <li>{@code remarks: ... whois.example.jp ...} (RIPE, APNIC)</li>
 * </ol>
 *
 * @author WhoisRadar contributors
 */
public final class ReferralDetector {
    public static final int DEFAULT_PORT = 43;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;
    private static final String HOST_AND_PORT = "(?<host>[^:\\r\\n]+)(:(?<port>\\d+))?";

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("^ReferralServer:\\W+whois://" + HOST_AND_PORT, FLAGS),
            Pattern.compile("^\\s*(Registrar\\s+)?Whois Server:[ \\t]*" + HOST_AND_PORT, FLAGS),
            Pattern.compile("^\\s*refer:[ \\t]*" + HOST_AND_PORT, FLAGS),
            Pattern.compile("^\\s*whois:[ \\t]*" + HOST_AND_PORT, FLAGS),
            Pattern.compile("^remarks:\\W+.*(?<host>whois\\.[0-9a-z\\-.]+\\.[a-z]{2,})(:(?<port>\\d+))?", FLAGS)
    );

    /**
     * A server that the response refers to.
     *
     * @param host The host name of the server.
     * @param port The TCP port of the server.
     */
    public record Referral(@NotNull String host, int port) {
    }

    private ReferralDetector() {
    }

    /**
     * Looks for a referral in a WHOIS response.
     *
     * @param response      The response text.
     * @param currentServer The server that produced the response.
     * @return The referral, or an empty optional if there is none or if it refers to {@code currentServer}.
     */
    public static Optional<Referral> detect(@Nullable String response, @NotNull String currentServer) {
        if (response == null || response.isEmpty())
            return Optional.empty();

        for (var pattern : PATTERNS) {
            final Matcher matcher = pattern.matcher(response);
            while (matcher.find()) {
                final var host = matcher.group("host").trim();
                // A label without a value, such as IANA's "whois:" for TLDs without a WHOIS service
                if (host.isEmpty())
                    continue;

                if (host.equalsIgnoreCase(currentServer.trim()))
                    return Optional.empty();

                return Optional.of(new Referral(host, parsePort(matcher.group("port"))));
            }
        }

        return Optional.empty();
    }

    private static int parsePort(@Nullable String port) {
        if (port == null)
            return DEFAULT_PORT;

        try {
            final var value = Integer.parseInt(port);
            return value >= 1 && value <= 65535 ? value : DEFAULT_PORT;
        } catch (NumberFormatException e) {
            // Too many digits
            return DEFAULT_PORT;
        }
    }
}

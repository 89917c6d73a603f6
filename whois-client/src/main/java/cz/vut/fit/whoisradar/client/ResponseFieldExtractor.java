package cz.vut.fit.whoisradar.client;

import cz.vut.fit.whoisradar.models.AddressRange;
import cz.vut.fit.whoisradar.models.LookupResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the organization name and the network address range from the free-form text of a WHOIS response.
 * <p>
 * Registries label these fields differently (and JPNIC in Japanese), so every field has an ordered list of
 * patterns. The first pattern that yields a valid value wins; a field that no pattern matches stays empty.
 * The order of the patterns is significant and must be kept.
 *
 * @author WhoisRadar contributors
 */
public final class ResponseFieldExtractor {
    public static final String ARIN_SERVER = "whois.arin.net";

    // \W must not consume Japanese letters
    private static final int FLAGS = Pattern.MULTILINE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<Pattern> ORGANIZATION_PATTERNS = List.of(
            // JPNIC: "f. [組織名]   ..."
            Pattern.compile("^(f\\.)?\\W*\\[組織名\\]\\W+(?<value>[^\\r\\n]+)", FLAGS),
            Pattern.compile("^\\s*(OrgName|descr|Registrant Organization|owner):\\W+(?<value>[^\\r\\n]+)", FLAGS),
            Pattern.compile("^\\s*(Organization|org-name):\\W+(?<value>[^\\r\\n]+)", FLAGS)
    );

    private static final List<Pattern> ADDRESS_RANGE_PATTERNS = List.of(
            // JPNIC: "a. [IPネットワークアドレス]   ..."
            Pattern.compile("^(a\\.)?\\W*\\[IPネットワークアドレス\\]\\W+(?<value>[^\\r\\n]+)", FLAGS),
            Pattern.compile("^(NetRange|CIDR|inet6?num):\\W+(?<value>[^\\r\\n]+)", FLAGS)
    );

    // ARIN closes some responses with summary lines such as "Example Org NET-192-0-2-0-1 192.0.2.0 - 192.0.2.255"
    private static final Pattern ARIN_SUMMARY_PATTERN = Pattern.compile(
            "^(?<org>.*) (?<range>\\d+\\.\\d+\\.\\d+\\.\\d+ - \\d+\\.\\d+\\.\\d+\\.\\d+)", FLAGS);

    private static final Set<String> ARIN_FIELD_LABELS = Set.of("NetRange:", "CIDR:", "inetnum:");

    private ResponseFieldExtractor() {
    }

    /**
     * Builds the lookup result for the final response of a lookup.
     *
     * @param servers  The servers queried during the lookup, in order.
     * @param response The response of the last server.
     * @return The result with the extracted fields.
     */
    @NotNull
    public static LookupResult toResult(@NotNull List<String> servers, @Nullable String response) {
        final var raw = response == null ? "" : response;

        var organizationName = extractOrganizationName(raw).orElse("");
        var addressRange = extractAddressRange(raw).orElse(null);

        if (!servers.isEmpty() && ARIN_SERVER.equalsIgnoreCase(servers.get(servers.size() - 1))) {
            // The summary comes after the detailed block and supersedes it
            final var summary = extractArinSummary(raw);
            if (summary.isPresent()) {
                organizationName = summary.get().organizationName();
                addressRange = summary.get().addressRange();
            }
        }

        return new LookupResult(servers, raw, organizationName, addressRange);
    }

    /**
     * Finds the organization name in a response.
     */
    public static Optional<String> extractOrganizationName(@NotNull String response) {
        for (var pattern : ORGANIZATION_PATTERNS) {
            final Matcher matcher = pattern.matcher(response);
            if (matcher.find())
                return Optional.of(matcher.group("value"));
        }
        return Optional.empty();
    }

    /**
     * Finds the network address range in a response. A pattern whose value is not a valid range is skipped.
     */
    public static Optional<AddressRange> extractAddressRange(@NotNull String response) {
        for (var pattern : ADDRESS_RANGE_PATTERNS) {
            final Matcher matcher = pattern.matcher(response);
            if (!matcher.find())
                continue;

            final var range = parseRange(matcher.group("value"));
            if (range != null)
                return Optional.of(range);
        }
        return Optional.empty();
    }

    /**
     * An organization and its network, taken from an ARIN summary line.
     */
    public record ArinSummary(@NotNull String organizationName, @NotNull AddressRange addressRange) {
    }

    /**
     * Finds the last ARIN summary line in a response. Lines that are just a repeated
     * {@code NetRange:}, {@code CIDR:} or {@code inetnum:} field are not summaries.
     */
    public static Optional<ArinSummary> extractArinSummary(@NotNull String response) {
        final Matcher matcher = ARIN_SUMMARY_PATTERN.matcher(response);
        String organization = null;
        String range = null;
        while (matcher.find()) {
            organization = matcher.group("org");
            range = matcher.group("range");
        }

        if (organization == null)
            return Optional.empty();

        organization = organization.trim();
        if (ARIN_FIELD_LABELS.contains(organization))
            return Optional.empty();

        final var addressRange = parseRange(range);
        if (addressRange == null)
            return Optional.empty();

        return Optional.of(new ArinSummary(organization, addressRange));
    }

    @Nullable
    private static AddressRange parseRange(String value) {
        try {
            return AddressRange.parse(value);
        } catch (IllegalArgumentException e) {
            // Not an error, the field just stays empty
            return null;
        }
    }
}

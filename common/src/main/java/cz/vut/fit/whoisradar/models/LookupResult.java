package cz.vut.fit.whoisradar.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A record representing the outcome of a WHOIS lookup.
 *
 * @param respondedServers The WHOIS servers that were queried, in order. The first one is the bootstrap server,
 *                         the last one is the server that produced {@code raw}.
 * @param raw              The raw response of the last server (empty if the server did not respond).
 * @param organizationName The organization name found in the response, or an empty string.
 * @param addressRange     The network address range found in the response, or null.
 *
 * @author WhoisRadar contributors
 */
public record LookupResult(@JsonProperty("respondedServers") @NotNull List<String> respondedServers,
                           @JsonProperty("raw") @NotNull String raw,
                           @JsonProperty("organizationName") @NotNull String organizationName,
                           @JsonProperty("addressRange") @Nullable AddressRange addressRange) {

    private static final LookupResult EMPTY = new LookupResult(List.of(), "", "", null);

    public LookupResult {
        respondedServers = List.copyOf(Objects.requireNonNull(respondedServers, "respondedServers"));
        raw = Objects.requireNonNullElse(raw, "");
        organizationName = Objects.requireNonNullElse(organizationName, "");
    }

    /**
     * Returns a result with no servers, no response and no extracted data.
     */
    public static LookupResult empty() {
        return EMPTY;
    }

    /**
     * Returns the server that produced the raw response, if any.
     */
    public Optional<String> lastServer() {
        return respondedServers.isEmpty()
                ? Optional.empty()
                : Optional.of(respondedServers.get(respondedServers.size() - 1));
    }

    public Optional<AddressRange> optionalAddressRange() {
        return Optional.ofNullable(addressRange);
    }
}

package cz.vut.fit.whoisradar.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Objects;

/**
 * An inclusive range of IP addresses of a single family, such as a network block allocated by a registry.
 * <p>
 * The range can be parsed from the notations found in WHOIS responses:
 * <ul>
 *     <li>CIDR: {@code 192.0.2.0/24}, {@code 2001:db8::/32}, abbreviated IPv4 CIDR {@code 192.168/16}</li>
 *     <li>CIDR with a dotted mask: {@code 192.168.0.0/255.255.255.0}</li>
 *     <li>Dashed range: {@code 10.0.0.0 - 10.0.0.255} (the spaces are optional)</li>
 *     <li>A single address</li>
 * </ul>
 * Address literals are parsed with Guava's {@link InetAddresses}, so no name resolution ever takes place.
 *
 * @param begin The first address of the range.
 * @param end   The last address of the range.
 *
 * @author WhoisRadar contributors
 */
public record AddressRange(@NotNull InetAddress begin, @NotNull InetAddress end) {

    public AddressRange {
        Objects.requireNonNull(begin, "begin");
        Objects.requireNonNull(end, "end");
        if (begin.getAddress().length != end.getAddress().length) {
            throw new IllegalArgumentException("Mixed address families: " + begin + ", " + end);
        }
        if (toNumber(begin).compareTo(toNumber(end)) > 0) {
            throw new IllegalArgumentException("Range begins after its end: " + begin + ", " + end);
        }
    }

    /**
     * Parses an address range.
     *
     * @param text The range in one of the supported notations.
     * @return The parsed range.
     * @throws IllegalArgumentException if the text is not a valid range.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AddressRange parse(@NotNull String text) {
        final var value = Objects.requireNonNull(text, "text").trim();
        if (value.isEmpty())
            throw new IllegalArgumentException("Empty address range");

        final var dash = value.indexOf('-');
        if (dash >= 0) {
            return new AddressRange(parseAddress(value.substring(0, dash)),
                    parseAddress(value.substring(dash + 1)));
        }

        final var slash = value.indexOf('/');
        if (slash >= 0) {
            return parseCidr(value.substring(0, slash).trim(), value.substring(slash + 1).trim());
        }

        final var address = parseAddress(value);
        return new AddressRange(address, address);
    }

    /**
     * Returns true when the address belongs to this range.
     */
    public boolean contains(@NotNull InetAddress address) {
        if (address.getAddress().length != begin.getAddress().length)
            return false;

        final var number = toNumber(address);
        return number.compareTo(toNumber(begin)) >= 0 && number.compareTo(toNumber(end)) <= 0;
    }

    /**
     * Returns the prefix length when the range is exactly one CIDR block, or -1 otherwise.
     */
    public int prefixLength() {
        final int bits = begin.getAddress().length * 8;
        final var size = toNumber(end).subtract(toNumber(begin)).add(BigInteger.ONE);
        if (size.bitCount() != 1)
            return -1;

        final int hostBits = size.getLowestSetBit();
        // The block must be aligned to its size
        if (toNumber(begin).getLowestSetBit() < hostBits && toNumber(begin).signum() != 0)
            return -1;

        return bits - hostBits;
    }

    /**
     * Formats the range: a single address, a CIDR block if the range is one, or {@code begin - end}.
     */
    @JsonValue
    @Override
    public String toString() {
        if (begin.equals(end))
            return InetAddresses.toAddrString(begin);

        final int prefix = prefixLength();
        if (prefix >= 0)
            return InetAddresses.toAddrString(begin) + "/" + prefix;

        return InetAddresses.toAddrString(begin) + " - " + InetAddresses.toAddrString(end);
    }

    private static AddressRange parseCidr(String addressPart, String prefixPart) {
        final var address = parseAddress(padAbbreviatedIPv4(addressPart));
        final int bits = address.getAddress().length * 8;

        final int prefix;
        if (prefixPart.indexOf('.') >= 0) {
            prefix = maskToPrefix(parseAddress(prefixPart));
        } else {
            try {
                prefix = Integer.parseInt(prefixPart);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid CIDR prefix: " + prefixPart, e);
            }
        }

        if (prefix < 0 || prefix > bits)
            throw new IllegalArgumentException("CIDR prefix out of range: " + prefix);

        final var hostMask = BigInteger.ONE.shiftLeft(bits - prefix).subtract(BigInteger.ONE);
        final var networkMask = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE).xor(hostMask);
        final var network = toNumber(address).and(networkMask);

        return new AddressRange(toAddress(network, bits), toAddress(network.or(hostMask), bits));
    }

    private static int maskToPrefix(InetAddress mask) {
        if (!(mask instanceof Inet4Address))
            throw new IllegalArgumentException("Invalid network mask: " + mask);

        final var number = toNumber(mask);
        final int prefix = number.bitCount();
        // A valid mask is a contiguous run of ones
        final var expected = BigInteger.ONE.shiftLeft(prefix).subtract(BigInteger.ONE).shiftLeft(32 - prefix);
        if (!number.equals(expected))
            throw new IllegalArgumentException("Non-contiguous network mask: " + InetAddresses.toAddrString(mask));

        return prefix;
    }

    // APNIC and others publish blocks such as "192.168/16"
    private static String padAbbreviatedIPv4(String address) {
        if (address.indexOf(':') >= 0 || address.isEmpty())
            return address;

        var padded = address;
        long dots = address.chars().filter(c -> c == '.').count();
        while (dots++ < 3) {
            padded += ".0";
        }
        return padded;
    }

    private static InetAddress parseAddress(String text) {
        return InetAddresses.forString(text.trim());
    }

    private static BigInteger toNumber(InetAddress address) {
        return new BigInteger(1, address.getAddress());
    }

    private static InetAddress toAddress(BigInteger number, int bits) {
        final var raw = number.toByteArray();
        final var bytes = new byte[bits / 8];
        // toByteArray() may add a sign byte or omit leading zero bytes
        final int copy = Math.min(raw.length, bytes.length);
        System.arraycopy(raw, raw.length - copy, bytes, bytes.length - copy, copy);
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            // Cannot happen for 4 or 16 byte arrays
            throw new IllegalStateException("Invalid address length: " + Arrays.toString(bytes), e);
        }
    }
}

package com.fintech.webhook.security;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

/**
 * One IPv4 or IPv6 prefix. A bare address is a single-host prefix (/32 or /128).
 * Host bits beyond the prefix length are masked off.
 */
public final class IpNetwork {

    private final byte[] network;
    private final int prefixLength;

    private IpNetwork(byte[] network, int prefixLength) {
        this.network = network;
        this.prefixLength = prefixLength;
    }

    /**
     * @throws IllegalArgumentException when the entry is not a valid address or CIDR prefix
     */
    public static IpNetwork parse(String cidr) {
        if (cidr == null || cidr.isBlank()) {
            throw new IllegalArgumentException("Empty network entry");
        }
        String value = cidr.trim();
        String addressPart = value;
        Integer prefix = null;

        int slash = value.indexOf('/');
        if (slash >= 0) {
            addressPart = value.substring(0, slash);
            try {
                prefix = Integer.parseInt(value.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid prefix length in " + value, e);
            }
        }

        byte[] address = parseAddress(addressPart);
        if (address == null) {
            throw new IllegalArgumentException("Invalid address in " + value);
        }
        int maxBits = address.length * 8;
        int bits = prefix == null ? maxBits : prefix;
        if (bits < 0 || bits > maxBits) {
            throw new IllegalArgumentException("Prefix length out of range in " + value);
        }
        return new IpNetwork(mask(address, bits), bits);
    }

    public boolean contains(byte[] address) {
        if (address == null || address.length != network.length) {
            return false;
        }
        return Arrays.equals(mask(address, prefixLength), network);
    }

    public boolean contains(String address) {
        return contains(parseAddress(address));
    }

    /**
     * Parses an address literal. Never performs a name lookup.
     *
     * @return the raw address bytes, or {@code null} when the text is not a literal
     */
    public static byte[] parseAddress(String text) {
        if (text == null) {
            return null;
        }
        String value = text.trim();
        if (value.startsWith("[") && value.endsWith("]")) {
            value = value.substring(1, value.length() - 1);
        }
        if (value.isEmpty()) {
            return null;
        }
        if (value.indexOf(':') >= 0) {
            return parseIpv6(value);
        }
        return parseIpv4(value);
    }

    private static byte[] parseIpv4(String value) {
        String[] octets = value.split("\\.", -1);
        if (octets.length != 4) {
            return null;
        }
        byte[] result = new byte[4];
        for (int i = 0; i < 4; i++) {
            String octet = octets[i];
            if (octet.isEmpty() || octet.length() > 3) {
                return null;
            }
            for (int c = 0; c < octet.length(); c++) {
                if (!Character.isDigit(octet.charAt(c))) {
                    return null;
                }
            }
            int number = Integer.parseInt(octet);
            if (number > 255) {
                return null;
            }
            result[i] = (byte) number;
        }
        return result;
    }

    private static byte[] parseIpv6(String value) {
        int zone = value.indexOf('%');
        String literal = zone >= 0 ? value.substring(0, zone) : value;
        if (literal.isEmpty()) {
            return null;
        }
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (!(Character.digit(c, 16) >= 0 || c == ':' || c == '.')) {
                return null;
            }
        }
        try {
            // Brackets force literal parsing: an invalid literal fails instead of falling back to DNS.
            // IPv4-mapped literals come back as 4-byte addresses.
            return InetAddress.getByName("[" + literal + "]").getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static byte[] mask(byte[] address, int bits) {
        byte[] masked = address.clone();
        for (int i = 0; i < masked.length; i++) {
            int remaining = bits - i * 8;
            if (remaining >= 8) {
                continue;
            }
            if (remaining <= 0) {
                masked[i] = 0;
            } else {
                masked[i] = (byte) (masked[i] & (0xFF << (8 - remaining)));
            }
        }
        return masked;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    @Override
    public String toString() {
        try {
            return InetAddress.getByAddress(network).getHostAddress() + "/" + prefixLength;
        } catch (UnknownHostException e) {
            return Arrays.toString(network) + "/" + prefixLength;
        }
    }
}

package com.netcracker.core.ddisync.model;

import com.netcracker.core.ddisync.exception.ValidationException;

/**
 * IPv4 network in canonical CIDR form: host bits cleared, prefix in [8,32],
 * neither reserved (240.0.0.0/4) nor multicast (224.0.0.0/4).
 */
public record CidrBlock(long networkAddress, int prefixLength) {
    public static final int MIN_PREFIX = 8;
    public static final int MAX_PREFIX = 32;

    private static final long MULTICAST_BASE = 0xE0000000L;
    private static final long RESERVED_BASE = 0xF0000000L;
    private static final long CLASS_MASK = 0xF0000000L;

    public static CidrBlock parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Invalid subnet '': value is empty");
        }
        String value = text.trim();
        int slash = value.indexOf('/');
        String addressPart = slash < 0 ? value : value.substring(0, slash);
        int prefix = slash < 0 ? MAX_PREFIX : parsePrefix(value, value.substring(slash + 1));

        if (prefix < MIN_PREFIX || prefix > MAX_PREFIX) {
            throw new ValidationException("Invalid subnet '%s': prefix must be between /%d and /%d"
                    .formatted(value, MIN_PREFIX, MAX_PREFIX));
        }

        long address = parseAddress(value, addressPart);
        long mask = mask(prefix);
        long network = address & mask;
        long broadcast = network | (~mask & 0xFFFFFFFFL);

        if (inBlock(network, RESERVED_BASE) && inBlock(broadcast, RESERVED_BASE)) {
            throw new ValidationException("Invalid subnet '%s': reserved networks are not allowed".formatted(value));
        }
        if (inBlock(network, MULTICAST_BASE) && inBlock(broadcast, MULTICAST_BASE)) {
            throw new ValidationException("Invalid subnet '%s': multicast networks are not allowed".formatted(value));
        }
        return new CidrBlock(network, prefix);
    }

    public static String canonicalize(String text) {
        return parse(text).toString();
    }

    @Override
    public String toString() {
        return "%d.%d.%d.%d/%d".formatted(
                (networkAddress >>> 24) & 0xFF,
                (networkAddress >>> 16) & 0xFF,
                (networkAddress >>> 8) & 0xFF,
                networkAddress & 0xFF,
                prefixLength);
    }

    private static int parsePrefix(String value, String prefixPart) {
        if (prefixPart.isEmpty() || prefixPart.length() > 2 || !prefixPart.chars().allMatch(Character::isDigit)) {
            throw new ValidationException("Invalid subnet '%s': malformed prefix length".formatted(value));
        }
        return Integer.parseInt(prefixPart);
    }

    private static long parseAddress(String value, String addressPart) {
        String[] octets = addressPart.split("\\.", -1);
        if (octets.length != 4) {
            throw new ValidationException("Invalid subnet '%s': expected x.x.x.x/y".formatted(value));
        }
        long address = 0;
        for (String octet : octets) {
            if (octet.isEmpty() || octet.length() > 3 || !octet.chars().allMatch(Character::isDigit)) {
                throw new ValidationException("Invalid subnet '%s': malformed octet '%s'".formatted(value, octet));
            }
            if (octet.length() > 1 && octet.charAt(0) == '0') {
                throw new ValidationException("Invalid subnet '%s': octet '%s' has leading zeros".formatted(value, octet));
            }
            int octetValue = Integer.parseInt(octet);
            if (octetValue > 255) {
                throw new ValidationException("Invalid subnet '%s': octet %d out of range".formatted(value, octetValue));
            }
            address = (address << 8) | octetValue;
        }
        return address;
    }

    private static long mask(int prefix) {
        return prefix == 0 ? 0 : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
    }

    private static boolean inBlock(long address, long base) {
        return (address & CLASS_MASK) == base;
    }
}

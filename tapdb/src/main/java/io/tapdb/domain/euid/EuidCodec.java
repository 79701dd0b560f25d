package io.tapdb.domain.euid;

import io.tapdb.domain.error.InvalidIdentifierInputException;

import java.util.Set;

/**
 * Checksummed, human-readable identifiers of the form {@code PREFIX-BODYCHECK}.
 *
 * <p>The body is a Crockford base-32 counter (no I, L, O or U, never a leading
 * zero). The check character is a Luhn mod-32 digit computed over
 * {@code PREFIX + BODY}. Sandbox identifiers are written {@code S:PREFIX-BODYCHECK}.
 *
 * <pre>
 * EuidCodec.format("TX", 1)          // "TX-1C"
 * EuidCodec.format("TX", 1, "X")     // "X:TX-1C"
 * EuidCodec.validate("TX-1C")        // true
 * EuidCodec.decode("TX-1C")          // Euid[sandbox=null, prefix=TX, counterValue=1]
 * </pre>
 */
public final class EuidCodec {

    public static final String ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";

    private static final int BASE = 32;
    // 32^12 = 2^60 keeps every decodable body inside a long
    private static final int MAX_BODY_LENGTH = 12;

    private EuidCodec() {}

    /** Encode a positive counter value as a base-32 body. */
    public static String encode(long counterValue) {
        if (counterValue <= 0) {
            throw new InvalidIdentifierInputException(String.valueOf(counterValue),
                "counter value must be positive");
        }
        StringBuilder sb = new StringBuilder();
        long n = counterValue;
        while (n > 0) {
            sb.append(ALPHABET.charAt((int) (n % BASE)));
            n /= BASE;
        }
        return sb.reverse().toString();
    }

    /** Decode a base-32 body back to its counter value. */
    public static long decodeBody(String body) {
        if (body == null || body.isEmpty()) {
            throw new InvalidIdentifierInputException(String.valueOf(body), "empty body");
        }
        if (body.charAt(0) == '0') {
            throw new InvalidIdentifierInputException(body, "body has a leading zero");
        }
        long value = 0;
        for (int i = 0; i < body.length(); i++) {
            int digit = ALPHABET.indexOf(body.charAt(i));
            if (digit < 0) {
                throw new InvalidIdentifierInputException(body,
                    "invalid character '" + body.charAt(i) + "' in body");
            }
            if (value > (Long.MAX_VALUE - digit) / BASE) {
                throw new InvalidIdentifierInputException(body, "body overflows a 64-bit counter");
            }
            value = value * BASE + digit;
        }
        return value;
    }

    /**
     * Luhn mod-32 check character over {@code prefix + body}.
     *
     * <p>Characters are scanned right to left; the rightmost one is doubled and
     * the factor then alternates. Each product contributes
     * {@code p / 32 + p % 32} to the sum.
     */
    public static char checksum(String prefix, String body) {
        String payload = String.valueOf(prefix) + body;
        int total = 0;
        int len = payload.length();
        for (int i = len - 1; i >= 0; i--) {
            int value = ALPHABET.indexOf(payload.charAt(i));
            if (value < 0) {
                throw new InvalidIdentifierInputException(payload,
                    "invalid character '" + payload.charAt(i) + "' for checksum");
            }
            int factor = (len - 1 - i) % 2 == 0 ? 2 : 1;
            int product = value * factor;
            total += product / BASE + product % BASE;
        }
        return ALPHABET.charAt((BASE - total % BASE) % BASE);
    }

    public static String format(String prefix, long counterValue) {
        return format(prefix, counterValue, null);
    }

    /** Build a full identifier; {@code sandbox} is a single letter or null. */
    public static String format(String prefix, long counterValue, String sandbox) {
        if (!isValidPrefix(prefix)) {
            throw new InvalidIdentifierInputException(String.valueOf(prefix),
                "prefix must be uppercase identifier letters");
        }
        if (sandbox != null && !isValidSandbox(sandbox)) {
            throw new InvalidIdentifierInputException(sandbox, "sandbox must be a single identifier letter");
        }
        String body = encode(counterValue);
        String euid = prefix + "-" + body + checksum(prefix, body);
        return sandbox == null ? euid : sandbox + ":" + euid;
    }

    public static boolean validate(String euid) {
        return validate(euid, EuidEnvironment.PRODUCTION, null);
    }

    /**
     * Structural and checksum validation.
     *
     * @param allowedSandboxPrefixes sandbox letters accepted in the sandbox
     *                               environment; null accepts any letter
     */
    public static boolean validate(String euid, EuidEnvironment environment, Set<String> allowedSandboxPrefixes) {
        Euid parsed = parse(euid);
        if (parsed == null) {
            return false;
        }
        if (environment == EuidEnvironment.PRODUCTION) {
            return !parsed.isSandbox();
        }
        if (!parsed.isSandbox()) {
            return false;
        }
        return allowedSandboxPrefixes == null || allowedSandboxPrefixes.contains(parsed.sandbox());
    }

    /** Decode an identifier in either environment; anything {@link #validate} rejects fails. */
    public static Euid decode(String euid) {
        Euid parsed = parse(euid);
        if (parsed == null) {
            throw new InvalidIdentifierInputException(String.valueOf(euid), "not a valid identifier");
        }
        return parsed;
    }

    /** Prefix of an identifier without validating it, or null when it has no prefix segment. */
    public static String prefixOf(String euid) {
        if (euid == null) {
            return null;
        }
        String rest = euid.trim();
        int colon = rest.indexOf(':');
        if (colon >= 0) {
            rest = rest.substring(colon + 1);
        }
        int dash = rest.indexOf('-');
        return dash > 0 ? rest.substring(0, dash).toUpperCase() : null;
    }

    public static boolean isValidPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            if (!Character.isLetter(c) || ALPHABET.indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isValidSandbox(String sandbox) {
        return sandbox.length() == 1 && isValidPrefix(sandbox);
    }

    private static Euid parse(String euid) {
        if (euid == null || euid.isEmpty()) {
            return null;
        }
        String rest = euid;
        String sandbox = null;
        String[] sandboxParts = euid.split(":", -1);
        if (sandboxParts.length > 2) {
            return null;
        }
        if (sandboxParts.length == 2) {
            sandbox = sandboxParts[0];
            rest = sandboxParts[1];
            if (!isValidSandbox(sandbox)) {
                return null;
            }
        }
        String[] segments = rest.split("-", -1);
        if (segments.length != 2) {
            return null;
        }
        String prefix = segments[0];
        String bodyAndCheck = segments[1];
        if (!isValidPrefix(prefix) || bodyAndCheck.length() < 2) {
            return null;
        }
        String body = bodyAndCheck.substring(0, bodyAndCheck.length() - 1);
        char check = bodyAndCheck.charAt(bodyAndCheck.length() - 1);
        if (body.charAt(0) == '0' || ALPHABET.indexOf(check) < 0) {
            return null;
        }
        for (int i = 0; i < body.length(); i++) {
            if (ALPHABET.indexOf(body.charAt(i)) < 0) {
                return null;
            }
        }
        if (body.length() > MAX_BODY_LENGTH || checksum(prefix, body) != check) {
            return null;
        }
        return new Euid(sandbox, prefix, decodeBody(body));
    }
}

package io.tapdb.domain.euid;

/**
 * Decoded form of an enterprise unique identifier.
 *
 * @param sandbox      sandbox letter, or null for production identifiers
 * @param prefix       uppercase letter prefix
 * @param counterValue positive counter value encoded in the body
 */
public record Euid(String sandbox, String prefix, long counterValue) {

    public boolean isSandbox() {
        return sandbox != null;
    }

    @Override
    public String toString() {
        return EuidCodec.format(prefix, counterValue, sandbox);
    }
}

package io.tapdb.domain.euid;

import io.tapdb.domain.error.IdentifierIntegrityException;
import io.tapdb.domain.error.InvalidIdentifierInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Maps identifier prefixes to the store counters that number them.
 *
 * <p>The core prefixes are always present. Instance prefixes are registered at
 * startup or while seeding templates; a prefix keeps its counter for the life
 * of the registry.
 */
public final class EuidRegistry {
    private static final Logger log = LoggerFactory.getLogger(EuidRegistry.class);

    public static final String TEMPLATE_PREFIX = "GT";
    public static final String LINEAGE_PREFIX = "GN";
    public static final String DEFAULT_INSTANCE_PREFIX = "GX";

    private static final Map<String, String> CORE_COUNTERS = Map.of(
        TEMPLATE_PREFIX, "generic_template_seq",
        LINEAGE_PREFIX, "generic_instance_lineage_seq",
        DEFAULT_INSTANCE_PREFIX, "gx_instance_seq"
    );

    private static final Pattern COUNTER_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    private final Map<String, String> counters = new ConcurrentHashMap<>(CORE_COUNTERS);

    /** Trim and uppercase a prefix, rejecting anything but identifier letters. */
    public static String normalizePrefix(String prefix) {
        String normalized = prefix == null ? "" : prefix.trim().toUpperCase();
        if (!EuidCodec.isValidPrefix(normalized)) {
            throw new InvalidIdentifierInputException(String.valueOf(prefix),
                "prefix must contain identifier letters only");
        }
        return normalized;
    }

    /** Counter name used for a prefix registered without an explicit counter. */
    public static String defaultCounterName(String prefix) {
        return normalizePrefix(prefix).toLowerCase() + "_instance_seq";
    }

    public static boolean isCorePrefix(String prefix) {
        return CORE_COUNTERS.containsKey(prefix == null ? null : prefix.trim().toUpperCase());
    }

    public String register(String prefix) {
        return register(prefix, defaultCounterName(prefix));
    }

    /**
     * Bind a prefix to a counter. Re-registering the same binding is a no-op.
     *
     * @return the counter name bound to the prefix
     */
    public synchronized String register(String prefix, String counterName) {
        String normalized = normalizePrefix(prefix);
        if (counterName == null || !COUNTER_NAME.matcher(counterName).matches()) {
            throw new IdentifierIntegrityException(normalized, "invalid counter name: " + counterName);
        }
        String core = CORE_COUNTERS.get(normalized);
        if (core != null && !core.equals(counterName)) {
            throw new IdentifierIntegrityException(normalized,
                "core prefix cannot be rebound from " + core + " to " + counterName);
        }
        String existing = counters.get(normalized);
        if (existing != null) {
            if (!existing.equals(counterName)) {
                throw new IdentifierIntegrityException(normalized,
                    "prefix already bound to " + existing + ", cannot rebind to " + counterName);
            }
            return existing;
        }
        counters.put(normalized, counterName);
        log.info("Registered EUID prefix {} -> {}", normalized, counterName);
        return counterName;
    }

    public Optional<String> counterFor(String prefix) {
        if (prefix == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(counters.get(prefix.trim().toUpperCase()));
    }

    public boolean isRegistered(String prefix) {
        return counterFor(prefix).isPresent();
    }

    /** Sorted copy of every binding. */
    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(counters));
    }
}

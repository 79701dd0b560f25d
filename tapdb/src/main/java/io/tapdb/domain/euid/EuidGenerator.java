package io.tapdb.domain.euid;

import io.tapdb.application.port.output.SequenceAllocator;
import io.tapdb.domain.error.IdentifierIntegrityException;
import io.tapdb.infrastructure.persistence.UnitOfWork;

/**
 * Allocates new identifiers from the prefix's store counter.
 */
public class EuidGenerator {

    private final EuidRegistry registry;
    private final SequenceAllocator sequenceAllocator;
    private final String sandbox;

    public EuidGenerator(EuidRegistry registry, SequenceAllocator sequenceAllocator) {
        this(registry, sequenceAllocator, null);
    }

    /**
     * @param sandbox sandbox letter stamped on every identifier, or null in production
     */
    public EuidGenerator(EuidRegistry registry, SequenceAllocator sequenceAllocator, String sandbox) {
        this.registry = registry;
        this.sequenceAllocator = sequenceAllocator;
        this.sandbox = sandbox;
    }

    public String generate(UnitOfWork uow, String prefix) {
        String normalized = EuidRegistry.normalizePrefix(prefix);
        String counter = registry.counterFor(normalized)
            .orElseThrow(() -> new IdentifierIntegrityException(normalized, "no counter registered for prefix"));
        long value = sequenceAllocator.next(uow, counter);
        return EuidCodec.format(normalized, value, sandbox);
    }

    public EuidRegistry registry() {
        return registry;
    }
}

package io.tapdb.application.port.output;

import io.tapdb.infrastructure.persistence.UnitOfWork;

/**
 * Store-side counters backing identifier generation.
 */
public interface SequenceAllocator {

    /** Atomically allocate the next value of a counter. */
    long next(UnitOfWork uow, String counterName);

    /** Check whether a counter exists. */
    boolean exists(UnitOfWork uow, String counterName);

    /** Create a counter if missing; an existing counter is left untouched. */
    void ensure(UnitOfWork uow, String counterName);
}

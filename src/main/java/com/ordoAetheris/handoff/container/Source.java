package com.ordoAetheris.handoff.container;

import java.util.Optional;

/**
 * Pull-based supplier of items for producers.
 *
 * Implementations shared by several producers must be safe for concurrent calls.
 * Once {@link #next()} has returned empty it returns empty forever and never throws for that reason.
 */
@FunctionalInterface
public interface Source<T> {

    /** @return the next item, or empty when the source is exhausted */
    Optional<T> next();
}

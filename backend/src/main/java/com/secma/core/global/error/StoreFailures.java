package com.secma.core.global.error;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Maps Spring's persistence exceptions onto the core taxonomy.
 */
public final class StoreFailures {

    private StoreFailures() {
    }

    public static SecmaException translate(DataAccessException ex) {
        if (ex instanceof DataIntegrityViolationException) {
            return new ConflictException("constraint-violation",
                    "The change conflicts with existing data.", ex);
        }
        return new StoreUnavailableException("The credential store is unavailable.", ex);
    }
}

package org.srm.alerting.config.index;

/**
 * Internal consistency failure in the category index bookkeeping.
 * Continuing would break the category order of the persisted document, so this is never caught.
 */
public class StructuralInvariantViolationException extends IllegalStateException {

    public StructuralInvariantViolationException(String message) {
        super(message);
    }
}

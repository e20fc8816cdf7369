package com.bmsedge.emergency.model.enums;

/**
 * Shape of a correlation rule's match condition.
 */
public enum CorrelationPredicate {
    /** Every listed sensor trigger must be present in the window. */
    SET_OF_TYPES,
    /** At least N distinct sensors of one type must have fired in the window. */
    COUNT_THRESHOLD
}

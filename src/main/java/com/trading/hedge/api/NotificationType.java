package com.trading.hedge.api;

/**
 * Kinds of notification emitted by the valuation engine while it evaluates a
 * contract.
 */
public enum NotificationType {
    /** One node value of the dependency graph has been computed. */
    UNIT_OF_WORK_COMPLETED,

    /** The final call result has been written to the result store. */
    RESULT_CREATED
}

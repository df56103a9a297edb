package com.bondplatform.common.exception;

/**
 * Coarse grouping of {@link ErrorCode}s. Service layers map categories, not
 * individual codes, onto transport status.
 */
public enum ErrorCategory {
    AUTHORIZATION,
    STATE_PRECONDITION,
    PARAMETER_VALIDATION,
    ORACLE_INTEGRITY,
    RELAY_AUTHENTICATION,
    SLIPPAGE,
    NOT_FOUND
}

package com.bondplatform.common.exception;

public enum ErrorCode {

    // authorization
    ONLY_DEBTOR(ErrorCategory.AUTHORIZATION, "Caller is not the debtor"),
    ONLY_DEBTOR_OR_CREDITOR(ErrorCategory.AUTHORIZATION, "Caller is neither debtor nor creditor"),
    ONLY_ADMIN(ErrorCategory.AUTHORIZATION, "Caller is not the admin"),
    NOT_BOND_OWNER(ErrorCategory.AUTHORIZATION, "Caller does not own the bond"),

    // state preconditions
    PRINCIPAL_ALREADY_PAID(ErrorCategory.STATE_PRECONDITION, "Principal has already been paid"),
    PRINCIPAL_NOT_PAID(ErrorCategory.STATE_PRECONDITION, "Principal has not been paid yet"),
    INSUFFICIENT_BALANCE(ErrorCategory.STATE_PRECONDITION, "Balance too low"),
    INSUFFICIENT_ALLOWANCE(ErrorCategory.STATE_PRECONDITION, "Allowance too low"),
    UNSUPPORTED_OPERATION(ErrorCategory.STATE_PRECONDITION, "Operation is permanently disabled"),

    // parameter validation
    ZERO_ADDRESS(ErrorCategory.PARAMETER_VALIDATION, "Address must not be zero"),
    ZERO_AMOUNT(ErrorCategory.PARAMETER_VALIDATION, "Amount must not be zero"),
    INVALID_RECEIVER(ErrorCategory.PARAMETER_VALIDATION, "Vault cannot pay out to itself"),
    INVALID_PRINCIPAL_AMOUNT(ErrorCategory.PARAMETER_VALIDATION, "Principal amount is not acceptable"),
    EXCESSIVE_VAULT_FEES(ErrorCategory.PARAMETER_VALIDATION, "Fees exceed 1000 bips"),
    INVALID_BOND_MATURITY(ErrorCategory.PARAMETER_VALIDATION, "Bond maturity is invalid"),
    INVALID_PAYLOAD(ErrorCategory.PARAMETER_VALIDATION, "Relay payload cannot be decoded"),

    // oracle integrity
    STALE_PRICE(ErrorCategory.ORACLE_INTEGRITY, "Latest price is too old"),
    INVALID_PRICE_VALUE(ErrorCategory.ORACLE_INTEGRITY, "Price is not positive"),
    PRICE_FEEDS_TIME_MISMATCH(ErrorCategory.ORACLE_INTEGRITY, "Feeds were updated too far apart"),

    // lookups
    ROUND_NOT_FOUND(ErrorCategory.NOT_FOUND, "Round was never received"),
    BOND_NOT_FOUND(ErrorCategory.NOT_FOUND, "Bond does not exist"),

    // relay authentication
    INVALID_SOURCE(ErrorCategory.RELAY_AUTHENTICATION, "Message source is not allowed"),
    UNEXPECTED_MESSAGE(ErrorCategory.RELAY_AUTHENTICATION, "Component does not accept messages"),
    UNAUTHORIZED_RELAYER(ErrorCategory.RELAY_AUTHENTICATION, "Relayer is not authorized"),

    // slippage
    INSUFFICIENT_ASSETS(ErrorCategory.SLIPPAGE, "Required assets exceed the caller's maximum");

    private final ErrorCategory category;
    private final String description;

    ErrorCode(ErrorCategory category, String description) {
        this.category    = category;
        this.description = description;
    }

    public ErrorCategory category() {
        return category;
    }

    public String description() {
        return description;
    }
}

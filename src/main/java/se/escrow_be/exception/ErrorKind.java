package se.escrow_be.exception;

public enum ErrorKind {
    INVALID_TRANSITION,
    UNAUTHORIZED_PARTY,
    SIGNATURE_INVALID,
    INSUFFICIENT_FUNDS,
    INCOMPLETE_EVIDENCE,
    EXTERNAL_ORACLE_FAILURE,
    UNKNOWN_MESSAGE_TYPE,
    NOT_FOUND,
    CONFLICT,
    VALIDATION,
    INTERNAL
}

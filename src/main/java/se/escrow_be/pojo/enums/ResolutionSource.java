package se.escrow_be.pojo.enums;

public enum ResolutionSource {
    SIGNATURE_THRESHOLD,  // two verified signatures agreed
    INACTIVITY_TIMEOUT,   // configured default after the inactivity deadline
    ORACLE_UNAVAILABLE    // configured default after arbitration retries ran out
}

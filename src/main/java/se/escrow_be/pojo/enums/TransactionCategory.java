package se.escrow_be.pojo.enums;

public enum TransactionCategory {
    DIGITAL_GOODS,
    SERVICES_TIMED,
    SERVICES_DELIVERABLE,
    SOCIAL_PROOF,
    PHYSICAL_GOODS
}

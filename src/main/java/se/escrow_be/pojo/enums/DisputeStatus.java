package se.escrow_be.pojo.enums;

public enum DisputeStatus {
    AWAITING_EVIDENCE,
    AWAITING_AI_DECISION,
    // Verdict recorded but no decision has two verified signatures yet
    AWAITING_SIGNATURES
}

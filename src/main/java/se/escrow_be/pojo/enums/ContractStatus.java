package se.escrow_be.pojo.enums;

public enum ContractStatus {
    PENDING,
    COMPLETED
}

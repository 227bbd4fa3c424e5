package se.escrow_be.pojo.enums;

public enum Party {
    BUYER,
    SELLER,
    AI_ORACLE;

    public Party counterparty() {
        return switch (this) {
            case BUYER -> SELLER;
            case SELLER -> BUYER;
            case AI_ORACLE -> throw new IllegalStateException("The oracle has no counterparty");
        };
    }
}

package se.escrow_be.pojo.enums;

public enum RoomStatus {
    WAITING_FOR_BUYER,
    AWAITING_DESCRIPTION,
    AWAITING_SELLER_APPROVAL,
    AWAITING_BUYER_APPROVAL,
    AWAITING_SELLER_READY,
    AWAITING_PAYMENT,
    MONEY_SECURED,
    PRODUCT_DELIVERED,
    DISPUTE,
    COMPLETE,
    // Timed out before any funds were locked
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELLED;
    }

    public boolean isNegotiation() {
        return this == AWAITING_SELLER_APPROVAL || this == AWAITING_BUYER_APPROVAL;
    }

    /**
     * Statuses from MONEY_SECURED onwards own a contract. CANCELLED never does.
     */
    public boolean requiresContract() {
        return this != CANCELLED && ordinal() >= MONEY_SECURED.ordinal();
    }

    public boolean requiresBuyer() {
        return this != CANCELLED && ordinal() >= AWAITING_DESCRIPTION.ordinal();
    }
}

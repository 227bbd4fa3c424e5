package se.escrow_be.pojo.enums;

public enum UserRole {
    BUYER,
    SELLER
}

package se.escrow_be.pojo.enums;

public enum MessageType {
    CHAT,
    SYSTEM
}

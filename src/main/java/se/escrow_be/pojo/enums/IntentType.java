package se.escrow_be.pojo.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Client to server intents carried in the {@code type} field of a WebSocket frame.
 */
public enum IntentType {
    PROPOSE_DESCRIPTION("propose_description"),
    APPROVE_DESCRIPTION("approve_description"),
    EDIT_DESCRIPTION("edit_description"),
    CONFIRM_SELLER_READY("confirm_seller_ready"),
    BUYER_LOCK_FUNDS("buyer_lock_funds"),
    PRODUCT_DELIVERED("product_delivered"),
    TRANSACTION_SUCCESSFULL("transaction_successfull"),
    INIT_DISPUTE("init_dispute"),
    FINALIZE_SUBMISSION("finalize_submission"),
    SUBMIT_SIGNATURE("submit_signature"),
    CHAT_MESSAGE("chat_message"),
    PING("ping");

    private final String wireName;

    IntentType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<IntentType> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(name))
                .findFirst();
    }
}

package se.escrow_be.exception;

/**
 * Internal fault: persisted state that violates a room or contract invariant, or an
 * infrastructure failure in the middle of a transition. Never a client mistake.
 */
public class EscrowStateException extends EscrowException {

    public EscrowStateException(String message) {
        super(ErrorKind.INTERNAL, message);
    }

    public EscrowStateException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}

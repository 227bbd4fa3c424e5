package se.escrow_be.exception;

/**
 * Base of every rejection the escrow core reports. The kind travels to REST clients in the
 * error body and to WebSocket clients in the {@code error} frame.
 */
public abstract class EscrowException extends RuntimeException {

    private final ErrorKind kind;

    protected EscrowException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected EscrowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}

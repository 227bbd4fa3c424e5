package se.escrow_be.exception;

public class BusinessLogicException extends EscrowException {

    public BusinessLogicException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    protected BusinessLogicException(ErrorKind kind, String message) {
        super(kind, message);
    }
}

package se.escrow_be.exception;

public class InvalidTransitionException extends BusinessLogicException {

    public InvalidTransitionException(String message) {
        super(ErrorKind.INVALID_TRANSITION, message);
    }
}

package se.escrow_be.exception;

public class UnknownMessageTypeException extends BusinessLogicException {

    public UnknownMessageTypeException(String message) {
        super(ErrorKind.UNKNOWN_MESSAGE_TYPE, message);
    }
}

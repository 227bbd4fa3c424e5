package se.escrow_be.exception;

public class ResourceConflictException extends BusinessLogicException {

    public ResourceConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}

package se.escrow_be.exception;

public class ResourceNotFoundException extends EscrowException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}

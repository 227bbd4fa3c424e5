package se.escrow_be.exception;

public class SignatureInvalidException extends BusinessLogicException {

    public SignatureInvalidException(String message) {
        super(ErrorKind.SIGNATURE_INVALID, message);
    }
}

package se.escrow_be.exception;

public class UnauthorizedPartyException extends EscrowException {

    public UnauthorizedPartyException(String message) {
        super(ErrorKind.UNAUTHORIZED_PARTY, message);
    }
}

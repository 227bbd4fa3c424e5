package se.escrow_be.exception;

public class InsufficientFundsException extends BusinessLogicException {

    public InsufficientFundsException(String message) {
        super(ErrorKind.INSUFFICIENT_FUNDS, message);
    }
}

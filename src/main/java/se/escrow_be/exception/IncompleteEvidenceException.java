package se.escrow_be.exception;

public class IncompleteEvidenceException extends BusinessLogicException {

    public IncompleteEvidenceException(String message) {
        super(ErrorKind.INCOMPLETE_EVIDENCE, message);
    }
}

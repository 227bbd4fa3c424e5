package se.escrow_be.exception;

public class ExternalOracleException extends EscrowException {

    public ExternalOracleException(String message) {
        super(ErrorKind.EXTERNAL_ORACLE_FAILURE, message);
    }

    public ExternalOracleException(String message, Throwable cause) {
        super(ErrorKind.EXTERNAL_ORACLE_FAILURE, message, cause);
    }
}

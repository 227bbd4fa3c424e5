package se.escrow_be.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import se.escrow_be.dto.response.ApiResponse;

import java.util.List;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(UnauthorizedPartyException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnauthorizedParty(UnauthorizedPartyException ex) {
        log.warn("Unauthorized party: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ex);
    }

    @ExceptionHandler(ResourceConflictException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(ResourceConflictException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(BusinessLogicException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessLogic(BusinessLogicException ex) {
        log.warn("Business logic violation: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(ExternalOracleException.class)
    public ResponseEntity<ApiResponse<Void>> handleExternalOracle(ExternalOracleException ex) {
        log.error("Arbitration oracle failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(EscrowStateException.class)
    public ResponseEntity<ApiResponse<Void>> handleEscrowState(EscrowStateException ex) {
        log.error("Internal escrow fault: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(HttpStatus.INTERNAL_SERVER_ERROR.toString(), "Internal error",
                        List.of(ErrorKind.INTERNAL.name())));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationErrors(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(HttpStatus.BAD_REQUEST.toString(), "Validation failed", errors));
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(HttpStatus.BAD_REQUEST.toString(), "Malformed request",
                        List.of(ErrorKind.VALIDATION.name())));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Upload too large: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiResponse.error(HttpStatus.PAYLOAD_TOO_LARGE.toString(), "Uploaded file is too large",
                        List.of(ErrorKind.VALIDATION.name())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(HttpStatus.INTERNAL_SERVER_ERROR.toString(), "An unexpected error occurred",
                        List.of(ErrorKind.INTERNAL.name())));
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, EscrowException ex) {
        return ResponseEntity.status(status)
                .body(ApiResponse.error(status.toString(), ex.getMessage(), List.of(ex.getKind().name())));
    }
}

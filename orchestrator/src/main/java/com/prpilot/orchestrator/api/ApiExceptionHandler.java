package com.prpilot.orchestrator.api;

import com.prpilot.orchestrator.api.dto.ErrorResponse;
import com.prpilot.orchestrator.error.ErrorCode;
import com.prpilot.orchestrator.error.PrFlowException;
import com.prpilot.orchestrator.model.ErrorDetail;
import com.prpilot.orchestrator.repository.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Turns every failure that escapes a controller into the uniform error body.
 *
 * <pre>
 *   validation_error            400
 *   authentication_error        401
 *   not_found                   404
 *   rate_limited                429
 *   everything else             502
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final IdGenerator ids;
    private final Clock       clock;

    public ApiExceptionHandler(IdGenerator ids, Clock clock) {
        this.ids   = ids;
        this.clock = clock;
    }

    public static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case VALIDATION_ERROR     -> HttpStatus.BAD_REQUEST;
            case AUTHENTICATION_ERROR -> HttpStatus.UNAUTHORIZED;
            case NOT_FOUND            -> HttpStatus.NOT_FOUND;
            case RATE_LIMITED         -> HttpStatus.TOO_MANY_REQUESTS;
            default                   -> HttpStatus.BAD_GATEWAY;
        };
    }

    @ExceptionHandler(PrFlowException.class)
    public ResponseEntity<ErrorResponse> handle(PrFlowException e) {
        return respond(ErrorDetail.from(e));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return respond(new ErrorDetail(ErrorCode.VALIDATION_ERROR, "Request body is missing or is not valid JSON",
                List.of("Send a JSON object with Content-Type: application/json"), false, Map.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error in request", e);
        return respond(ErrorDetail.internal(e));
    }

    ResponseEntity<ErrorResponse> respond(ErrorDetail detail) {
        String errorId = ids.next(IdGenerator.ERROR);
        if (detail.code() != ErrorCode.INTERNAL_ERROR) {
            log.info("Request rejected [{}] {}: {}", errorId, detail.code().code(), detail.message());
        }
        return ResponseEntity.status(statusFor(detail.code()))
                .body(new ErrorResponse(ErrorResponse.ErrorBody.from(detail), clock.instant(), errorId));
    }
}

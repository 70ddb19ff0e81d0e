package uk.gegc.reviewscheduler.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authorization.AuthorizationDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.reviewscheduler.features.review.application.exception.InvalidQualityException;
import uk.gegc.reviewscheduler.features.review.application.exception.ReviewConflictException;
import uk.gegc.reviewscheduler.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.reviewscheduler.shared.api.problem.ProblemType;
import uk.gegc.reviewscheduler.shared.exception.ForbiddenException;
import uk.gegc.reviewscheduler.shared.exception.ResourceNotFoundException;
import uk.gegc.reviewscheduler.shared.exception.UnauthorizedException;

/**
 * Maps review API failures to {@code application/problem+json} responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String FORBIDDEN_DETAIL = "You do not have permission to access this resource";
    private static final String CONSTRAINT_DETAIL = "One or more validation constraints were violated";

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return respond(ProblemType.RESOURCE_NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidQualityException.class)
    public ResponseEntity<ProblemDetail> handleInvalidQuality(InvalidQualityException ex, HttpServletRequest request) {
        return respond(ProblemType.INVALID_QUALITY, ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(ProblemType.INVALID_ARGUMENT, ex.getMessage(), request);
    }

    @ExceptionHandler(ReviewConflictException.class)
    public ResponseEntity<ProblemDetail> handleReviewConflict(ReviewConflictException ex, HttpServletRequest request) {
        logger.info("Rejected review on record {}: {}", ex.getRecordId(), ex.getMessage());
        return ProblemDetailBuilder.of(ProblemType.REVIEW_CONFLICT)
                .detail(ex.getMessage())
                .property("recordId", ex.getRecordId())
                .at(request)
                .toResponse();
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ProblemDetail> handleStaleRecord(OptimisticLockingFailureException ex, HttpServletRequest request) {
        logger.warn("Stale review record write: {}", ex.getMessage());
        return respond(ProblemType.OPTIMISTIC_LOCK_CONFLICT,
                "Review record has been modified concurrently. Please refresh and try again.", request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex, HttpServletRequest request) {
        logger.error("Constraint rejected review write: {}", ex.getMostSpecificCause().getMessage(), ex);
        return respond(ProblemType.DATA_CONFLICT,
                "The review data conflicts with an existing record.", request);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleUnauthorized(UnauthorizedException ex, HttpServletRequest request) {
        return respond(ProblemType.UNAUTHORIZED, ex.getMessage(), request);
    }

    @ExceptionHandler({ForbiddenException.class, AccessDeniedException.class, AuthorizationDeniedException.class})
    public ResponseEntity<ProblemDetail> handleForbidden(RuntimeException ex, HttpServletRequest request) {
        String detail = ex.getMessage() == null ? FORBIDDEN_DETAIL : ex.getMessage();
        return respond(ProblemType.ACCESS_DENIED, detail, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        return ProblemDetailBuilder.of(ProblemType.CONSTRAINT_VIOLATION)
                .detail(CONSTRAINT_DETAIL)
                .property("violations", ex.getConstraintViolations().stream().map(InvalidField::of).toList())
                .at(request)
                .toResponse();
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String expected = ex.getRequiredType() == null ? "unknown" : ex.getRequiredType().getSimpleName();
        return ProblemDetailBuilder.of(ProblemType.TYPE_MISMATCH)
                .detail("Parameter '%s' expects a value of type %s.".formatted(ex.getName(), expected))
                .property("parameter", ex.getName())
                .property("expectedType", expected)
                .property("providedValue", ex.getValue())
                .at(request)
                .toResponse();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
        logger.error("Unexpected failure serving {}", request.getRequestURI(), ex);
        return respond(ProblemType.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = ProblemDetailBuilder.of(ProblemType.MALFORMED_JSON)
                .detail("Request body is malformed or cannot be read")
                .property("parseError", ex.getMostSpecificCause().getMessage())
                .at(request)
                .build();
        return new ResponseEntity<>(problem, headers, ProblemType.MALFORMED_JSON.status());
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = ProblemDetailBuilder.of(ProblemType.VALIDATION_FAILED)
                .detail("Validation failed for one or more fields")
                .property("fieldErrors", ex.getBindingResult().getFieldErrors().stream().map(InvalidField::of).toList())
                .at(request)
                .build();
        return new ResponseEntity<>(problem, headers, ProblemType.VALIDATION_FAILED.status());
    }

    @Override
    protected ResponseEntity<Object> handleHandlerMethodValidationException(
            @NonNull HandlerMethodValidationException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = ProblemDetailBuilder.of(ProblemType.CONSTRAINT_VIOLATION)
                .detail(CONSTRAINT_DETAIL)
                .at(request)
                .build();
        return new ResponseEntity<>(problem, headers, ProblemType.CONSTRAINT_VIOLATION.status());
    }

    private static ResponseEntity<ProblemDetail> respond(ProblemType type, String detail, HttpServletRequest request) {
        return ProblemDetailBuilder.of(type).detail(detail).at(request).toResponse();
    }

    private record InvalidField(String field, String message, Object rejectedValue) {

        static InvalidField of(ConstraintViolation<?> violation) {
            return new InvalidField(violation.getPropertyPath().toString(), violation.getMessage(), violation.getInvalidValue());
        }

        static InvalidField of(FieldError error) {
            return new InvalidField(error.getField(), error.getDefaultMessage(), error.getRejectedValue());
        }
    }
}

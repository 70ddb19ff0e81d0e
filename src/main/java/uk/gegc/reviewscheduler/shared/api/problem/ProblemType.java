package uk.gegc.reviewscheduler.shared.api.problem;

import org.springframework.http.HttpStatus;

import java.net.URI;

/**
 * Problem kinds returned by the review API, each bound to its HTTP status and RFC 7807 title.
 * The {@code type} URI is derived from the slug.
 */
public enum ProblemType {

    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND, "resource-not-found", "Resource Not Found"),

    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "validation-failed", "Validation Failed"),
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST, "invalid-argument", "Invalid Argument"),
    INVALID_QUALITY(HttpStatus.BAD_REQUEST, "invalid-quality", "Invalid Quality"),
    CONSTRAINT_VIOLATION(HttpStatus.BAD_REQUEST, "constraint-violation", "Constraint Violation"),
    TYPE_MISMATCH(HttpStatus.BAD_REQUEST, "type-mismatch", "Type Mismatch"),
    MALFORMED_JSON(HttpStatus.BAD_REQUEST, "malformed-json", "Malformed JSON"),

    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "unauthorized", "Unauthorized"),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, "access-denied", "Access Denied"),

    REVIEW_CONFLICT(HttpStatus.CONFLICT, "review-conflict", "Review Conflict"),
    OPTIMISTIC_LOCK_CONFLICT(HttpStatus.CONFLICT, "optimistic-lock-conflict", "Conflict"),
    DATA_CONFLICT(HttpStatus.CONFLICT, "data-conflict", "Data Conflict"),

    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "internal-server-error", "Internal Server Error");

    private static final String DOCS_BASE = "https://review-scheduler.gegc.uk/docs/errors/";

    private final HttpStatus status;
    private final URI uri;
    private final String title;

    ProblemType(HttpStatus status, String slug, String title) {
        this.status = status;
        this.uri = URI.create(DOCS_BASE + slug);
        this.title = title;
    }

    public HttpStatus status() {
        return status;
    }

    public URI uri() {
        return uri;
    }

    public String title() {
        return title;
    }
}

package uk.gegc.reviewscheduler.features.review.application.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * A completion collided with another one for the same record and could not be treated as a replay.
 * Clients should refresh the due list instead of resubmitting.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ReviewConflictException extends RuntimeException {

    private final UUID recordId;

    public ReviewConflictException(UUID recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public ReviewConflictException(UUID recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
    }

    public UUID getRecordId() {
        return recordId;
    }
}

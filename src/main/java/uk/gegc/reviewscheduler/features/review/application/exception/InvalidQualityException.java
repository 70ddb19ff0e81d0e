package uk.gegc.reviewscheduler.features.review.application.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidQualityException extends RuntimeException {

    public InvalidQualityException(String message) {
        super(message);
    }
}

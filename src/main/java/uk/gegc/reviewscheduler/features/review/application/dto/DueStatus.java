package uk.gegc.reviewscheduler.features.review.application.dto;

public enum DueStatus {
    DUE,
    UPCOMING
}

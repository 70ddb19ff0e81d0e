package uk.gegc.reviewscheduler.features.review.application.dto;

/**
 * Declared from most to least urgent; ordinal order is used for sorting.
 */
public enum ReminderPriority {
    HIGH,
    NORMAL,
    LOW
}

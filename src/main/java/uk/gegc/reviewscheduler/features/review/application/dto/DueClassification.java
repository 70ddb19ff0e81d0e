package uk.gegc.reviewscheduler.features.review.application.dto;

public record DueClassification(
        DueStatus status,
        long daysOverdue,
        long daysUntil,
        ReminderPriority priority
) {
    public boolean isDue() {
        return status == DueStatus.DUE;
    }

    public boolean isOverdue() {
        return daysOverdue > 0;
    }
}

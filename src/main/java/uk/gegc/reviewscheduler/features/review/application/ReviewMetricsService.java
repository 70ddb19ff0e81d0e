package uk.gegc.reviewscheduler.features.review.application;

public interface ReviewMetricsService {

    void recordScheduled();

    void recordCompleted(int quality);

    void recordReplayed();

    void recordConflict();
}

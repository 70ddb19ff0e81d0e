package uk.gegc.reviewscheduler.features.review.application;

import uk.gegc.reviewscheduler.features.review.application.dto.ReminderDto;

import java.util.List;
import java.util.UUID;

public interface ReviewReminderService {

    List<ReminderDto> reminders(UUID userId);
}

package com.mergington.highschool.service;

import com.mergington.highschool.dto.ActivityDTO;
import com.mergington.highschool.dto.MessageResponse;
import com.mergington.highschool.exception.BadRequestException;
import com.mergington.highschool.exception.ResourceNotFoundException;
import com.mergington.highschool.exception.StorageWriteFailedException;
import com.mergington.highschool.exception.UnauthorizedException;
import com.mergington.highschool.model.Activity;
import com.mergington.highschool.model.ScheduleDetails;
import com.mergington.highschool.repository.ActivityRepository;
import com.mergington.highschool.security.CredentialVerifier;
import com.mergington.highschool.util.ScheduleTimes;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class ActivityService {

    private static final Logger logger = LoggerFactory.getLogger(ActivityService.class);

    private final ActivityRepository activityRepository;
    private final CredentialVerifier credentialVerifier;

    /**
     * Lists activities keyed by name, in store order.
     *
     * @param day       keep only activities meeting on this weekday (exact match)
     * @param startTime lower bound for the activity start, applied only together with {@code endTime}
     * @param endTime   upper bound for the activity end, applied only together with {@code startTime}
     */
    public Map<String, ActivityDTO> listActivities(String day, String startTime, String endTime) {
        boolean filterByDay = hasText(day);
        boolean filterByTime = hasText(startTime) && hasText(endTime);

        Optional<Integer> from = filterByTime ? ScheduleTimes.toMinuteOfDay(startTime) : Optional.empty();
        Optional<Integer> to = filterByTime ? ScheduleTimes.toMinuteOfDay(endTime) : Optional.empty();

        Map<String, ActivityDTO> results = new LinkedHashMap<>();
        for (Activity activity : activityRepository.findAll()) {
            if (filterByDay && !meetsOn(activity, day)) {
                continue;
            }
            if (filterByTime && !fitsWithin(activity, from, to)) {
                continue;
            }
            results.put(activity.getName(), mapToDTO(activity));
        }
        return results;
    }

    public List<String> getAvailableDays() {
        return activityRepository.findDistinctScheduledDays();
    }

    public MessageResponse signup(String activityName, String email, String teacherUsername) {
        requireTeacher(teacherUsername);

        Activity activity = activityRepository.findById(activityName)
                .orElseThrow(() -> new ResourceNotFoundException("Activity not found"));

        if (participantsOf(activity).contains(email)) {
            throw new BadRequestException("Already signed up for this activity");
        }

        if (activityRepository.addParticipant(activityName, email) == 0) {
            throw new StorageWriteFailedException("Failed to update activity");
        }

        logger.info("Teacher {} signed up {} for {}", teacherUsername, email, activityName);
        return new MessageResponse("Signed up " + email + " for " + activityName);
    }

    public MessageResponse unregister(String activityName, String email, String teacherUsername) {
        requireTeacher(teacherUsername);

        Activity activity = activityRepository.findById(activityName)
                .orElseThrow(() -> new ResourceNotFoundException("Activity not found"));

        if (!participantsOf(activity).contains(email)) {
            throw new BadRequestException("Not registered for this activity");
        }

        if (activityRepository.removeParticipant(activityName, email) == 0) {
            throw new StorageWriteFailedException("Failed to update activity");
        }

        logger.info("Teacher {} unregistered {} from {}", teacherUsername, email, activityName);
        return new MessageResponse("Unregistered " + email + " from " + activityName);
    }

    private void requireTeacher(String teacherUsername) {
        if (!hasText(teacherUsername)) {
            throw new UnauthorizedException("Authentication required for this action");
        }
        if (!credentialVerifier.verify(teacherUsername)) {
            logger.warn("Rejected roster change for unknown teacher {}", teacherUsername);
            throw new UnauthorizedException("Invalid teacher credentials");
        }
    }

    private boolean meetsOn(Activity activity, String day) {
        ScheduleDetails details = activity.getScheduleDetails();
        return details != null && details.getDays() != null && details.getDays().contains(day);
    }

    // An unparseable bound on either side excludes every activity
    private boolean fitsWithin(Activity activity, Optional<Integer> from, Optional<Integer> to) {
        ScheduleDetails details = activity.getScheduleDetails();
        if (details == null || from.isEmpty() || to.isEmpty()) {
            return false;
        }
        Optional<Integer> start = ScheduleTimes.toMinuteOfDay(details.getStartTime());
        Optional<Integer> end = ScheduleTimes.toMinuteOfDay(details.getEndTime());
        if (start.isEmpty() || end.isEmpty()) {
            return false;
        }
        return start.get() >= from.get() && end.get() <= to.get();
    }

    private List<String> participantsOf(Activity activity) {
        return activity.getParticipants() != null ? activity.getParticipants() : List.of();
    }

    private ActivityDTO mapToDTO(Activity activity) {
        return ActivityDTO.builder()
                .description(activity.getDescription())
                .schedule(activity.getSchedule())
                .scheduleDetails(activity.getScheduleDetails())
                .maxParticipants(activity.getMaxParticipants())
                .participants(new ArrayList<>(participantsOf(activity)))
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

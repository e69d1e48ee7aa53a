package com.mergington.highschool.controller;

import com.mergington.highschool.dto.ActivityDTO;
import com.mergington.highschool.dto.MessageResponse;
import com.mergington.highschool.service.ActivityService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/activities")
@RequiredArgsConstructor
@CrossOrigin("*")
@Validated
public class ActivityController {

    private final ActivityService activityService;

    /**
     * List activities, optionally filtered by weekday and by a start/end time window.
     */
    @GetMapping
    public ResponseEntity<Map<String, ActivityDTO>> getActivities(
            @RequestParam(required = false) String day,
            @RequestParam(name = "start_time", required = false) String startTime,
            @RequestParam(name = "end_time", required = false) String endTime) {
        return ResponseEntity.ok(activityService.listActivities(day, startTime, endTime));
    }

    @GetMapping("/days")
    public ResponseEntity<List<String>> getAvailableDays() {
        return ResponseEntity.ok(activityService.getAvailableDays());
    }

    @PostMapping("/{activityName}/signup")
    public ResponseEntity<MessageResponse> signup(@PathVariable String activityName,
            @RequestParam @NotBlank String email,
            @RequestParam(name = "teacher_username", required = false) String teacherUsername) {
        return ResponseEntity.ok(activityService.signup(activityName, email, teacherUsername));
    }

    @PostMapping("/{activityName}/unregister")
    public ResponseEntity<MessageResponse> unregister(@PathVariable String activityName,
            @RequestParam @NotBlank String email,
            @RequestParam(name = "teacher_username", required = false) String teacherUsername) {
        return ResponseEntity.ok(activityService.unregister(activityName, email, teacherUsername));
    }
}

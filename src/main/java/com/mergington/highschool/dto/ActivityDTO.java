package com.mergington.highschool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mergington.highschool.model.ScheduleDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Activity details as listed under the activity's name; the name itself is the map key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActivityDTO {
    private String description;
    private String schedule;

    @JsonProperty("schedule_details")
    private ScheduleDetails scheduleDetails;

    @JsonProperty("max_participants")
    private Integer maxParticipants;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private List<String> participants;
}

package com.mergington.highschool.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.List;

/**
 * Structured meeting pattern of an activity. Times are 24-hour "HH:MM" strings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScheduleDetails {

    private List<String> days;

    @Field("start_time")
    @JsonProperty("start_time")
    private String startTime;

    @Field("end_time")
    @JsonProperty("end_time")
    private String endTime;
}

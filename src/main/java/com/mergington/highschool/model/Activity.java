package com.mergington.highschool.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "activities")
public class Activity {

    // The activity name doubles as the document id
    @Id
    private String name;

    private String description;

    // Human readable summary, e.g. "Mondays and Fridays, 3:15 PM - 4:45 PM"
    private String schedule;

    @Field("schedule_details")
    private ScheduleDetails scheduleDetails;

    @Field("max_participants")
    private Integer maxParticipants;

    @Builder.Default
    private List<String> participants = new ArrayList<>();
}

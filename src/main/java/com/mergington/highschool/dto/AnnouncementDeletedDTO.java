package com.mergington.highschool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnnouncementDeletedDTO {

    @JsonProperty("_id")
    private String id;

    private boolean deleted;
}

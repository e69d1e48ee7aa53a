package com.mergington.highschool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnnouncementRequestDTO {

    // Teacher performing the change
    private String username;

    private String message;

    @JsonProperty("expiration_date")
    private String expirationDate;

    @JsonProperty("start_date")
    private String startDate;
}

package com.mergington.highschool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnnouncementDTO {

    @JsonProperty("_id")
    private String id;

    private String message;

    @JsonProperty("expiration_date")
    private String expirationDate;

    @JsonProperty("start_date")
    private String startDate;
}

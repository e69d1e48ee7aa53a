package com.mergington.highschool.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "announcements")
public class Announcement {

    @Id
    private String id;

    private String message;

    // Dates are kept as validated ISO strings (YYYY-MM-DD)
    @Field("expiration_date")
    private String expirationDate;

    @Field("start_date")
    private String startDate;
}

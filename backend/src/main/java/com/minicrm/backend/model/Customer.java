package com.minicrm.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;

/**
 * Customer document. Segments select audiences from this collection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "customers")
public class Customer {

    @Id
    private String id;

    @Indexed(unique = true)
    private String customerId;

    private String name;

    @Indexed
    private String email;

    private String phone;

    // Engagement
    private Double totalSpent;
    private Integer totalVisits;
    private Instant lastVisit;
    private Instant registrationDate;
    private Instant subscriptionExpiresAt;

    private String status;
    private String preferredCategory;

    private Location location;
    private Preferences preferences;
    private AiInsights aiInsights;

    @Field("isActive")
    private Boolean active;

    private List<String> tags;

    @CreatedDate
    private Instant createdAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Location {
        private String city;
        private String state;
        private String country;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Preferences {
        /** email, sms or both */
        private String channel;
        private String language;
        private Boolean emailOptIn;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AiInsights {
        /** low, medium or high */
        private String churnRisk;
        private Double lifetimeValue;
    }
}

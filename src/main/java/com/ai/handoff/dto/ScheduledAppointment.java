package com.ai.handoff.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.lang.Nullable;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScheduledAppointment {

    @JsonAlias("phone_normalized")
    private String identity;

    @JsonAlias("canal")
    private String channel;

    @JsonAlias("scheduled_datetime")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant scheduledAt;

    @Builder.Default
    private AppointmentStatus status = AppointmentStatus.PENDING;

    @JsonAlias("reminder_sent")
    private boolean reminderSent;

    @JsonAlias("followup_sent")
    private boolean followupSent;

    @JsonAlias("created_at")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant createdAt;

    @Nullable
    @JsonAlias("contact_name")
    private String contactName;

    @Nullable
    @JsonAlias("contact_id")
    private String contactId;

    @Nullable
    private String notes;
}

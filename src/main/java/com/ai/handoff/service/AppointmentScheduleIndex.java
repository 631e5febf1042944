package com.ai.handoff.service;

import com.ai.handoff.component.BusinessHours;
import com.ai.handoff.component.SessionKeyspace;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.AppointmentStatus;
import com.ai.handoff.dto.ScheduledAppointment;
import com.ai.handoff.dto.StoreDocuments;
import com.ai.handoff.store.CoordinationStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Appointments per session plus a time-ordered index scored by the scheduled instant
 * in epoch seconds. Reminder and follow-up lookups are range queries over the index.
 * Cancelling removes the index pointer; the record stays until its TTL runs out.
 */
@Service
public class AppointmentScheduleIndex {

    private static final Logger log = LoggerFactory.getLogger(AppointmentScheduleIndex.class);

    private static final Duration WINDOW_NEAR = Duration.ofHours(23);
    private static final Duration WINDOW_FAR = Duration.ofHours(25);
    private static final Instant FAR_FUTURE = Instant.parse("9999-12-31T23:59:59Z");

    private final CoordinationStore store;
    private final SessionKeyspace keyspace;
    private final BusinessHours businessHours;
    private final Clock clock;
    private final Duration recordTtl;
    private final ObjectMapper mapper = StoreDocuments.newMapper();

    public AppointmentScheduleIndex(CoordinationStore store,
                                    SessionKeyspace keyspace,
                                    BusinessHours businessHours,
                                    Clock clock,
                                    @Value("${handoff.appointments.ttl:30d}") Duration recordTtl) {
        this.store = store;
        this.keyspace = keyspace;
        this.businessHours = businessHours;
        this.clock = clock;
        this.recordTtl = recordTtl;
    }

    public ScheduledAppointment create(SessionRef ref, Instant scheduledAt,
                                       @Nullable String contactName, @Nullable String contactId,
                                       @Nullable String notes) {
        ScheduledAppointment appointment = ScheduledAppointment.builder()
                .identity(ref.identity())
                .channel(ref.channel())
                .scheduledAt(scheduledAt)
                .status(AppointmentStatus.PENDING)
                .createdAt(clock.instant())
                .contactName(contactName)
                .contactId(contactId)
                .notes(notes)
                .build();
        String key = keyspace.appointmentKey(ref);
        store.set(key, encode(appointment), recordTtl);
        store.addToIndex(SessionKeyspace.APPOINTMENT_INDEX, key, score(scheduledAt));
        log.info("[{}] Appointment created for {}", ref, scheduledAt.atZone(businessHours.getZone()).toLocalDateTime());
        return appointment;
    }

    /**
     * Zone-less date-times are read in the business time zone.
     */
    public ScheduledAppointment create(SessionRef ref, LocalDateTime scheduledAt,
                                       @Nullable String contactName, @Nullable String contactId,
                                       @Nullable String notes) {
        return create(ref, scheduledAt.atZone(businessHours.getZone()).toInstant(), contactName, contactId, notes);
    }

    public Optional<ScheduledAppointment> get(SessionRef ref) {
        return load(keyspace.appointmentKey(ref));
    }

    /**
     * Rewrites the record and moves its index pointer when the date changed.
     * Cancelled appointments stay out of the index.
     */
    public void update(ScheduledAppointment appointment) {
        SessionRef ref = SessionRef.of(appointment.getIdentity(), appointment.getChannel());
        String key = keyspace.appointmentKey(ref);
        store.set(key, encode(appointment), recordTtl);
        if (appointment.getStatus() != AppointmentStatus.CANCELLED) {
            store.addToIndex(SessionKeyspace.APPOINTMENT_INDEX, key, score(appointment.getScheduledAt()));
        }
    }

    public boolean confirm(SessionRef ref) {
        return modify(ref, a -> a.setStatus(AppointmentStatus.CONFIRMED));
    }

    public boolean complete(SessionRef ref) {
        boolean done = modify(ref, a -> a.setStatus(AppointmentStatus.COMPLETED));
        if (done) {
            log.info("[{}] Appointment completed", ref);
        }
        return done;
    }

    public boolean markNoShow(SessionRef ref) {
        return modify(ref, a -> a.setStatus(AppointmentStatus.NO_SHOW));
    }

    public boolean markReminderSent(SessionRef ref) {
        return modify(ref, a -> a.setReminderSent(true));
    }

    public boolean markFollowupSent(SessionRef ref) {
        return modify(ref, a -> a.setFollowupSent(true));
    }

    public boolean cancel(SessionRef ref) {
        Optional<ScheduledAppointment> appointment = get(ref);
        if (appointment.isEmpty()) {
            return false;
        }
        appointment.get().setStatus(AppointmentStatus.CANCELLED);
        String key = keyspace.appointmentKey(ref);
        store.set(key, encode(appointment.get()), recordTtl);
        store.removeFromIndex(SessionKeyspace.APPOINTMENT_INDEX, key);
        log.info("[{}] Appointment cancelled", ref);
        return true;
    }

    /**
     * Open appointments 23 to 25 hours ahead whose reminder has not gone out.
     * The two-hour window tolerates an hourly job.
     */
    public List<ScheduledAppointment> dueForReminder() {
        Instant now = clock.instant();
        List<ScheduledAppointment> due = scan(now.plus(WINDOW_NEAR), now.plus(WINDOW_FAR), Integer.MAX_VALUE,
                a -> a.getStatus().isOpen() && !a.isReminderSent());
        log.info("Appointments due for reminder: {}", due.size());
        return due;
    }

    /**
     * Completed appointments 23 to 25 hours ago without a follow-up.
     */
    public List<ScheduledAppointment> dueForFollowup() {
        Instant now = clock.instant();
        List<ScheduledAppointment> due = scan(now.minus(WINDOW_FAR), now.minus(WINDOW_NEAR), Integer.MAX_VALUE,
                a -> a.getStatus() == AppointmentStatus.COMPLETED && !a.isFollowupSent());
        log.info("Appointments due for follow-up: {}", due.size());
        return due;
    }

    public List<ScheduledAppointment> upcoming(int limit, @Nullable String identity) {
        Instant now = clock.instant();
        return scan(now, FAR_FUTURE, limit,
                a -> a.getStatus().isOpen() && (identity == null || identity.equals(a.getIdentity())));
    }

    private List<ScheduledAppointment> scan(Instant from, Instant to, int limit,
                                            Predicate<ScheduledAppointment> filter) {
        List<ScheduledAppointment> result = new ArrayList<>();
        if (limit <= 0) {
            return result;
        }
        for (String key : store.rangeByScore(SessionKeyspace.APPOINTMENT_INDEX, score(from), score(to), Integer.MAX_VALUE)) {
            Optional<ScheduledAppointment> appointment = load(key);
            if (appointment.isEmpty()) {
                log.debug("Dropping index pointer {} with no record", key);
                store.removeFromIndex(SessionKeyspace.APPOINTMENT_INDEX, key);
                continue;
            }
            if (filter.test(appointment.get())) {
                result.add(appointment.get());
                if (result.size() >= limit) {
                    break;
                }
            }
        }
        return result;
    }

    private boolean modify(SessionRef ref, Consumer<ScheduledAppointment> change) {
        Optional<ScheduledAppointment> appointment = get(ref);
        if (appointment.isEmpty()) {
            return false;
        }
        change.accept(appointment.get());
        store.set(keyspace.appointmentKey(ref), encode(appointment.get()), recordTtl);
        return true;
    }

    private Optional<ScheduledAppointment> load(String key) {
        Optional<String> raw = store.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            ScheduledAppointment appointment = mapper.readValue(raw.get(), ScheduledAppointment.class);
            if (appointment.getStatus() == null) {
                appointment.setStatus(AppointmentStatus.PENDING);
            }
            return Optional.of(appointment);
        } catch (JsonProcessingException e) {
            log.error("Undecodable appointment {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String encode(ScheduledAppointment appointment) {
        try {
            return mapper.writeValueAsString(appointment);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize appointment " + appointment.getIdentity(), e);
        }
    }

    private static double score(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
    }
}

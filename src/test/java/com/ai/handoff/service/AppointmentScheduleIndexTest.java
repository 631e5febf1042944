package com.ai.handoff.service;

import com.ai.handoff.component.BusinessHours;
import com.ai.handoff.component.SessionKeyspace;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.AppointmentStatus;
import com.ai.handoff.dto.ScheduledAppointment;
import com.ai.handoff.store.InMemoryCoordinationStore;
import com.ai.handoff.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class AppointmentScheduleIndexTest {

    private static final SessionRef ANA = SessionRef.of("+573001234567", "whatsapp");
    private static final SessionRef LUIS = SessionRef.of("+573109876543", "whatsapp");
    private static final SessionRef EVA = SessionRef.of("+573205551234", "instagram");

    private final MutableClock clock = MutableClock.at("2024-06-03T15:00:00Z");
    private final InMemoryCoordinationStore store = new InMemoryCoordinationStore(clock);
    private final BusinessHours hours = new BusinessHours(clock, "America/Bogota", "08:30", "17:00", "08:30", "12:00");
    private final AppointmentScheduleIndex schedule =
            new AppointmentScheduleIndex(store, new SessionKeyspace(), hours, clock, Duration.ofDays(30));

    @Test
    void reminder_window_is_23_to_25_hours_ahead() {
        schedule.create(ANA, clock.instant().plus(Duration.ofHours(24)), "Ana", null, null);
        schedule.create(LUIS, clock.instant().plus(Duration.ofHours(20)), "Luis", null, null);
        schedule.create(EVA, clock.instant().plus(Duration.ofHours(24)), "Eva", null, null);
        schedule.markReminderSent(EVA);

        assertThat(schedule.dueForReminder())
                .extracting(ScheduledAppointment::getIdentity)
                .containsExactly(ANA.identity());
    }

    @Test
    void confirmed_appointments_still_get_reminders_but_cancelled_ones_do_not() {
        schedule.create(ANA, clock.instant().plus(Duration.ofHours(24)), null, null, null);
        schedule.create(LUIS, clock.instant().plus(Duration.ofHours(24)), null, null, null);
        schedule.confirm(ANA);
        schedule.cancel(LUIS);

        assertThat(schedule.dueForReminder()).extracting(ScheduledAppointment::getIdentity)
                .containsExactly(ANA.identity());
    }

    @Test
    void follow_up_window_is_23_to_25_hours_after_a_completed_visit() {
        schedule.create(ANA, clock.instant().minus(Duration.ofHours(24)), null, null, null);
        schedule.create(LUIS, clock.instant().minus(Duration.ofHours(24)), null, null, null);
        schedule.create(EVA, clock.instant().minus(Duration.ofHours(30)), null, null, null);
        schedule.complete(ANA);
        schedule.markNoShow(LUIS);
        schedule.complete(EVA);

        assertThat(schedule.dueForFollowup()).extracting(ScheduledAppointment::getIdentity)
                .containsExactly(ANA.identity());

        schedule.markFollowupSent(ANA);
        assertThat(schedule.dueForFollowup()).isEmpty();
    }

    @Test
    void cancel_removes_the_pointer_but_keeps_the_record() {
        schedule.create(ANA, clock.instant().plus(Duration.ofDays(2)), "Ana", "901", "Apto 302");

        assertThat(schedule.cancel(ANA)).isTrue();

        assertThat(store.rangeByScore(SessionKeyspace.APPOINTMENT_INDEX, 0, Double.MAX_VALUE, 10)).isEmpty();
        ScheduledAppointment kept = schedule.get(ANA).orElseThrow();
        assertThat(kept.getStatus()).isEqualTo(AppointmentStatus.CANCELLED);
        assertThat(kept.getNotes()).isEqualTo("Apto 302");
        assertThat(schedule.upcoming(10, null)).isEmpty();
    }

    @Test
    void record_expires_after_thirty_days() {
        schedule.create(ANA, clock.instant().plus(Duration.ofDays(1)), null, null, null);

        clock.advance(Duration.ofDays(30));

        assertThat(schedule.get(ANA)).isEmpty();
        assertThat(schedule.confirm(ANA)).isFalse();
    }

    @Test
    void upcoming_is_ordered_capped_and_filterable() {
        schedule.create(ANA, clock.instant().plus(Duration.ofDays(3)), null, null, null);
        schedule.create(LUIS, clock.instant().plus(Duration.ofDays(1)), null, null, null);
        schedule.create(EVA, clock.instant().plus(Duration.ofDays(2)), null, null, null);
        schedule.create(SessionRef.of("+573001234567", "instagram"), clock.instant().minus(Duration.ofHours(1)), null, null, null);

        assertThat(schedule.upcoming(2, null)).extracting(ScheduledAppointment::getIdentity)
                .containsExactly(LUIS.identity(), EVA.identity());
        assertThat(schedule.upcoming(10, ANA.identity())).extracting(ScheduledAppointment::getChannel)
                .containsExactly("whatsapp");
    }

    @Test
    void local_times_are_read_in_the_business_zone() {
        ScheduledAppointment appointment = schedule.create(ANA, LocalDateTime.of(2024, 6, 4, 10, 0), null, null, null);

        assertThat(appointment.getScheduledAt()).isEqualTo(Instant.parse("2024-06-04T15:00:00Z"));
    }

    @Test
    void update_moves_the_index_pointer() {
        ScheduledAppointment appointment = schedule.create(ANA, clock.instant().plus(Duration.ofDays(5)), null, null, null);
        appointment.setScheduledAt(clock.instant().plus(Duration.ofHours(24)));

        schedule.update(appointment);

        assertThat(schedule.dueForReminder()).hasSize(1);
    }

    @Test
    void old_records_with_snake_case_fields_are_readable() {
        store.set("appointment:+573001234567:whatsapp", "{"
                + "\"phone_normalized\":\"+573001234567\",\"canal\":\"whatsapp\","
                + "\"scheduled_datetime\":\"2024-06-04T10:00:00-05:00\",\"status\":\"confirmed\","
                + "\"reminder_sent\":false,\"followup_sent\":false,\"contact_name\":\"Ana\"}", null);

        ScheduledAppointment appointment = schedule.get(ANA).orElseThrow();

        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.CONFIRMED);
        assertThat(appointment.getScheduledAt()).isEqualTo(Instant.parse("2024-06-04T15:00:00Z"));
        assertThat(appointment.getContactName()).isEqualTo("Ana");
    }
}

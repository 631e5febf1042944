package com.ai.handoff.component;

import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.service.AppointmentScheduleIndex;
import com.ai.handoff.service.OutboundMessenger;
import com.ai.handoff.store.InMemoryCoordinationStore;
import com.ai.handoff.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

class AppointmentReminderJobTest {

    private static final SessionRef ANA = SessionRef.of("+573001234567", "whatsapp");
    private static final SessionRef LUIS = SessionRef.of("+573109876543", "whatsapp");

    private final MutableClock clock = MutableClock.at("2024-06-03T15:00:00Z");
    private final BusinessHours hours = new BusinessHours(clock, "America/Bogota", "08:30", "17:00", "08:30", "12:00");
    private final AppointmentScheduleIndex schedule = new AppointmentScheduleIndex(
            new InMemoryCoordinationStore(clock), new SessionKeyspace(), hours, clock, Duration.ofDays(30));
    private final OutboundMessenger messenger = mock(OutboundMessenger.class);
    private final AppointmentReminderJob job = new AppointmentReminderJob(schedule, messenger, hours);

    @Test
    void sends_reminder_in_local_time_and_marks_it() {
        schedule.create(ANA, clock.instant().plus(Duration.ofHours(24)), "Ana María", null, null);

        AppointmentReminderJob.Report report = job.runOnce();

        assertThat(report).isEqualTo(new AppointmentReminderJob.Report(1, 0, 0));
        verify(messenger).send(ANA,
                "¡Hola Ana! Te recordamos tu visita de mañana a las 10:00. Responde CONFIRMAR para confirmarla.");
        assertThat(schedule.get(ANA).orElseThrow().isReminderSent()).isTrue();

        assertThat(job.runOnce().reminders()).isZero();
        verifyNoMoreInteractions(messenger);
    }

    @Test
    void sends_follow_up_after_a_completed_visit() {
        schedule.create(ANA, clock.instant().minus(Duration.ofHours(24)), null, null, null);
        schedule.complete(ANA);

        AppointmentReminderJob.Report report = job.runOnce();

        assertThat(report.followups()).isEqualTo(1);
        verify(messenger).send(eq(ANA), eq(String.format(AppointmentReminderJob.FOLLOWUP_TEMPLATE, "")));
        assertThat(schedule.get(ANA).orElseThrow().isFollowupSent()).isTrue();
    }

    @Test
    void one_failed_send_does_not_stop_the_sweep() {
        schedule.create(ANA, clock.instant().plus(Duration.ofHours(24)), "Ana", null, null);
        schedule.create(LUIS, clock.instant().plus(Duration.ofMinutes(24 * 60 + 30)), "Luis", null, null);
        doThrow(new IllegalStateException("provider down")).when(messenger).send(eq(ANA), anyString());

        AppointmentReminderJob.Report report = job.runOnce();

        assertThat(report).isEqualTo(new AppointmentReminderJob.Report(1, 0, 1));
        assertThat(schedule.get(ANA).orElseThrow().isReminderSent()).isFalse();
        assertThat(schedule.get(LUIS).orElseThrow().isReminderSent()).isTrue();
    }
}

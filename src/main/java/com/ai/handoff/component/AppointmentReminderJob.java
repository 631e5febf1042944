package com.ai.handoff.component;

import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.ScheduledAppointment;
import com.ai.handoff.service.AppointmentScheduleIndex;
import com.ai.handoff.service.OutboundMessenger;
import com.ai.handoff.store.StoreUnavailableException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Hourly sweep: reminders the day before a visit, follow-ups the day after a
 * completed one. One failing appointment does not stop the rest.
 */
@Component
public class AppointmentReminderJob {

    private static final Logger log = LoggerFactory.getLogger(AppointmentReminderJob.class);

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    static final String REMINDER_TEMPLATE =
            "¡Hola%s! Te recordamos tu visita de mañana a las %s. Responde CONFIRMAR para confirmarla.";
    static final String FOLLOWUP_TEMPLATE =
            "¡Hola%s! Esperamos que la visita al inmueble haya sido de tu agrado. "
                    + "¿Cómo calificarías tu experiencia del 1 al 5?";

    private final AppointmentScheduleIndex schedule;
    private final OutboundMessenger messenger;
    private final BusinessHours businessHours;

    @Value("${handoff.appointments.jobs-enabled:true}")
    private boolean enabled = true;

    public AppointmentReminderJob(AppointmentScheduleIndex schedule,
                                  OutboundMessenger messenger,
                                  BusinessHours businessHours) {
        this.schedule = schedule;
        this.messenger = messenger;
        this.businessHours = businessHours;
    }

    @Scheduled(cron = "${handoff.appointments.cron:0 0 * * * *}", zone = "${handoff.business.zone:America/Bogota}")
    public void run() {
        if (!enabled) {
            log.debug("Appointment jobs disabled; skipping");
            return;
        }
        try {
            Report report = runOnce();
            log.info("Appointment sweep: {} reminders, {} follow-ups, {} failures",
                    report.reminders(), report.followups(), report.failures());
        } catch (StoreUnavailableException e) {
            log.warn("Skipping appointment sweep, store unavailable: {}", e.getMessage());
        }
    }

    public Report runOnce() {
        int reminders = 0;
        int followups = 0;
        int failures = 0;

        List<ScheduledAppointment> dueReminders = schedule.dueForReminder();
        for (ScheduledAppointment appointment : dueReminders) {
            SessionRef ref = SessionRef.of(appointment.getIdentity(), appointment.getChannel());
            try {
                String time = appointment.getScheduledAt().atZone(businessHours.getZone()).format(TIME);
                messenger.send(ref, String.format(REMINDER_TEMPLATE, firstName(appointment), time));
                schedule.markReminderSent(ref);
                reminders++;
            } catch (RuntimeException e) {
                failures++;
                log.error("[{}] Reminder failed: {}", ref, e.getMessage(), e);
            }
        }

        List<ScheduledAppointment> dueFollowups = schedule.dueForFollowup();
        for (ScheduledAppointment appointment : dueFollowups) {
            SessionRef ref = SessionRef.of(appointment.getIdentity(), appointment.getChannel());
            try {
                messenger.send(ref, String.format(FOLLOWUP_TEMPLATE, firstName(appointment)));
                schedule.markFollowupSent(ref);
                followups++;
            } catch (RuntimeException e) {
                failures++;
                log.error("[{}] Follow-up failed: {}", ref, e.getMessage(), e);
            }
        }
        return new Report(reminders, followups, failures);
    }

    /** Leading space included so the greeting reads well without a name. */
    private static String firstName(ScheduledAppointment appointment) {
        String name = appointment.getContactName();
        if (StringUtils.isBlank(name)) {
            return "";
        }
        return " " + name.trim().split("\\s+")[0];
    }

    public record Report(int reminders, int followups, int failures) {
    }
}

package com.ai.handoff.component;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Office hours of the human team, in the business time zone.
 * Weekdays and Saturday have their own ranges; Sunday is closed.
 */
@Component
public class BusinessHours {

    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime weekdayOpen;
    private final LocalTime weekdayClose;
    private final LocalTime saturdayOpen;
    private final LocalTime saturdayClose;

    public BusinessHours(Clock clock,
                         @Value("${handoff.business.zone:America/Bogota}") String zone,
                         @Value("${handoff.business.weekday-open:08:30}") String weekdayOpen,
                         @Value("${handoff.business.weekday-close:17:00}") String weekdayClose,
                         @Value("${handoff.business.saturday-open:08:30}") String saturdayOpen,
                         @Value("${handoff.business.saturday-close:12:00}") String saturdayClose) {
        this.clock = clock;
        this.zone = ZoneId.of(zone);
        this.weekdayOpen = LocalTime.parse(weekdayOpen);
        this.weekdayClose = LocalTime.parse(weekdayClose);
        this.saturdayOpen = LocalTime.parse(saturdayOpen);
        this.saturdayClose = LocalTime.parse(saturdayClose);
    }

    public ZoneId getZone() {
        return zone;
    }

    public boolean isOpen() {
        return isOpen(clock.instant());
    }

    public boolean isOpen(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        LocalTime time = local.toLocalTime();
        DayOfWeek day = local.getDayOfWeek();
        if (day == DayOfWeek.SUNDAY) {
            return false;
        }
        if (day == DayOfWeek.SATURDAY) {
            return !time.isBefore(saturdayOpen) && time.isBefore(saturdayClose);
        }
        return !time.isBefore(weekdayOpen) && time.isBefore(weekdayClose);
    }
}

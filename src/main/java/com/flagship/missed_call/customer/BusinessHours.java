package com.flagship.missed_call.customer;

import lombok.Value;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Opening hours of a business in its own timezone.
 *
 * Days are ISO day numbers (1 = Monday .. 7 = Sunday). An end time before the
 * start time means the business is open across midnight.
 */
@Value
public class BusinessHours {
    ZoneId zone;
    LocalTime start;
    LocalTime end;
    Set<DayOfWeek> daysOpen;

    public static BusinessHours parse(String timezone, String start, String end, String daysOpen) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (daysOpen != null && !daysOpen.isBlank()) {
            Arrays.stream(daysOpen.split(","))
                .map(String::trim)
                .filter(day -> !day.isEmpty())
                .map(day -> DayOfWeek.of(Integer.parseInt(day)))
                .forEach(days::add);
        }
        return new BusinessHours(ZoneId.of(timezone), LocalTime.parse(start), LocalTime.parse(end), days);
    }

    public boolean isOpenAt(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        LocalTime time = local.toLocalTime();

        if (start.equals(end)) {
            return daysOpen.contains(local.getDayOfWeek());
        }
        if (start.isBefore(end)) {
            return daysOpen.contains(local.getDayOfWeek()) && !time.isBefore(start) && time.isBefore(end);
        }
        // Overnight: the early-morning part belongs to the previous day's shift
        if (!time.isBefore(start)) {
            return daysOpen.contains(local.getDayOfWeek());
        }
        return time.isBefore(end) && daysOpen.contains(local.getDayOfWeek().minus(1));
    }

    public String daysOpenAsString() {
        return daysOpen.stream()
            .sorted()
            .map(day -> String.valueOf(day.getValue()))
            .collect(Collectors.joining(","));
    }
}

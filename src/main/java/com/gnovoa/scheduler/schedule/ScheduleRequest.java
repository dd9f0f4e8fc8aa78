package com.gnovoa.scheduler.schedule;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything needed to lay out a league season.
 *
 * @param teamIds participating teams, already checked for eligibility by the caller
 * @param numberOfWeeks season length
 * @param startDate earliest game day
 * @param dayOfWeek game weekday, 0 = Sunday ... 6 = Saturday
 * @param courtIds available courts
 */
public record ScheduleRequest(
        List<String> teamIds,
        int numberOfWeeks,
        LocalDate startDate,
        int dayOfWeek,
        List<Integer> courtIds
) {}

package com.gnovoa.scheduler.api.dto;

import java.time.LocalDate;
import java.util.List;

/** Body of {@code POST /api/competitions/{id}/schedule}. {@code dayOfWeek}: 0 = Sunday ... 6 = Saturday. */
public record GenerateScheduleRequest(
        List<String> teams,
        LocalDate startDate,
        Integer dayOfWeek,
        Integer numberOfWeeks,
        List<Integer> courtIds
) {}

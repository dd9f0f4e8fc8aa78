package com.gnovoa.scheduler.api.dto;

import java.util.List;

public record GenerateScheduleResponse(
        String competitionId,
        int matchesCreated,
        int weeks,
        List<MatchResponse> matches
) {}

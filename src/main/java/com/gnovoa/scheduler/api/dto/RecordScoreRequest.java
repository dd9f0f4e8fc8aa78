package com.gnovoa.scheduler.api.dto;

public record RecordScoreRequest(Integer homeScore, Integer awayScore) {}

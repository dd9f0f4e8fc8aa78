package com.gnovoa.scheduler.api.dto;

public record ErrorResponse(String code, String message) {}

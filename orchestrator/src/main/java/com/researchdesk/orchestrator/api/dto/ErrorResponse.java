package com.researchdesk.orchestrator.api.dto;

/** Body of every 4xx answer produced by the API. */
public record ErrorResponse(int status, String error, String message) {}

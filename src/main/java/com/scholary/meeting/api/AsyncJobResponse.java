package com.scholary.meeting.api;

/** Response for an accepted meeting run; poll the status URL for the result. */
public record AsyncJobResponse(String jobId, String statusUrl) {}

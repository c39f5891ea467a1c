package com.cario.insight.app.model;

/** Returned by a submission: the job id and its initial status. */
public record JobHandle(String id, JobStatus status) {}

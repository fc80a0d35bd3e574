package dev.flowbridge.model;

/**
 * Pipeline immediately before and after one step.
 */
public record StepStates(PipelineState before, PipelineState after) {}

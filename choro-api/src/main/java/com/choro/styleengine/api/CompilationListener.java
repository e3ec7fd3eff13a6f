/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 *
 * <p>The compilation pipeline consists of 4 stages:
 * <ol>
 *   <li>PARSING - Read the JSON or SLD document</li>
 *   <li>VALIDATION - Check titles, filters, thresholds and colours</li>
 *   <li>MODEL_BUILDING - Build the immutable style sheet</li>
 *   <li>COVERAGE_ANALYSIS - Look for empty rules, gaps and overlaps</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * CompilationListener listener = new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d us%n", stageName, result.durationNanos() / 1_000);
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 * compiler.setCompilationListener(listener);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName   Name of the stage (e.g., "PARSING", "VALIDATION")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result    Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage fails.
     *
     * @param stageName Name of the stage that failed
     * @param error     The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName     Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics       Stage-specific metrics (e.g., "ruleCount", "gapCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {}
}

package dev.masterrecipe.model;

import java.util.List;

/**
 * Binds a process element ({@code stepId}) to a resource and the capabilities it uses for that step.
 */
public record Assignment(
    String stepId,
    String resource,
    List<String> capabilities,
    List<CapabilityDetail> capabilityDetails
) {}

package br.gov.controleprocessos.aggregates.process.services.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of a creation or transition: either the instances it touched (plus warnings
 * for degraded branches) or the reason it was rejected.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransitionResult(
        boolean accepted,
        List<ProcessInstanceView> instances,
        List<String> warnings,
        Rejection rejection
) {
    public static TransitionResult accepted(List<ProcessInstanceView> instances, List<String> warnings) {
        return new TransitionResult(true, List.copyOf(instances), List.copyOf(warnings), null);
    }

    public static TransitionResult accepted(ProcessInstanceView instance) {
        return accepted(List.of(instance), List.of());
    }

    public static TransitionResult rejected(Rejection rejection) {
        return new TransitionResult(false, List.of(), List.of(), rejection);
    }

    /**
     * First touched instance, the one the operation was addressed to.
     */
    public ProcessInstanceView primary() {
        return instances.isEmpty() ? null : instances.get(0);
    }
}

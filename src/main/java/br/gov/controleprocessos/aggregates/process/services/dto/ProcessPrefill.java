package br.gov.controleprocessos.aggregates.process.services.dto;

/**
 * Descriptive fields suggested for a new submission, taken from the most recently
 * updated matching instance.
 */
public record ProcessPrefill(
        String sourceInstanceId,
        String sourceCaseNumberDisplay,
        String subject,
        String stakeholder,
        String externalParty
) {}

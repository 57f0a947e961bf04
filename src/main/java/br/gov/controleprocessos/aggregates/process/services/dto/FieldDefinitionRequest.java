package br.gov.controleprocessos.aggregates.process.services.dto;

import br.gov.controleprocessos.aggregates.process.model.enums.FieldValueKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record FieldDefinitionRequest(
        @NotBlank String fieldKey,
        @NotBlank String label,
        @NotNull FieldValueKind valueKind
) {}

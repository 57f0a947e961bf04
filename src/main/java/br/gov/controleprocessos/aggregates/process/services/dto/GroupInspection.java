package br.gov.controleprocessos.aggregates.process.services.dto;

public record GroupInspection(GroupAnalysis analysis, ProcessPrefill prefill) {}

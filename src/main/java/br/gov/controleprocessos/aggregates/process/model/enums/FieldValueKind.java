package br.gov.controleprocessos.aggregates.process.model.enums;

public enum FieldValueKind {
    TEXT,
    NUMBER,
    DATE
}

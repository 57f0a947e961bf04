package br.gov.controleprocessos.aggregates.process.model;

import br.gov.controleprocessos.aggregates.process.model.enums.FieldValueKind;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Typed entry of a process instance's attribute bag. The value is kept in its canonical
 * string form (plain decimal for numbers, ISO date for dates).
 */
public record AttributeValue(FieldValueKind kind, String value) {

    public AttributeValue {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    public static AttributeValue text(String value) {
        return new AttributeValue(FieldValueKind.TEXT, value);
    }

    public static AttributeValue number(BigDecimal value) {
        return new AttributeValue(FieldValueKind.NUMBER, value.stripTrailingZeros().toPlainString());
    }

    public static AttributeValue date(LocalDate value) {
        return new AttributeValue(FieldValueKind.DATE, value.toString());
    }

    @JsonIgnore
    public BigDecimal asNumber() {
        return kind == FieldValueKind.NUMBER && value != null ? new BigDecimal(value) : null;
    }

    @JsonIgnore
    public LocalDate asDate() {
        return kind == FieldValueKind.DATE && value != null ? LocalDate.parse(value) : null;
    }

    @Override
    public String toString() {
        return value;
    }
}

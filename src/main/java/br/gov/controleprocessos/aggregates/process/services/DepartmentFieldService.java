package br.gov.controleprocessos.aggregates.process.services;

import br.gov.controleprocessos.aggregates.process.exceptions.ProcessConflictException;
import br.gov.controleprocessos.aggregates.process.exceptions.ProcessNotFoundException;
import br.gov.controleprocessos.aggregates.process.exceptions.ProcessValidationException;
import br.gov.controleprocessos.aggregates.process.model.AttributeValue;
import br.gov.controleprocessos.aggregates.process.model.DepartmentFieldDefinition;
import br.gov.controleprocessos.aggregates.process.model.ProcessInstance;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.FieldValueKind;
import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;
import br.gov.controleprocessos.aggregates.process.repositories.ProcessInstanceRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Manages the custom attributes departments record on their processes and validates
 * attribute values against them.
 */
@JBossLog
@ApplicationScoped
public class DepartmentFieldService {

    private static final DateTimeFormatter BRAZILIAN_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    @Inject
    ProcessInstanceRepository processRepository;

    @Transactional
    public DepartmentFieldDefinition define(Department department, String fieldKey, String label, FieldValueKind valueKind) {
        List<String> missing = new ArrayList<>();
        if (department == null) missing.add("department");
        if (fieldKey == null || fieldKey.isBlank()) missing.add("fieldKey");
        if (label == null || label.isBlank()) missing.add("label");
        if (valueKind == null) missing.add("valueKind");
        if (!missing.isEmpty()) {
            throw new ProcessValidationException(RejectionReason.MISSING_MANDATORY_FIELD, missing);
        }

        String key = fieldKey.trim();
        if (DepartmentFieldDefinition.findByDepartmentAndKey(department, key).isPresent()) {
            throw new ProcessConflictException(RejectionReason.DUPLICATE_FIELD_DEFINITION,
                    String.format("Field %s is already defined for %s", key, department), List.of(department));
        }

        DepartmentFieldDefinition definition = new DepartmentFieldDefinition();
        definition.setDepartment(department);
        definition.setFieldKey(key);
        definition.setLabel(label.trim());
        definition.setValueKind(valueKind);
        definition.persist();

        log.infof("Defined field %s (%s) for %s", key, valueKind, department);
        return definition;
    }

    @Transactional(Transactional.TxType.SUPPORTS)
    public List<DepartmentFieldDefinition> list(Department department) {
        return DepartmentFieldDefinition.findByDepartment(department);
    }

    /**
     * Deletes a definition and purges its key from every attribute bag, unless another
     * department still defines the same key.
     *
     * @return number of process instances whose attribute bag was purged
     */
    @Transactional
    public int delete(Department department, String fieldKey) {
        String key = fieldKey == null ? "" : fieldKey.trim();
        DepartmentFieldDefinition definition = DepartmentFieldDefinition.findByDepartmentAndKey(department, key)
                .orElseThrow(() -> new ProcessNotFoundException(RejectionReason.FIELD_DEFINITION_NOT_FOUND,
                        String.format("No field %s defined for %s", key, department)));
        definition.delete();

        if (DepartmentFieldDefinition.countByKey(key) > 0) {
            log.infof("Deleted field %s of %s; key still defined elsewhere, attribute bags kept", key, department);
            return 0;
        }

        int purged = 0;
        for (ProcessInstance instance : processRepository.findWithAttributeKey(key)) {
            Map<String, AttributeValue> attributes = instance.getAttributes();
            if (attributes.remove(key) != null) {
                instance.setAttributes(attributes);
                purged++;
            }
        }
        log.infof("Deleted field %s of %s; purged from %d process(es)", key, department, purged);
        return purged;
    }

    /**
     * Converts raw attribute strings into typed values using the department's definitions.
     * A blank raw value maps to {@code null}, meaning "remove the attribute".
     *
     * @throws ProcessValidationException listing every unknown key and malformed value
     */
    @Transactional(Transactional.TxType.SUPPORTS)
    public Map<String, AttributeValue> validateAttributes(Department department, Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, DepartmentFieldDefinition> definitions = DepartmentFieldDefinition.findByDepartment(department)
                .stream()
                .collect(Collectors.toMap(DepartmentFieldDefinition::getFieldKey, Function.identity()));

        Map<String, AttributeValue> typed = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, String> entry : new TreeMap<>(raw).entrySet()) {
            String key = entry.getKey();
            DepartmentFieldDefinition definition = definitions.get(key);
            if (definition == null) {
                errors.add(key + " (not defined for " + department + ")");
                continue;
            }
            String value = entry.getValue();
            if (value == null || value.isBlank()) {
                typed.put(key, null);
                continue;
            }
            try {
                typed.put(key, convert(definition.getValueKind(), value.trim()));
            } catch (NumberFormatException | DateTimeParseException e) {
                errors.add(key + " (not a valid " + definition.getValueKind().name().toLowerCase(Locale.ROOT) + ": " + value + ")");
            }
        }

        if (!errors.isEmpty()) {
            log.warnf("Rejected attributes for %s: %s", department, errors);
            throw new ProcessValidationException(RejectionReason.INVALID_ATTRIBUTE, errors);
        }
        return typed;
    }

    private static AttributeValue convert(FieldValueKind kind, String value) {
        return switch (kind) {
            case TEXT -> AttributeValue.text(value);
            case NUMBER -> AttributeValue.number(new BigDecimal(value.replace(',', '.')));
            case DATE -> AttributeValue.date(parseDate(value));
        };
    }

    static LocalDate parseDate(String value) {
        if (value.indexOf('/') > 0) {
            return LocalDate.parse(value, BRAZILIAN_DATE);
        }
        return LocalDate.parse(value);
    }
}

package br.gov.controleprocessos.aggregates.process.model;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.FieldValueKind;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Custom attribute a department records on its processes. Lives independently of any
 * process instance.
 */
@Data
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@Entity
@Table(
    name = "department_field_definitions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_field_department_key", columnNames = {"department", "field_key"})
    }
)
public class DepartmentFieldDefinition extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @EqualsAndHashCode.Include
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "department", nullable = false, length = 20)
    private Department department;

    @Column(name = "field_key", nullable = false, length = 60)
    private String fieldKey;

    @Column(name = "label", nullable = false, length = 150)
    private String label;

    @Enumerated(EnumType.STRING)
    @Column(name = "value_kind", nullable = false, length = 10)
    private FieldValueKind valueKind;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt = LocalDateTime.now();

    public static List<DepartmentFieldDefinition> findByDepartment(Department department) {
        return list("department = ?1 ORDER BY fieldKey", department);
    }

    public static Optional<DepartmentFieldDefinition> findByDepartmentAndKey(Department department, String fieldKey) {
        return find("department = ?1 AND fieldKey = ?2", department, fieldKey).firstResultOptional();
    }

    public static long countByKey(String fieldKey) {
        return count("fieldKey", fieldKey);
    }
}

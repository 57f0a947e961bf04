package br.gov.controleprocessos.aggregates.process.model;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Department grant held by a person who may be assigned to processes. Coordination and
 * team narrow the grant when set.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@Entity
@Table(name = "assignee_grants", indexes = @Index(name = "idx_grant_user", columnList = "user_ref"))
public class AssigneeGrant extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @EqualsAndHashCode.Include
    private Long id;

    @Column(name = "user_ref", nullable = false, length = 100)
    private String userRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "department", nullable = false, length = 20)
    private Department department;

    @Column(name = "coordination", length = 100)
    private String coordination;

    @Column(name = "team", length = 100)
    private String team;

    public AssigneeGrant(String userRef, Department department, String coordination, String team) {
        this.userRef = userRef;
        this.department = department;
        this.coordination = coordination;
        this.team = team;
    }

    public static List<AssigneeGrant> findByUserRef(String userRef) {
        return list("userRef", userRef);
    }
}

package br.gov.controleprocessos.aggregates.process.services;

import br.gov.controleprocessos.aggregates.process.model.AssigneeGrant;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

/**
 * Reads grants from the {@code assignee_grants} table.
 */
@ApplicationScoped
public class GrantTableAssigneeDirectory implements AssigneeDirectory {

    @Override
    public List<AssigneeGrant> findGrants(String userRef) {
        if (userRef == null || userRef.isBlank()) {
            return List.of();
        }
        return AssigneeGrant.findByUserRef(userRef.trim());
    }
}

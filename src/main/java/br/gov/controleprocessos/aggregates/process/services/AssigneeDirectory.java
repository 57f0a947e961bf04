package br.gov.controleprocessos.aggregates.process.services;

import br.gov.controleprocessos.aggregates.process.model.AssigneeGrant;

import java.util.List;

/**
 * Source of the department grants held by people who may be assigned to processes.
 */
public interface AssigneeDirectory {

    /**
     * @return every grant of the person, empty when unknown
     */
    List<AssigneeGrant> findGrants(String userRef);
}

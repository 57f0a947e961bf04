package br.gov.controleprocessos.aggregates.process.services.dto;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;

import java.util.List;

/**
 * What already exists for a base case number.
 *
 * @param caseNumberBase    canonical number the analysis was made for
 * @param activeCount       instances not closed
 * @param finalizedCount    closed instances
 * @param activeDepartments departments holding an active instance, in routing order
 * @param relationalKey     canonical key, or {@code null} when none or when keys conflict
 * @param keyConflict       active instances carry more than one distinct key
 * @param conflictingKeys   the distinct keys seen when {@code keyConflict} is set
 */
public record GroupAnalysis(
        String caseNumberBase,
        int activeCount,
        int finalizedCount,
        List<Department> activeDepartments,
        String relationalKey,
        boolean keyConflict,
        List<String> conflictingKeys
) {
    public boolean hasHistory() {
        return activeCount > 0 || finalizedCount > 0;
    }

    public boolean onlyFinalizedHistory() {
        return activeCount == 0 && finalizedCount > 0;
    }
}

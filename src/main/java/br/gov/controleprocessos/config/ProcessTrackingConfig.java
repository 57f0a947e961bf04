package br.gov.controleprocessos.config;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routing configuration for the process tracking core.
 *
 * Loaded once at startup; department codes and status vocabularies are fixed
 * configuration data, not part of the tracked state.
 */
@ConfigMapping(prefix = "process-tracking")
public interface ProcessTrackingConfig {

    /**
     * Department an INTAKE synonym resolves to when the caller does not accept the
     * pseudo-department itself.
     */
    @WithDefault("GEPLAN")
    Department defaultDepartment();

    /**
     * Per-department settings keyed by department code.
     */
    Map<String, DepartmentSettings> departments();

    TimelineConfig timeline();

    interface DepartmentSettings {
        /**
         * Allowed status codes. A department without a list accepts any non-blank status.
         */
        Optional<List<String>> statuses();
    }

    interface TimelineConfig {
        /**
         * Width of the timestamp bucket used to collapse duplicated ledger lines.
         */
        @WithDefault("60")
        int dedupBucketSeconds();
    }
}

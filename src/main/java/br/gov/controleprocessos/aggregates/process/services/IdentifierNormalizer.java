package br.gov.controleprocessos.aggregates.process.services;

import br.gov.controleprocessos.aggregates.process.exceptions.ProcessValidationException;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;
import br.gov.controleprocessos.config.ProcessTrackingConfig;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.text.Normalizer;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Turns free-form case numbers, department names and status codes into their canonical
 * forms.
 *
 * Case numbers are stored as {@code DEPARTMENT-base}; the base number is what groups
 * instances together, so prefix stripping only ever removes a token that is itself a
 * department.
 */
@ApplicationScoped
public class IdentifierNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[^A-Z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, Department> VOCABULARY = buildVocabulary();

    @Inject
    ProcessTrackingConfig config;

    private Map<Department, Set<String>> allowedStatuses = Map.of();

    public IdentifierNormalizer() {
    }

    public IdentifierNormalizer(ProcessTrackingConfig config) {
        this.config = config;
        init();
    }

    @PostConstruct
    void init() {
        this.allowedStatuses = buildStatusCatalog(config);
    }

    /**
     * Resolves a department, mapping INTAKE synonyms to the configured default department.
     */
    public Department normalizeDepartment(String raw) {
        return normalizeDepartment(raw, false);
    }

    /**
     * Resolves a department from a code, name or synonym, possibly embedded in a longer
     * string ("GEPLAN - DOP" resolves to the right-most unit, DOP).
     *
     * @param raw         free-form department text
     * @param allowIntake when false an INTAKE synonym resolves to the default department
     * @return the department, or {@code null} when nothing matches
     */
    public Department normalizeDepartment(String raw, boolean allowIntake) {
        String canonical = canonicalText(raw);
        if (canonical.isEmpty()) {
            return null;
        }

        Department match = VOCABULARY.get(canonical);
        if (match == null) {
            match = matchEmbedded(canonical);
        }
        if (match == Department.INTAKE && !allowIntake) {
            return config.defaultDepartment();
        }
        return match;
    }

    /**
     * Strips one leading {@code DEPARTMENT-} prefix, and only when the token before the
     * first hyphen is exactly a department. Everything else is kept, so numbers such as
     * {@code 2024-0012} survive untouched.
     */
    public String extractBaseCaseNumber(String raw) {
        String compact = raw == null ? "" : WHITESPACE.matcher(raw.trim()).replaceAll("").toUpperCase(Locale.ROOT);
        if (compact.isEmpty()) {
            throw new ProcessValidationException(RejectionReason.INVALID_CASE_NUMBER, "Case number is blank");
        }

        int hyphen = compact.indexOf('-');
        if (hyphen <= 0) {
            return compact;
        }

        String prefix = compact.substring(0, hyphen);
        if (VOCABULARY.containsKey(canonicalText(prefix))) {
            String rest = compact.substring(hyphen + 1);
            if (rest.isEmpty()) {
                throw new ProcessValidationException(RejectionReason.INVALID_CASE_NUMBER,
                        "Case number has a department prefix but no number: " + raw);
            }
            return rest;
        }
        return compact;
    }

    public String displayCaseNumber(Department department, String caseNumberBase) {
        return department.name() + "-" + caseNumberBase;
    }

    /**
     * Canonical status code for a department.
     *
     * @return the canonical status, or {@code null} for blank input
     * @throws ProcessValidationException if the department restricts its statuses and the
     *                                    value is not one of them
     */
    public String normalizeStatus(Department department, String raw) {
        String canonical = stripAccents(raw).trim().toUpperCase(Locale.ROOT);
        canonical = WHITESPACE.matcher(canonical).replaceAll("_");
        if (canonical.isEmpty()) {
            return null;
        }
        Set<String> allowed = allowedStatuses.get(department);
        if (allowed != null && !allowed.isEmpty() && !allowed.contains(canonical)) {
            throw new ProcessValidationException(RejectionReason.INVALID_STATUS,
                    String.format("Status %s is not allowed in %s (allowed: %s)", canonical, department, allowed));
        }
        return canonical;
    }

    /**
     * Accent-stripped, upper-cased text with every run of separators collapsed to a space.
     */
    static String canonicalText(String raw) {
        String upper = stripAccents(raw).toUpperCase(Locale.ROOT);
        return SEPARATORS.matcher(upper).replaceAll(" ").trim();
    }

    static String stripAccents(String raw) {
        if (raw == null) {
            return "";
        }
        return DIACRITICS.matcher(Normalizer.normalize(raw, Normalizer.Form.NFD)).replaceAll("");
    }

    private Department matchEmbedded(String canonical) {
        // a single-token match wins; multi-word names are the fallback, longest first
        Department phraseMatch = null;
        int phraseLength = 0;
        String padded = " " + canonical + " ";
        for (Map.Entry<String, Department> entry : VOCABULARY.entrySet()) {
            String phrase = entry.getKey();
            if (phrase.indexOf(' ') > 0 && phrase.length() > phraseLength && padded.contains(" " + phrase + " ")) {
                phraseMatch = entry.getValue();
                phraseLength = phrase.length();
            }
        }

        Department tokenMatch = null;
        for (String token : canonical.split(" ")) {
            Department candidate = VOCABULARY.get(token);
            if (candidate != null) {
                tokenMatch = candidate;
            }
        }
        return tokenMatch != null ? tokenMatch : phraseMatch;
    }

    private static Map<String, Department> buildVocabulary() {
        Map<String, Department> words = new HashMap<>();
        for (Department department : Department.values()) {
            words.put(canonicalText(department.name()), department);
            words.put(canonicalText(department.getDisplayName()), department);
            for (String synonym : department.getSynonyms()) {
                words.put(canonicalText(synonym), department);
            }
        }
        return Collections.unmodifiableMap(words);
    }

    private static Map<Department, Set<String>> buildStatusCatalog(ProcessTrackingConfig config) {
        Map<Department, Set<String>> catalog = new EnumMap<>(Department.class);
        config.departments().forEach((code, settings) -> {
            Department department = Department.valueOf(code.trim().toUpperCase(Locale.ROOT));
            Set<String> statuses = new LinkedHashSet<>();
            settings.statuses().orElse(List.of()).forEach(status -> {
                String canonical = WHITESPACE.matcher(stripAccents(status).trim().toUpperCase(Locale.ROOT)).replaceAll("_");
                if (!canonical.isEmpty()) {
                    statuses.add(canonical);
                }
            });
            catalog.put(department, Collections.unmodifiableSet(statuses));
        });
        return catalog;
    }
}

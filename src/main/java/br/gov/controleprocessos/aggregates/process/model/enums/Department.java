package br.gov.controleprocessos.aggregates.process.model.enums;

import java.util.List;

/**
 * Routing vocabulary for process instances.
 *
 * Concrete departments are declared in routing order. INTAKE and OUTBOUND_REVIEW are
 * pseudo-departments a process may sit in; CLOSED only ever appears as the target of a
 * global finalization event in the movement ledger.
 */
public enum Department {

    GEPLAN("Gerencia de Planejamento", Kind.CONCRETE, List.of("PLANEJAMENTO")),
    DOP("Divisao de Orcamento e Programacao", Kind.CONCRETE, List.of("ORCAMENTO")),
    GEFIN("Gerencia Financeira", Kind.CONCRETE, List.of("FINANCEIRO", "FINANCEIRA")),
    ASJUR("Assessoria Juridica", Kind.CONCRETE, List.of("JURIDICO", "JURIDICA")),
    GECOMP("Gerencia de Compras", Kind.CONCRETE, List.of("COMPRAS")),
    GABINETE("Gabinete", Kind.CONCRETE, List.of("GAB")),

    INTAKE("Entrada", Kind.PSEUDO, List.of("ENTRADA", "PROTOCOLO", "TRIAGEM")),
    OUTBOUND_REVIEW("Revisao de Saida", Kind.PSEUDO, List.of("SAIDA", "REVISAO DE SAIDA", "OUTBOUND REVIEW")),
    CLOSED("Encerrado", Kind.LEDGER_ONLY, List.of("ENCERRADO", "FINALIZADO", "ARQUIVADO"));

    public enum Kind { CONCRETE, PSEUDO, LEDGER_ONLY }

    private final String displayName;
    private final Kind kind;
    private final List<String> synonyms;

    Department(String displayName, Kind kind, List<String> synonyms) {
        this.displayName = displayName;
        this.kind = kind;
        this.synonyms = synonyms;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getSynonyms() {
        return synonyms;
    }

    public boolean isConcrete() {
        return kind == Kind.CONCRETE;
    }

    /**
     * Departments a process instance may currently sit in.
     */
    public boolean isOccupiable() {
        return kind != Kind.LEDGER_ONLY;
    }
}

package com.survey.codeframe.brand;

import java.util.List;

public record KnowledgeGraphEvidence(
        String query,
        List<KnowledgeGraphEntity> entities,
        KnowledgeGraphVerdict verdict
) implements TierEvidence {

    @Override
    public EvidenceTier tier() {
        return EvidenceTier.KNOWLEDGE_GRAPH;
    }

    @Override
    public double positive() {
        return switch (verdict.severity()) {
            case OK -> 1.0;
            case WARNING -> KnowledgeGraphVerdict.CATEGORY_UNCONFIRMED.equals(verdict.code()) ? 0.5 : 0.0;
            case ERROR -> 0.0;
        };
    }

    @Override
    public double negative() {
        return verdict.isError() ? 1.0 : 0.0;
    }

    @Override
    public String summary() {
        return verdict.message();
    }
}

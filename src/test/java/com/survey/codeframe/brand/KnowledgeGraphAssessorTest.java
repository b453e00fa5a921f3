package com.survey.codeframe.brand;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeGraphAssessorTest {

    private KnowledgeGraphAssessor assessor;

    @BeforeEach
    void setUp() {
        assessor = new KnowledgeGraphAssessor();
    }

    private KnowledgeGraphEntity entity(String name, List<String> types, String description, String detailed) {
        return new KnowledgeGraphEntity(name, types, description, detailed, 1000.0);
    }

    @Test
    void testBrandInExpectedCategoryIsVerified() {
        KnowledgeGraphEntity colgate = entity("Colgate", List.of("Thing", "Brand"),
                "Brand of oral hygiene products", "Colgate is a brand of toothpaste produced by Colgate-Palmolive.");

        KnowledgeGraphVerdict verdict = assessor.assess("Colgate", List.of("colgate"), "Toothpaste", List.of(colgate));

        assertEquals(IssueSeverity.OK, verdict.severity());
        assertEquals(KnowledgeGraphVerdict.VERIFIED, verdict.code());
        assertEquals("Colgate", verdict.matchedEntity());
        assertEquals("Brand", verdict.entityType());
        assertEquals("Toothpaste", verdict.foundCategory());
        assertFalse(verdict.isError());
    }

    @Test
    void testPlaceIsWrongEntity() {
        KnowledgeGraphEntity paris = entity("Paris", List.of("Place", "City"), "Capital of France", null);

        KnowledgeGraphVerdict verdict = assessor.assess("Paris", List.of(), "Toothpaste", List.of(paris));

        assertTrue(verdict.isError());
        assertEquals(KnowledgeGraphVerdict.WRONG_ENTITY, verdict.code());
        assertEquals("Place", verdict.entityType());
    }

    @Test
    void testBrandWithAnotherNameIsWrongEntity() {
        KnowledgeGraphEntity colgate = entity("Colgate", List.of("Brand"), "Toothpaste brand", null);

        KnowledgeGraphVerdict verdict = assessor.assess("Sensodyne", List.of(), "Toothpaste", List.of(colgate));

        assertTrue(verdict.isError());
        assertEquals(KnowledgeGraphVerdict.WRONG_ENTITY, verdict.code());
        assertEquals("Colgate", verdict.matchedEntity());
    }

    @Test
    void testBrandFromAnotherCategoryIsMismatch() {
        KnowledgeGraphEntity corona = entity("Corona", List.of("Brand"), "Beer brand", "Corona is a Mexican beer.");

        KnowledgeGraphVerdict verdict = assessor.assess("Corona", List.of(), "Toothpaste", List.of(corona));

        assertTrue(verdict.isError());
        assertEquals(KnowledgeGraphVerdict.CATEGORY_MISMATCH, verdict.code());
        assertEquals("Beer", verdict.foundCategory());
    }

    @Test
    void testRelatedCategoryCountsAsMatch() {
        KnowledgeGraphEntity oralB = entity("Oral-B", List.of("Brand"), "Oral care brand", null);

        KnowledgeGraphVerdict verdict = assessor.assess("Oral B", List.of(), "Toothbrush", List.of(oralB));

        assertEquals(IssueSeverity.OK, verdict.severity());
        assertEquals("Oral care", verdict.foundCategory());
    }

    @Test
    void testCompanyWithoutCategoryIsUnconfirmed() {
        KnowledgeGraphEntity acme = entity("Acme", List.of("Corporation"), "American company", null);

        KnowledgeGraphVerdict verdict = assessor.assess("Acme", List.of(), "Toothpaste", List.of(acme));

        assertEquals(IssueSeverity.WARNING, verdict.severity());
        assertEquals(KnowledgeGraphVerdict.CATEGORY_UNCONFIRMED, verdict.code());
        assertEquals("Company", verdict.entityType());
    }

    @Test
    void testNoEntitiesIsNotFoundWarning() {
        KnowledgeGraphVerdict verdict = assessor.assess("Zyxbrite", List.of(), "Toothpaste", List.of());

        assertEquals(IssueSeverity.WARNING, verdict.severity());
        assertEquals(KnowledgeGraphVerdict.NOT_FOUND, verdict.code());
    }

    @Test
    void testMissingExpectedCategoryStillVerifies() {
        KnowledgeGraphEntity colgate = entity("Colgate", List.of("Brand"), "Toothpaste brand", null);

        KnowledgeGraphVerdict verdict = assessor.assess("Colgate", List.of(), null, List.of(colgate));

        assertEquals(IssueSeverity.OK, verdict.severity());
    }
}

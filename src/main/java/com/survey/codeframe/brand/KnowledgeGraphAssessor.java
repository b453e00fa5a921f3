package com.survey.codeframe.brand;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns knowledge-graph entities into a verdict for one brand candidate.
 * <ul>
 *   <li>ERROR {@code WRONG_ENTITY}: nothing brand-like came back (only places, people, events...)
 *       or the brand-like entity has a different name.</li>
 *   <li>ERROR {@code CATEGORY_MISMATCH}: the entity is verified but its description places it in a
 *       different known product category.</li>
 *   <li>WARNING {@code NOT_FOUND} / {@code CATEGORY_UNCONFIRMED}.</li>
 *   <li>OK otherwise.</li>
 * </ul>
 */
@Component
public class KnowledgeGraphAssessor {

    static final Set<String> REJECTED_TYPES = Set.of(
            "Event", "Location", "Place", "Person", "SportsEvent", "Organization", "Thing");

    static final Set<String> ACCEPTED_TYPES = Set.of("Brand", "Company", "Retail", "Product");

    // description keyword → product category
    private static final Map<String, String> KNOWN_CATEGORIES = knownCategories();

    private static final Map<String, List<String>> RELATED_CATEGORIES = Map.of(
            "toothpaste", List.of("healthcare", "dental", "oral care"),
            "toothbrush", List.of("healthcare", "dental", "oral care"),
            "mouthwash", List.of("healthcare", "dental", "oral care"),
            "soap", List.of("personal care", "hygiene"),
            "shampoo", List.of("personal care", "cosmetics", "beauty"),
            "deodorant", List.of("personal care", "cosmetics", "beauty"),
            "beer", List.of("beverage", "brewery", "drink"),
            "soft drink", List.of("beverage", "drink"),
            "coffee", List.of("beverage", "drink"));

    public KnowledgeGraphVerdict assess(String candidate, List<String> variants, String expectedCategory,
                                        List<KnowledgeGraphEntity> entities) {
        if (entities == null || entities.isEmpty()) {
            return new KnowledgeGraphVerdict(IssueSeverity.WARNING, KnowledgeGraphVerdict.NOT_FOUND,
                    "'" + candidate + "' not found in the knowledge graph", null, null, null);
        }

        List<String> names = new ArrayList<>();
        names.add(candidate);
        if (variants != null) {
            names.addAll(variants);
        }

        KnowledgeGraphEntity acceptable = null;
        String acceptableType = null;
        for (KnowledgeGraphEntity entity : entities) {
            String type = entityType(entity);
            if (!ACCEPTED_TYPES.contains(type)) {
                continue;
            }
            if (acceptable == null) {
                acceptable = entity;
                acceptableType = type;
            }
            if (nameMatches(entity.name(), names)) {
                return checkCategory(entity, type, expectedCategory);
            }
        }

        if (acceptable == null) {
            KnowledgeGraphEntity top = entities.get(0);
            String type = entityType(top);
            return new KnowledgeGraphVerdict(IssueSeverity.ERROR, KnowledgeGraphVerdict.WRONG_ENTITY,
                    String.format("'%s' resolves to '%s' (%s), not a brand", candidate, top.name(), type),
                    top.name(), type, null);
        }
        return new KnowledgeGraphVerdict(IssueSeverity.ERROR, KnowledgeGraphVerdict.WRONG_ENTITY,
                String.format("Closest brand entity is '%s', a different name from '%s'", acceptable.name(), candidate),
                acceptable.name(), acceptableType, extractCategory(descriptionOf(acceptable)));
    }

    private KnowledgeGraphVerdict checkCategory(KnowledgeGraphEntity entity, String type, String expectedCategory) {
        String description = descriptionOf(entity);
        String found = extractCategory(description);

        if (expectedCategory == null || expectedCategory.isBlank()) {
            return new KnowledgeGraphVerdict(IssueSeverity.OK, KnowledgeGraphVerdict.VERIFIED,
                    String.format("Verified as '%s' (%s)", entity.name(), type), entity.name(), type, found);
        }
        if (categoryMatches(found, description, expectedCategory)) {
            return new KnowledgeGraphVerdict(IssueSeverity.OK, KnowledgeGraphVerdict.VERIFIED,
                    String.format("Verified as '%s' (%s), category matches", entity.name(), type),
                    entity.name(), type, found);
        }
        if (found != null) {
            return new KnowledgeGraphVerdict(IssueSeverity.ERROR, KnowledgeGraphVerdict.CATEGORY_MISMATCH,
                    String.format("'%s' is a %s brand, expected %s", entity.name(), found, expectedCategory),
                    entity.name(), type, found);
        }
        return new KnowledgeGraphVerdict(IssueSeverity.WARNING, KnowledgeGraphVerdict.CATEGORY_UNCONFIRMED,
                String.format("'%s' exists (%s) but its category could not be confirmed", entity.name(), type),
                entity.name(), type, null);
    }

    static String entityType(KnowledgeGraphEntity entity) {
        List<String> types = entity.types() == null ? List.of() : entity.types();
        List<String> lower = types.stream().map(t -> t.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
        String description = descriptionOf(entity).toLowerCase(Locale.ROOT);

        if (lower.contains("brand") || description.contains("brand")) {
            return "Brand";
        }
        if (lower.contains("corporation") || lower.contains("company")
                || (lower.contains("organization") && description.contains("company"))) {
            return description.contains("retail") || description.contains("store") ? "Retail" : "Company";
        }
        if (lower.contains("product") || description.contains("product")) {
            return "Product";
        }
        for (String type : types) {
            if (REJECTED_TYPES.contains(type)) {
                return type;
            }
        }
        return types.isEmpty() ? "Thing" : types.get(0);
    }

    static boolean categoryMatches(String found, String description, String expectedCategory) {
        String expected = expectedCategory.toLowerCase(Locale.ROOT).trim();
        String desc = description.toLowerCase(Locale.ROOT);

        for (String keyword : keywords(expected)) {
            if (desc.contains(keyword)) {
                return true;
            }
        }
        if (found == null) {
            return false;
        }
        String foundLower = found.toLowerCase(Locale.ROOT);
        if (expected.contains(foundLower) || foundLower.contains(expected)) {
            return true;
        }
        for (Map.Entry<String, List<String>> related : RELATED_CATEGORIES.entrySet()) {
            if (expected.contains(related.getKey())
                    && related.getValue().stream().anyMatch(foundLower::contains)) {
                return true;
            }
        }
        return false;
    }

    static String extractCategory(String description) {
        String desc = description == null ? "" : description.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : KNOWN_CATEGORIES.entrySet()) {
            if (desc.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static boolean nameMatches(String entityName, List<String> names) {
        String entity = normalize(entityName);
        if (entity.isEmpty()) {
            return false;
        }
        for (String name : names) {
            String candidate = normalize(name);
            if (candidate.isEmpty()) {
                continue;
            }
            if (entity.equals(candidate) || entity.startsWith(candidate) || candidate.startsWith(entity)) {
                return true;
            }
        }
        return false;
    }

    // category words of at least four letters, with a naive plural strip ("toothpastes" → "toothpaste")
    private static List<String> keywords(String expected) {
        List<String> words = new ArrayList<>();
        for (String word : expected.split("[^\\p{L}\\p{N}]+")) {
            if (word.length() < 4 || word.equals("brand") || word.equals("brands")) {
                continue;
            }
            words.add(word.endsWith("s") && word.length() > 4 ? word.substring(0, word.length() - 1) : word);
        }
        return words;
    }

    private static String descriptionOf(KnowledgeGraphEntity entity) {
        String description = entity.description() == null ? "" : entity.description();
        String detailed = entity.detailedDescription() == null ? "" : entity.detailedDescription();
        return (description + " " + detailed).trim();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
    }

    private static Map<String, String> knownCategories() {
        Map<String, String> categories = new LinkedHashMap<>();
        categories.put("toothpaste", "Toothpaste");
        categories.put("toothbrush", "Toothbrush");
        categories.put("mouthwash", "Mouthwash");
        categories.put("soap", "Soap");
        categories.put("shampoo", "Shampoo");
        categories.put("deodorant", "Deodorant");
        categories.put("cosmetic", "Cosmetics");
        categories.put("electronics", "Electronics");
        categories.put("technology", "Technology");
        categories.put("software", "Technology");
        categories.put("automobile", "Automotive");
        categories.put("car manufacturer", "Automotive");
        categories.put("beer", "Beer");
        categories.put("brewery", "Beer");
        categories.put("soft drink", "Soft drink");
        categories.put("coffee", "Coffee");
        categories.put("beverage", "Beverage");
        categories.put("food", "Food");
        categories.put("clothing", "Clothing");
        categories.put("apparel", "Clothing");
        categories.put("healthcare", "Healthcare");
        categories.put("oral care", "Oral care");
        categories.put("retail", "Retail");
        return categories;
    }
}

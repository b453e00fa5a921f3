package com.survey.codeframe.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.clustering.AnswerCluster;
import com.survey.codeframe.clustering.ClusteringResult;
import com.survey.codeframe.clustering.HdbscanClusterer;
import com.survey.codeframe.config.AlgorithmConfig;
import com.survey.codeframe.config.CodeframeProperties;
import com.survey.codeframe.entity.Category;
import com.survey.codeframe.entity.CodingType;
import com.survey.codeframe.entity.ConfidenceLevel;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.entity.NodeType;
import com.survey.codeframe.exception.LabelingException;
import com.survey.codeframe.hierarchy.ClusterLabel;
import com.survey.codeframe.hierarchy.ClusterLabeler;
import com.survey.codeframe.hierarchy.HierarchyTree;
import com.survey.codeframe.hierarchy.LabelingRequest;
import com.survey.codeframe.util.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

/**
 * Turns answer clusters into a category → theme → code (→ subcode) tree.
 * <p>
 * Pass 1 labels every cluster as a code. Pass 2 clusters the code centroids with coarser
 * parameters and labels each group as a theme; codes the theme pass leaves as noise (or all
 * codes, when it finds nothing) share one extra theme.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HierarchyBuilderService {

    private static final int MAX_VARIANTS = 10;

    private final ClusterLabeler labeler;
    private final CodeframeProperties properties;
    private final ObjectMapper objectMapper;

    public HierarchyTree build(BuildInput input) {
        return build(input, done -> { });
    }

    /**
     * @param onCodeLabeled called with the number of clusters labeled so far
     */
    public HierarchyTree build(BuildInput input, IntConsumer onCodeLabeled) {
        AlgorithmConfig config = input.config();
        List<AnswerCluster> clusters = input.clustering().clusters();

        List<StagedCode> codes = new ArrayList<>();
        for (AnswerCluster cluster : clusters) {
            codes.add(labelCode(cluster, input));
            onCodeLabeled.accept(codes.size());
        }
        log.info("Labeled {} codes for generation {}", codes.size(), input.generationId());

        List<List<StagedCode>> groups = groupIntoThemes(codes, config);

        HierarchyTree tree = new HierarchyTree();
        int clustered = clusters.stream().mapToInt(AnswerCluster::size).sum();
        HierarchyNode root = tree.add(baseNode(input.generationId(), NodeType.CATEGORY, null)
                .name(input.category().getName())
                .description(input.category().getDescription())
                .clusterSize(clustered)
                .build());

        for (List<StagedCode> group : groups) {
            HierarchyNode theme = tree.add(labelTheme(group, root.getId(), input));
            for (StagedCode code : group) {
                code.node().setParentId(theme.getId());
                tree.add(code.node());
                for (HierarchyNode subcode : code.subcodes()) {
                    subcode.setParentId(code.node().getId());
                    tree.add(subcode);
                }
            }
        }

        tree.applyDisplayOrder();
        tree.validate();
        log.info("Hierarchy built: {} themes, {} codes, {} nodes total",
                groups.size(), codes.size(), tree.size());
        return tree;
    }

    private StagedCode labelCode(AnswerCluster cluster, BuildInput input) {
        List<String> examples = exampleTexts(cluster, input.answerTexts());
        ClusterLabel label = labeler.label(new LabelingRequest(
                LabelingRequest.Target.CODE,
                input.category().getName(),
                input.category().getDescription(),
                input.codingType(),
                examples,
                cluster.size(),
                input.config().labelingModel()), input.usageContext());

        String name = requireName(label, "cluster " + cluster.clusterId());
        HierarchyNode node = baseNode(input.generationId(), NodeType.CODE, null)
                .name(name)
                .description(label.description())
                .clusterId(cluster.clusterId())
                .clusterSize(cluster.size())
                .representativeAnswerIds(new ArrayList<>(cluster.representativeAnswerIds()))
                .memberAnswerIds(new ArrayList<>(cluster.memberAnswerIds()))
                .confidence(parseLevel(label.confidence(), "confidence", name))
                .frequencyEstimate(parseLevel(label.frequencyEstimate(), "frequency_estimate", name))
                .embedding(cluster.centroid())
                .exampleTexts(exampleJson(cluster.representativeAnswerIds(), input.answerTexts()))
                .variants(input.codingType() == CodingType.BRAND
                        ? variants(name, cluster.memberAnswerIds(), input.answerTexts())
                        : new ArrayList<>())
                .build();

        List<HierarchyNode> subcodes = new ArrayList<>();
        if (label.subcodes() != null) {
            for (ClusterLabel.SubcodeLabel sub : label.subcodes()) {
                if (sub.name() == null || sub.name().isBlank()) {
                    throw new LabelingException("Labeler returned a subcode without a name under '" + name + "'");
                }
                subcodes.add(baseNode(input.generationId(), NodeType.SUBCODE, null)
                        .name(sub.name().trim())
                        .description(sub.description())
                        .confidence(parseLevel(sub.confidence(), "confidence", sub.name()))
                        .build());
            }
        }
        log.debug("Code '{}' from cluster {} ({} answers, {} subcodes)",
                name, cluster.clusterId(), cluster.size(), subcodes.size());
        return new StagedCode(node, subcodes);
    }

    private List<List<StagedCode>> groupIntoThemes(List<StagedCode> codes, AlgorithmConfig config) {
        if (codes.size() < config.themeMinClusterSize()) {
            return List.of(codes);
        }

        List<float[]> centroids = codes.stream().map(c -> c.node().getEmbedding()).collect(Collectors.toList());
        int[] labels = new HdbscanClusterer(config.themeMinClusterSize(), config.themeMinSamples()).fit(centroids);
        int themeCount = HdbscanClusterer.clusterCount(labels);
        if (themeCount == 0) {
            log.info("Theme pass found no structure among {} codes, using a single theme", codes.size());
            return List.of(codes);
        }

        List<List<StagedCode>> groups = new ArrayList<>();
        for (int t = 0; t < themeCount; t++) {
            groups.add(new ArrayList<>());
        }
        List<StagedCode> leftovers = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == HdbscanClusterer.NOISE) {
                leftovers.add(codes.get(i));
            } else {
                groups.get(labels[i]).add(codes.get(i));
            }
        }
        if (!leftovers.isEmpty()) {
            groups.add(leftovers);
        }
        return groups;
    }

    private HierarchyNode labelTheme(List<StagedCode> group, UUID rootId, BuildInput input) {
        List<String> codeNames = group.stream().map(c -> c.node().getName()).collect(Collectors.toList());
        int size = group.stream().mapToInt(c -> c.node().getClusterSize()).sum();

        ClusterLabel label = labeler.label(new LabelingRequest(
                LabelingRequest.Target.THEME,
                input.category().getName(),
                input.category().getDescription(),
                input.codingType(),
                codeNames,
                size,
                input.config().labelingModel()), input.usageContext());

        String name = requireName(label, "theme over " + codeNames);
        List<Long> members = new ArrayList<>();
        List<Long> representatives = new ArrayList<>();
        for (StagedCode code : group) {
            members.addAll(code.node().getMemberAnswerIds());
            if (!code.node().getRepresentativeAnswerIds().isEmpty()) {
                representatives.add(code.node().getRepresentativeAnswerIds().get(0));
            }
        }
        members.sort(Long::compareTo);

        return baseNode(input.generationId(), NodeType.THEME, rootId)
                .name(name)
                .description(label.description())
                .clusterSize(size)
                .memberAnswerIds(members)
                .representativeAnswerIds(representatives)
                .confidence(parseLevel(label.confidence(), "confidence", name))
                .frequencyEstimate(parseLevel(label.frequencyEstimate(), "frequency_estimate", name))
                .embedding(VectorMath.centroid(group.stream().map(c -> c.node().getEmbedding()).collect(Collectors.toList())))
                .build();
    }

    private String requireName(ClusterLabel label, String what) {
        if (label == null || label.name() == null || label.name().isBlank()) {
            throw new LabelingException("Labeler returned no name for " + what);
        }
        return label.name().trim();
    }

    private ConfidenceLevel parseLevel(String raw, String field, String nodeName) {
        return ConfidenceLevel.fromLabel(raw).orElseThrow(() -> new LabelingException(String.format(
                "Invalid %s '%s' for '%s': expected high, medium or low", field, raw, nodeName)));
    }

    private List<String> exampleTexts(AnswerCluster cluster, Map<Long, String> answerTexts) {
        int limit = Math.max(1, properties.getGeneration().getLabelingExampleCount());
        Set<Long> ordered = new LinkedHashSet<>(cluster.representativeAnswerIds());
        ordered.addAll(cluster.memberAnswerIds());
        return ordered.stream()
                .map(answerTexts::get)
                .filter(text -> text != null && !text.isBlank())
                .limit(limit)
                .collect(Collectors.toList());
    }

    private String exampleJson(List<Long> answerIds, Map<Long, String> answerTexts) {
        List<Map<String, String>> examples = new ArrayList<>();
        for (Long id : answerIds) {
            Map<String, String> example = new LinkedHashMap<>();
            example.put("id", String.valueOf(id));
            example.put("text", answerTexts.getOrDefault(id, ""));
            examples.add(example);
        }
        try {
            return objectMapper.writeValueAsString(examples);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize example texts", e);
        }
    }

    // distinct spellings of the brand as respondents wrote it, canonical name first
    private List<String> variants(String name, List<Long> memberIds, Map<Long, String> answerTexts) {
        Map<String, String> byLower = new LinkedHashMap<>();
        byLower.put(name.toLowerCase(), name);
        for (Long id : memberIds) {
            String text = answerTexts.get(id);
            if (text == null || text.isBlank()) {
                continue;
            }
            String trimmed = text.trim();
            byLower.putIfAbsent(trimmed.toLowerCase(), trimmed);
            if (byLower.size() >= MAX_VARIANTS) {
                break;
            }
        }
        return new ArrayList<>(byLower.values());
    }

    private HierarchyNode.HierarchyNodeBuilder baseNode(UUID generationId, NodeType type, UUID parentId) {
        return HierarchyNode.builder()
                .id(UUID.randomUUID())
                .generationId(generationId)
                .parentId(parentId)
                .level(type.getLevel())
                .nodeType(type)
                .autoGenerated(true)
                .edited(false);
    }

    private record StagedCode(HierarchyNode node, List<HierarchyNode> subcodes) {}

    public record BuildInput(
            UUID generationId,
            Category category,
            CodingType codingType,
            ClusteringResult clustering,
            Map<Long, String> answerTexts,
            AlgorithmConfig config,
            UsageContext usageContext
    ) {}
}

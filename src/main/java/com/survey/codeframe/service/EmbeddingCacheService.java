package com.survey.codeframe.service;

import com.survey.codeframe.entity.Answer;
import com.survey.codeframe.entity.AnswerEmbedding;
import com.survey.codeframe.entity.UsageFeature;
import com.survey.codeframe.exception.EmbeddingServiceException;
import com.survey.codeframe.repository.AnswerEmbeddingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Answer embeddings keyed by (answer, model). A stored vector is reused as long as the
 * SHA-256 of the answer text still matches; otherwise it is recomputed and overwritten.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EmbeddingCacheService {

    private final AnswerEmbeddingRepository embeddingRepository;
    private final EmbeddingClient embeddingClient;
    private final ContentHashService hashService;
    private final UsageLedgerService usageLedger;

    /**
     * @return the embedding, or null for blank text (nothing is stored)
     */
    public float[] getOrCompute(Long answerId, String text, String model, UsageContext context) {
        Answer answer = Answer.builder().id(answerId).answerText(text).build();
        return getOrComputeAll(List.of(answer), model, context).get(answerId);
    }

    /**
     * Resolves embeddings for many answers with one cache lookup. Misses are sent to the provider
     * in requests of at most {@link EmbeddingClient#maxBatchSize()} texts.
     * Blank answers are left out of the result.
     *
     * @return answerId → vector, in input order
     */
    public Map<Long, float[]> getOrComputeAll(List<Answer> answers, String model, UsageContext context) {
        Map<Long, String> hashes = new LinkedHashMap<>();
        Map<Long, String> texts = new HashMap<>();
        for (Answer answer : answers) {
            String text = answer.getAnswerText();
            if (text == null || text.isBlank()) {
                continue;
            }
            hashes.put(answer.getId(), hashService.generateHash(text));
            texts.put(answer.getId(), text);
        }
        if (hashes.isEmpty()) {
            return new LinkedHashMap<>();
        }

        Map<Long, AnswerEmbedding> cached = new HashMap<>();
        for (AnswerEmbedding row : embeddingRepository.findByAnswerIdInAndEmbeddingModel(hashes.keySet(), model)) {
            cached.put(row.getAnswerId(), row);
        }

        Map<Long, float[]> result = new LinkedHashMap<>();
        List<Long> misses = new ArrayList<>();
        for (Map.Entry<Long, String> entry : hashes.entrySet()) {
            AnswerEmbedding row = cached.get(entry.getKey());
            if (row != null && !hashService.hasTextChanged(entry.getValue(), row.getTextHash())) {
                result.put(entry.getKey(), row.getEmbedding());
            } else {
                result.put(entry.getKey(), null);
                misses.add(entry.getKey());
            }
        }

        log.info("Embedding cache: {} hits, {} misses (model {})", hashes.size() - misses.size(), misses.size(), model);
        if (misses.isEmpty()) {
            return result;
        }

        int batchSize = embeddingClient.maxBatchSize() > 0 ? embeddingClient.maxBatchSize() : misses.size();
        for (int from = 0; from < misses.size(); from += batchSize) {
            List<Long> chunk = misses.subList(from, Math.min(misses.size(), from + batchSize));
            embedChunk(chunk, texts, hashes, cached, model, context, result);
        }

        return result;
    }

    /**
     * One provider request. Its cost is recorded and its vectors stored before the next chunk is sent.
     */
    private void embedChunk(List<Long> chunk, Map<Long, String> texts, Map<Long, String> hashes,
                            Map<Long, AnswerEmbedding> cached, String model, UsageContext context,
                            Map<Long, float[]> result) {
        List<String> chunkTexts = chunk.stream().map(texts::get).collect(Collectors.toList());
        EmbeddingClient.EmbeddingBatch batch;
        try {
            batch = embeddingClient.embed(chunkTexts, model);
        } catch (EmbeddingServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingServiceException("Embedding service failed: " + e.getMessage(), e);
        }
        if (batch == null || batch.vectors() == null || batch.vectors().size() != chunk.size()) {
            throw new EmbeddingServiceException("Embedding service returned an incomplete batch");
        }

        usageLedger.record(UsageFeature.EMBEDDING, model, batch.promptTokens(), 0, context,
                Map.of("texts", chunk.size()));

        List<AnswerEmbedding> toSave = new ArrayList<>(chunk.size());
        for (int i = 0; i < chunk.size(); i++) {
            Long answerId = chunk.get(i);
            float[] vector = batch.vectors().get(i);
            result.put(answerId, vector);

            AnswerEmbedding row = cached.get(answerId);
            if (row == null) {
                row = AnswerEmbedding.builder().answerId(answerId).embeddingModel(model).build();
            }
            row.setEmbedding(vector);
            row.setTextHash(hashes.get(answerId));
            toSave.add(row);
        }
        embeddingRepository.saveAll(toSave);
    }
}

package com.tomeqa.index.search;

import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.MetadataKeys;
import com.tomeqa.index.model.ScoredChunk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges dense and lexical candidates and ranks them by
 * {@code alpha * dense + beta * sparse + gamma * keyword}.
 * <p>
 * The keyword signal rewards query terms that occur in the chunk's headings: each matching
 * term adds {@code (7 - level) * 0.05} per heading level and {@code 0.1} for section and
 * subsection. Pure; safe to share.
 */
public class FusionReranker {

    public static final double DEFAULT_ALPHA = 0.5;
    public static final double DEFAULT_BETA = 0.3;
    public static final double DEFAULT_GAMMA = 0.2;

    static final double HEADING_WEIGHT_STEP = 0.05;
    static final double SECTION_WEIGHT = 0.1;

    private final double alpha;
    private final double beta;
    private final double gamma;

    private static final class Candidate {
        final Chunk chunk;
        double dense;
        double sparse;
        int denseRank = Integer.MAX_VALUE;
        int sparseRank = Integer.MAX_VALUE;
        double score;

        Candidate(Chunk chunk) {
            this.chunk = chunk;
        }
    }

    public FusionReranker() {
        this(DEFAULT_ALPHA, DEFAULT_BETA, DEFAULT_GAMMA);
    }

    public FusionReranker(double alpha, double beta, double gamma) {
        this.alpha = requireWeight("alpha", alpha);
        this.beta = requireWeight("beta", beta);
        this.gamma = requireWeight("gamma", gamma);
    }

    private static double requireWeight(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
        }
        return value;
    }

    public List<ScoredChunk> combine(List<ScoredChunk> dense, List<ScoredChunk> sparse, String query, int k) {
        Map<String, Candidate> byText = new LinkedHashMap<>();
        for (int rank = 0; rank < dense.size(); rank++) {
            ScoredChunk hit = dense.get(rank);
            Candidate c = byText.get(hit.chunk().text());
            if (c == null) {
                c = new Candidate(hit.chunk());
                c.dense = hit.score();
                c.denseRank = rank;
                byText.put(hit.chunk().text(), c);
            }
        }
        for (int rank = 0; rank < sparse.size(); rank++) {
            ScoredChunk hit = sparse.get(rank);
            Candidate c = byText.computeIfAbsent(hit.chunk().text(), t -> new Candidate(hit.chunk()));
            if (c.sparseRank == Integer.MAX_VALUE) {
                c.sparse = hit.score();
                c.sparseRank = rank;
            }
        }

        Set<String> terms = queryTerms(query);
        List<Candidate> candidates = new ArrayList<>(byText.values());
        for (Candidate c : candidates) {
            c.score = alpha * c.dense + beta * c.sparse + gamma * keywordScore(c.chunk.metadata(), terms);
        }
        candidates.sort(Comparator.comparingDouble((Candidate c) -> c.score).reversed()
                .thenComparingInt(c -> c.denseRank)
                .thenComparingInt(c -> c.sparseRank));

        return candidates.stream()
                .limit(Math.max(k, 0))
                .map(c -> new ScoredChunk(c.chunk, c.score))
                .toList();
    }

    /**
     * Distinct lowercase whitespace-separated terms.
     */
    static Set<String> queryTerms(String query) {
        if (query == null || query.isBlank()) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList(query.toLowerCase(Locale.ROOT).trim().split("\\s+")));
    }

    static double keywordScore(Map<String, Object> metadata, Set<String> terms) {
        if (terms.isEmpty()) {
            return 0.0;
        }
        double score = 0.0;
        for (int level = 1; level <= 6; level++) {
            score += matches(metadata.get(MetadataKeys.headingKey(level)), terms) * (7 - level) * HEADING_WEIGHT_STEP;
        }
        score += matches(metadata.get(MetadataKeys.SECTION), terms) * SECTION_WEIGHT;
        score += matches(metadata.get(MetadataKeys.SUBSECTION), terms) * SECTION_WEIGHT;
        return score;
    }

    private static int matches(Object field, Set<String> terms) {
        if (field == null) {
            return 0;
        }
        String value = field.toString().toLowerCase(Locale.ROOT);
        int count = 0;
        for (String term : terms) {
            if (value.contains(term)) count++;
        }
        return count;
    }

    public double alpha() {
        return alpha;
    }

    public double beta() {
        return beta;
    }

    public double gamma() {
        return gamma;
    }
}

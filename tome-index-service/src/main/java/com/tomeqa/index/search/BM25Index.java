package com.tomeqa.index.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable BM25 index over a fixed list of texts. Results refer to texts by their position
 * in that list. Safe for concurrent reads.
 */
public final class BM25Index {

    private static final Logger log = LoggerFactory.getLogger(BM25Index.class);

    // BM25 tuning parameters
    static final double K1 = 1.5;  // term frequency saturation
    static final double B = 0.75;  // length normalization

    public static final BM25Index EMPTY = new BM25Index(List.of(), Map.of(), 0);

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all",
            "can", "had", "her", "was", "one", "our", "out", "has",
            "have", "been", "were", "they", "this", "that", "with",
            "from", "will", "would", "there", "their", "what", "about",
            "which", "when", "make", "like", "time", "just", "know",
            "take", "into", "your", "some", "could", "them",
            "than", "then", "now", "look", "only", "come", "its",
            "over", "also", "back", "after", "use", "how",
            "well", "way", "even", "want", "because",
            "any", "these", "give", "most", "being"
    );

    private final List<Document> documents;
    private final Map<String, Map<Integer, Integer>> invertedIndex;
    private final double avgDocLength;

    record Document(int position, Map<String, Integer> termFrequencies, int length) {}

    public record BM25Result(int position, double score) {}

    private BM25Index(List<Document> documents, Map<String, Map<Integer, Integer>> invertedIndex, double avgDocLength) {
        this.documents = documents;
        this.invertedIndex = invertedIndex;
        this.avgDocLength = avgDocLength;
    }

    public static BM25Index build(List<String> texts) {
        long start = System.currentTimeMillis();
        List<Document> documents = new ArrayList<>(texts.size());
        Map<String, Map<Integer, Integer>> inverted = new HashMap<>();
        long totalLength = 0;

        for (int position = 0; position < texts.size(); position++) {
            List<String> tokens = tokenize(texts.get(position));
            Map<String, Integer> termFreq = new HashMap<>();
            for (String token : tokens) {
                termFreq.merge(token, 1, Integer::sum);
            }
            documents.add(new Document(position, termFreq, tokens.size()));
            totalLength += tokens.size();
            for (Map.Entry<String, Integer> e : termFreq.entrySet()) {
                inverted.computeIfAbsent(e.getKey(), k -> new HashMap<>()).put(position, e.getValue());
            }
        }

        double avg = documents.isEmpty() ? 0 : (double) totalLength / documents.size();
        log.debug("[BM25] Built index over {} texts, vocabulary {} in {}ms",
                documents.size(), inverted.size(), System.currentTimeMillis() - start);
        return new BM25Index(List.copyOf(documents), inverted, avg);
    }

    /**
     * Lowercase, strip punctuation, split on whitespace, drop short tokens and stopwords.
     */
    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase()
                        .replaceAll("[^a-z0-9\\s]", " ")
                        .split("\\s+"))
                .filter(t -> t.length() > 2)
                .filter(t -> !STOPWORDS.contains(t))
                .collect(Collectors.toList());
    }

    /**
     * score(D,Q) = sum IDF(q) * (f(q,D) * (k1 + 1)) / (f(q,D) + k1 * (1 - b + b * |D| / avgdl)),
     * IDF(q) = log((N - n(q) + 0.5) / (n(q) + 0.5) + 1). Ties keep insertion order.
     */
    public List<BM25Result> search(String query, int topK) {
        List<String> queryTerms = tokenize(query);
        if (queryTerms.isEmpty() || documents.isEmpty() || topK <= 0) {
            return List.of();
        }

        int totalDocs = documents.size();
        Map<Integer, Double> scores = new HashMap<>();
        for (String term : queryTerms) {
            Map<Integer, Integer> postings = invertedIndex.get(term);
            if (postings == null || postings.isEmpty()) {
                continue;
            }
            int df = postings.size();
            double idf = Math.log((totalDocs - df + 0.5) / (df + 0.5) + 1);

            for (Map.Entry<Integer, Integer> entry : postings.entrySet()) {
                int tf = entry.getValue();
                double docLength = documents.get(entry.getKey()).length();
                double lengthNorm = 1 - B + B * (docLength / avgDocLength);
                double tfNorm = (tf * (K1 + 1)) / (tf + K1 * lengthNorm);
                scores.merge(entry.getKey(), idf * tfNorm, Double::sum);
            }
        }

        return scores.entrySet().stream()
                .sorted(Map.Entry.<Integer, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(topK)
                .map(e -> new BM25Result(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    public int size() {
        return documents.size();
    }

    public int getVocabularySize() {
        return invertedIndex.size();
    }

    public double getAverageDocumentLength() {
        return avgDocLength;
    }

    public Map<String, Object> getStats() {
        return Map.of(
                "totalDocuments", documents.size(),
                "vocabularySize", invertedIndex.size(),
                "averageDocumentLength", avgDocLength
        );
    }
}

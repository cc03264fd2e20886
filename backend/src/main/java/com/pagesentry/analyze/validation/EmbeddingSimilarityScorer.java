package com.pagesentry.analyze.validation;

import dev.langchain4j.model.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cosine similarity between the snippet and a "keyword (category)" probe, both embedded by the
 * configured {@link EmbeddingModel}. Negative similarities clamp to 0.
 */
@Component
public class EmbeddingSimilarityScorer implements MatchScorer {
    private static final int MAX_PROBES = 1_000;

    private final EmbeddingModel embeddingModel;
    private final Map<String, float[]> probes = new ConcurrentHashMap<>();

    public EmbeddingSimilarityScorer(ObjectProvider<EmbeddingModel> embeddingModel) {
        this.embeddingModel = embeddingModel.getIfAvailable();
    }

    @Override
    public boolean isAvailable() {
        return embeddingModel != null;
    }

    @Override
    public double score(String keyword, String snippet, String category) {
        if (embeddingModel == null) {
            return 1.0;
        }
        String probeText = keyword + " (" + category + ")";
        float[] probe = probes.get(probeText);
        if (probe == null) {
            probe = embeddingModel.embed(probeText).content().vector();
            if (probes.size() >= MAX_PROBES) {
                probes.clear();
            }
            probes.put(probeText, probe);
        }
        float[] target = embeddingModel.embed(snippet == null ? "" : snippet).content().vector();
        return Math.max(0.0, Math.min(1.0, cosine(probe, target)));
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}

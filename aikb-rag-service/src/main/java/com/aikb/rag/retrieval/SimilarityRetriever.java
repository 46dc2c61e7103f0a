package com.aikb.rag.retrieval;

import com.aikb.rag.model.RetrievedMatch;

import java.util.List;

public interface SimilarityRetriever {

    /**
     * Top {@code topK} stored chunks closest to {@code vector}, ordered by descending
     * score. An empty list is a valid answer.
     */
    List<RetrievedMatch> search(List<Double> vector, int topK);
}

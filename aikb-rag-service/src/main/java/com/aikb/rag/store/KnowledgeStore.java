package com.aikb.rag.store;

import com.aikb.rag.chunk.Chunk;

import java.util.List;

/**
 * Document metadata plus chunk vectors. The query pipeline only reads; ingestion owns
 * all writes.
 */
public interface KnowledgeStore {

    List<StoredDocument> getAllMetadata();

    void deleteDocument(String docId);

    void upsert(StoredDocument document, List<Chunk> chunks);

    /**
     * Swaps the document's chunks for {@code chunks}. Readers see either the old set or
     * the new one, never a mix of both.
     */
    void replaceDocument(StoredDocument document, List<Chunk> chunks);

    long getVectorCount();
}

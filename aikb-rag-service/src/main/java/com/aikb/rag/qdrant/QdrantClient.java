package com.aikb.rag.qdrant;

import com.aikb.rag.chunk.Chunk;
import com.aikb.rag.error.UpstreamException;
import com.aikb.rag.http.Http;
import com.aikb.rag.json.Json;
import com.aikb.rag.model.RetrievedMatch;
import com.aikb.rag.retrieval.SimilarityRetriever;
import com.aikb.rag.store.KnowledgeStore;
import com.aikb.rag.store.StoredDocument;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Qdrant REST client acting as both the knowledge store and the similarity retriever.
 * Every point carries its document's metadata in the payload; the point with
 * {@code chunkIndex == 0} is the one read back for metadata listings.
 */
public final class QdrantClient implements KnowledgeStore, SimilarityRetriever {
    private static final Logger log = LoggerFactory.getLogger(QdrantClient.class);

    private static final int SCROLL_PAGE = 256;

    private final String baseUrl;
    private final String collection;
    private final int vectorSize;
    private final String distance;
    private final int batchSize;

    private volatile boolean ensured = false;

    public QdrantClient(String baseUrl, String collection, int vectorSize, String distance, int batchSize) {
        this.baseUrl = baseUrl;
        this.collection = collection;
        this.vectorSize = vectorSize;
        this.distance = (distance == null || distance.isBlank()) ? "Cosine" : distance;
        this.batchSize = Math.max(1, batchSize);
    }

    public void ensureCollectionExists() {
        if (ensured) return;
        synchronized (this) {
            if (ensured) return;

            HttpResponse<String> getResp = send(HttpRequest.newBuilder()
                    .uri(collectionUri(""))
                    .timeout(Duration.ofSeconds(10))
                    .GET()
                    .build());

            if (getResp.statusCode() == 200) {
                ensured = true;
                return;
            }
            if (getResp.statusCode() != 404) {
                throw new UpstreamException("Qdrant GET collection HTTP " + getResp.statusCode());
            }

            ObjectNode body = Json.MAPPER.createObjectNode();
            body.putObject("vectors")
                    .put("size", vectorSize)
                    .put("distance", distance);

            HttpResponse<String> putResp = send(jsonRequest(collectionUri(""), "PUT", body, 30));
            if (putResp.statusCode() / 100 != 2) {
                throw new UpstreamException("Qdrant CREATE collection HTTP " + putResp.statusCode());
            }
            log.info("[QDRANT] Created collection {} (size={}, distance={})", collection, vectorSize, distance);
            ensured = true;
        }
    }

    @Override
    public void upsert(StoredDocument document, List<Chunk> chunks) {
        ensureCollectionExists();

        for (int from = 0; from < chunks.size(); from += batchSize) {
            List<Chunk> batch = chunks.subList(from, Math.min(chunks.size(), from + batchSize));
            ArrayNode points = Json.MAPPER.createArrayNode();
            for (Chunk c : batch) {
                if (c.embedding() == null || c.embedding().size() != vectorSize) {
                    throw new IllegalArgumentException("Vector dimension mismatch for id=" + c.id()
                            + " expected=" + vectorSize
                            + " got=" + (c.embedding() == null ? "null" : c.embedding().size()));
                }
                ObjectNode point = points.addObject();
                point.put("id", c.id());
                point.set("vector", toArray(c.embedding()));
                point.set("payload", Json.MAPPER.valueToTree(payload(document, c)));
            }

            ObjectNode body = Json.MAPPER.createObjectNode();
            body.set("points", points);

            HttpResponse<String> resp = send(jsonRequest(collectionUri("/points?wait=true"), "PUT", body, 60));
            if (resp.statusCode() / 100 != 2) {
                throw new UpstreamException("Qdrant upsert HTTP " + resp.statusCode());
            }
        }
    }

    @Override
    public void deleteDocument(String docId) {
        ensureCollectionExists();

        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("filter", matchFilter("docId", docId));

        HttpResponse<String> resp = send(jsonRequest(collectionUri("/points/delete?wait=true"), "POST", body, 30));
        if (resp.statusCode() / 100 != 2) {
            throw new UpstreamException("Qdrant delete HTTP " + resp.statusCode());
        }
        log.info("[QDRANT] Deleted points of document {}", docId);
    }

    /**
     * Delete then upsert, both with {@code wait=true}. Qdrant has no multi-operation
     * transaction, so between the two calls the document is absent rather than mixed.
     * When a later upsert batch fails, the batches already written are deleted again
     * so the document is never left partially indexed.
     */
    @Override
    public void replaceDocument(StoredDocument document, List<Chunk> chunks) {
        deleteDocument(document.docId());
        try {
            upsert(document, chunks);
        } catch (RuntimeException e) {
            log.warn("[QDRANT] Upsert of document {} failed, removing partially written points: {}",
                    document.docId(), e.getMessage());
            try {
                deleteDocument(document.docId());
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    @Override
    public long getVectorCount() {
        ensureCollectionExists();

        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(collectionUri(""))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build());
        if (resp.statusCode() / 100 != 2) {
            throw new UpstreamException("Qdrant GET collection HTTP " + resp.statusCode());
        }
        return readTree(resp.body()).at("/result/points_count").asLong(0);
    }

    @Override
    public List<StoredDocument> getAllMetadata() {
        ensureCollectionExists();

        List<StoredDocument> out = new ArrayList<>();
        JsonNode offset = null;
        do {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.set("filter", matchFilter("chunkIndex", 0));
            body.put("limit", SCROLL_PAGE);
            body.put("with_payload", true);
            body.put("with_vector", false);
            if (offset != null) body.set("offset", offset);

            HttpResponse<String> resp = send(jsonRequest(collectionUri("/points/scroll"), "POST", body, 30));
            if (resp.statusCode() / 100 != 2) {
                throw new UpstreamException("Qdrant scroll HTTP " + resp.statusCode());
            }

            JsonNode result = readTree(resp.body()).path("result");
            for (JsonNode point : result.path("points")) {
                out.add(toDocument(point.path("payload")));
            }
            JsonNode next = result.path("next_page_offset");
            offset = next.isMissingNode() || next.isNull() ? null : next;
        } while (offset != null);
        return out;
    }

    @Override
    public List<RetrievedMatch> search(List<Double> vector, int topK) {
        long startTime = System.currentTimeMillis();
        ensureCollectionExists();

        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("vector", toArray(vector));
        body.put("limit", topK);
        body.put("with_payload", true);

        HttpResponse<String> resp = send(jsonRequest(collectionUri("/points/search"), "POST", body, 30));
        if (resp.statusCode() / 100 != 2) {
            throw new UpstreamException("Qdrant search HTTP " + resp.statusCode());
        }

        List<RetrievedMatch> results = parseMatches(resp.body());
        log.debug("[QDRANT TIMING] search total={}ms topK={} hits={}",
                System.currentTimeMillis() - startTime, topK, results.size());
        return results;
    }

    static List<RetrievedMatch> parseMatches(String json) {
        JsonNode result = readTree(json).get("result");
        if (result == null || !result.isArray()) return List.of();

        List<RetrievedMatch> out = new ArrayList<>();
        for (JsonNode hit : result) {
            JsonNode payload = hit.get("payload");
            JsonNode score = hit.get("score");
            if (payload == null || score == null) continue;

            JsonNode docId = payload.get("docId");
            JsonNode text = payload.get("text");
            if (docId == null || text == null) continue;

            JsonNode title = payload.get("title");
            out.add(new RetrievedMatch(
                    hit.path("id").asText(),
                    docId.asText(),
                    title != null && !title.isNull() ? title.asText() : null,
                    score.asDouble(),
                    text.asText()));
        }
        return out;
    }

    private static Map<String, Object> payload(StoredDocument document, Chunk chunk) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("docId", document.docId());
        payload.put("chunkIndex", chunk.sequenceIndex());
        payload.put("text", chunk.text());
        payload.put("title", document.title());
        payload.put("category", document.category());
        payload.put("department", document.department());
        payload.put("sensitivity", document.sensitivity());
        payload.put("chunkCount", document.chunkCount());
        payload.put("ingestedAt", document.ingestedAt() == null ? null : document.ingestedAt().toString());
        return payload;
    }

    private static StoredDocument toDocument(JsonNode payload) {
        String ingestedAt = textOrNull(payload, "ingestedAt");
        return new StoredDocument(
                payload.path("docId").asText(),
                textOrNull(payload, "title"),
                textOrNull(payload, "category"),
                textOrNull(payload, "department"),
                textOrNull(payload, "sensitivity"),
                payload.path("chunkCount").asInt(0),
                ingestedAt == null ? null : Instant.parse(ingestedAt));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static ObjectNode matchFilter(String key, Object value) {
        ObjectNode match = Json.MAPPER.createObjectNode();
        if (value instanceof Integer i) match.put("value", i);
        else match.put("value", String.valueOf(value));

        ObjectNode condition = Json.MAPPER.createObjectNode();
        condition.put("key", key);
        condition.set("match", match);

        ObjectNode filter = Json.MAPPER.createObjectNode();
        filter.set("must", Json.MAPPER.createArrayNode().add(condition));
        return filter;
    }

    private URI collectionUri(String suffix) {
        return URI.create(baseUrl + "/collections/" + collection + suffix);
    }

    private static HttpRequest jsonRequest(URI uri, String method, JsonNode body, int timeoutSeconds) {
        try {
            return HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                    .build();
        } catch (IOException e) {
            throw new IllegalStateException("Could not serialize Qdrant request body", e);
        }
    }

    private static HttpResponse<String> send(HttpRequest request) {
        try {
            return Http.CLIENT.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamException("Qdrant request failed: " + request.method() + " " + request.uri().getPath(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Qdrant request interrupted", e);
        }
    }

    private static JsonNode readTree(String json) {
        try {
            return Json.MAPPER.readTree(json);
        } catch (IOException e) {
            throw new UpstreamException("Bad Qdrant response JSON", e);
        }
    }

    private static ArrayNode toArray(List<Double> v) {
        ArrayNode a = Json.MAPPER.createArrayNode();
        for (Double d : v) a.add(d);
        return a;
    }
}

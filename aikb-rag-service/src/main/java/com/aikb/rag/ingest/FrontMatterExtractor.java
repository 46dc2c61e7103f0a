package com.aikb.rag.ingest;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips a YAML front-matter block ({@code ---} delimited, at the very top of the
 * document) and parses it. Any problem with the header yields empty metadata and the
 * untouched text; extraction never aborts an ingestion.
 */
@Slf4j
public class FrontMatterExtractor {

    private static final Pattern FRONT_MATTER = Pattern.compile("\\A---\\r?\\n(.*?)\\r?\\n---[ \\t]*(?:\\r?\\n|\\z)", Pattern.DOTALL);

    public record Extraction(DocumentMetadata metadata, String body) {}

    public Extraction extract(String content) {
        if (content == null) {
            return new Extraction(DocumentMetadata.EMPTY, "");
        }
        Matcher m = FRONT_MATTER.matcher(content);
        if (!m.find()) {
            return new Extraction(DocumentMetadata.EMPTY, content);
        }

        try {
            Object parsed = new Yaml(new SafeConstructor(new LoaderOptions())).load(m.group(1));
            if (!(parsed instanceof Map<?, ?> map)) {
                log.warn("[INGEST] Front matter is not a key/value block, ignoring it");
                return new Extraction(DocumentMetadata.EMPTY, content);
            }
            Map<String, Object> fields = stringKeys(map);
            if (fields.get("METADATA") instanceof Map<?, ?> nested) {
                fields = stringKeys(nested);
            }
            String body = content.substring(m.end()).strip();
            return new Extraction(toMetadata(fields), body);
        } catch (RuntimeException e) {
            log.warn("[INGEST] Could not parse front matter, keeping document unchanged: {}", e.getMessage());
            return new Extraction(DocumentMetadata.EMPTY, content);
        }
    }

    private static DocumentMetadata toMetadata(Map<String, Object> fields) {
        List<String> redactFields = List.of();
        if (fields.get("ai_access") instanceof Map<?, ?> access) {
            redactFields = stringList(access.get("redact_fields"));
        }
        return new DocumentMetadata(
                string(fields.get("document_id")),
                string(fields.get("title")),
                string(fields.get("category")),
                string(fields.get("department")),
                string(fields.get("owner")),
                string(fields.get("sensitivity")),
                stringList(fields.get("tags")),
                redactFields,
                fields
        );
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (k != null && v != null) out.put(String.valueOf(k), v);
        });
        return out;
    }

    private static String string(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static List<String> stringList(Object value) {
        if (value instanceof List<?> list) {
            List<String> out = new ArrayList<>(list.size());
            for (Object o : list) {
                if (o != null) out.add(String.valueOf(o));
            }
            return out;
        }
        if (value instanceof String s && !s.isBlank()) {
            return List.of(s);
        }
        return List.of();
    }
}

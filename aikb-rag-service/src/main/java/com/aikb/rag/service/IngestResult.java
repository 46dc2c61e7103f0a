package com.aikb.rag.service;

public record IngestResult(String docId, String title, int chunkCount, String sensitivity) {}

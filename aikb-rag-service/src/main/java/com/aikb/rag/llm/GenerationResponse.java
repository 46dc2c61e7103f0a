package com.aikb.rag.llm;

import com.aikb.rag.model.TokenUsage;

public record GenerationResponse(String text, TokenUsage usage) {}

package com.aikb.rag.llm;

/**
 * Generative model behind the query pipeline. Implementations return the model's raw
 * text; callers validate its structure before use.
 */
public interface AnswerGenerator {
    GenerationResponse generate(GenerationRequest request);
}

package dev.aparikh.hybridsearch.embedding;

/**
 * Where query embeddings come from.
 */
public enum EmbeddingProvider {
    /** Deterministic feature hashing, needs no model or network access. */
    HASHING,
    /** OpenAI embeddings through Spring AI. */
    OPENAI
}

package io.github.chirino.llmcache.chunking;

/** A fragment of a larger text, covering {@code [start, end)} of the source. */
public record TextChunk(int seq, int start, int end, String text) {}

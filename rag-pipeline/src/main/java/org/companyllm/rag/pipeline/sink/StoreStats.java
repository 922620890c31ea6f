package org.companyllm.rag.pipeline.sink;

public record StoreStats(String name, long count, String location) {}

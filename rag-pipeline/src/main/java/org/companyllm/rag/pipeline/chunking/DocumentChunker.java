package org.companyllm.rag.pipeline.chunking;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.companyllm.rag.pipeline.ir.CanonicalDocument;
import org.companyllm.rag.pipeline.ir.Chunk;
import org.companyllm.rag.pipeline.ir.MetadataKeys;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a canonical document into fingerprinted chunks. Pure: the same document and
 * configuration always produce the same {@code (chunkId, contentHash)} sequence.
 */
@Slf4j
public class DocumentChunker {
    private final TextChunker textChunker;
    private final ContentFingerprinter fingerprinter;

    public DocumentChunker(ChunkingConfig config) {
        this(new TextChunker(config), new ContentFingerprinter());
    }

    public DocumentChunker(TextChunker textChunker, ContentFingerprinter fingerprinter) {
        this.textChunker = textChunker;
        this.fingerprinter = fingerprinter;
    }

    public List<Chunk> chunk(CanonicalDocument document) {
        var windows = textChunker.chunk(document.body());
        if (windows.isEmpty()) {
            log.debug("Document {} has an empty body, no chunks produced", document.documentId());
            return List.of();
        }
        var inherited = inheritedMetadata(document);
        var chunks = new ArrayList<Chunk>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            var text = windows.get(i);
            var metadata = new LinkedHashMap<>(inherited);
            metadata.put(Chunk.CHUNK_INDEX_KEY, Integer.toString(i));
            chunks.add(new Chunk(
                Chunk.idFor(document.documentId(), i),
                text,
                fingerprinter.fingerprint(text),
                metadata
            ));
        }
        return chunks;
    }

    private static Map<String, String> inheritedMetadata(CanonicalDocument document) {
        var metadata = new LinkedHashMap<String, String>(document.metadata());
        metadata.put(MetadataKeys.SOURCE, document.source().wireName());
        metadata.put(MetadataKeys.TITLE, document.title());
        metadata.put(MetadataKeys.EXTERNAL_ID, document.externalId());
        metadata.put(MetadataKeys.DOCUMENT_ID, document.documentId());
        document.lastUpdated().ifPresent(ts -> metadata.put(MetadataKeys.UPDATED_AT, ts.toString()));
        return metadata;
    }
}

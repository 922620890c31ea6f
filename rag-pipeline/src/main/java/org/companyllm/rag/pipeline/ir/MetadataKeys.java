package org.companyllm.rag.pipeline.ir;

/**
 * Metadata keys shared by normalizers, the chunker and the prompt assembler.
 */
public final class MetadataKeys {
    public static final String SOURCE = "source";
    public static final String TITLE = "title";
    public static final String URL = "url";
    public static final String AUTHOR = "author";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String CONTENT_TYPE = "content_type";
    public static final String DOCUMENT_ID = "original_doc_id";
    public static final String EXTERNAL_ID = "external_id";
    public static final String PARENT_ID = "parent_id";
    public static final String THREAD_ID = "thread_id";
    public static final String COMMENTS = "comments";
    public static final String COMMENT_COUNT = "comment_count";

    private MetadataKeys() {
        // Constants only
    }
}

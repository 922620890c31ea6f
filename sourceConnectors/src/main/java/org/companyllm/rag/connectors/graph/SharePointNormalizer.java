package org.companyllm.rag.connectors.graph;

import java.util.LinkedHashMap;

import org.companyllm.rag.connectors.text.MarkupText;
import org.companyllm.rag.connectors.text.Metadata;
import org.companyllm.rag.connectors.text.Timestamps;
import org.companyllm.rag.pipeline.error.MalformedRecordException;
import org.companyllm.rag.pipeline.ir.CanonicalDocument;
import org.companyllm.rag.pipeline.ir.MetadataKeys;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.SourceType;
import org.companyllm.rag.pipeline.normalize.RecordNormalizer;

public class SharePointNormalizer implements RecordNormalizer {

    @Override
    public CanonicalDocument normalize(RawRecord rawRecord) {
        var file = rawRecord.payload();
        var context = rawRecord.context();
        var id = Metadata.text(file.path("id"), null);
        if (id == null) {
            throw new MalformedRecordException("SharePoint item without id (name=" + file.path("name").asText("?") + ")");
        }
        var mimeType = SharePointRecordSource.mimeTypeOf(file);
        var content = context.path(SharePointRecordSource.CONTENT_CONTEXT).asText("");
        var body = "text/html".equals(mimeType) ? MarkupText.toPlainText(content) : content;

        var metadata = new LinkedHashMap<String, String>();
        metadata.put(MetadataKeys.CONTENT_TYPE, "file");
        Metadata.putIfPresent(metadata, MetadataKeys.URL, file.path("webUrl"));
        metadata.put(MetadataKeys.AUTHOR, Metadata.text(file.path("lastModifiedBy").path("user").path("displayName"), "Unknown"));
        Metadata.putIfPresent(metadata, MetadataKeys.CREATED_AT, file.path("createdDateTime"));
        Metadata.putIfPresent(metadata, "sharepoint_site_name", context.path(SharePointRecordSource.SITE_NAME_CONTEXT));
        Metadata.putIfPresent(metadata, "sharepoint_file_path", context.path(SharePointRecordSource.FILE_PATH_CONTEXT));
        if (!mimeType.isEmpty()) {
            metadata.put("mime_type", mimeType);
        }
        Metadata.putIfPresent(metadata, "size", file.path("size"));
        Metadata.putIfPresent(metadata, MetadataKeys.PARENT_ID, file.path("parentReference").path("id"));

        return CanonicalDocument.builder()
            .source(SourceType.SHAREPOINT)
            .externalId(id)
            .title(Metadata.text(file.path("name"), "Untitled"))
            .body(body)
            .metadata(metadata)
            .updatedAt(Timestamps.parseLenient(Metadata.text(file.path("lastModifiedDateTime"), null)).orElse(null))
            .build();
    }
}

package org.companyllm.rag.pipeline.normalize;

import java.util.EnumMap;
import java.util.Map;

import org.companyllm.rag.pipeline.error.MalformedRecordException;
import org.companyllm.rag.pipeline.ir.CanonicalDocument;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.SourceType;

/**
 * Dispatches each record to the normalizer registered for its source tag. Any runtime
 * failure of a normalizer is reported as a {@link MalformedRecordException}, so one
 * unexpected payload shape skips that record only.
 */
public class NormalizerRegistry implements RecordNormalizer {
    private final Map<SourceType, RecordNormalizer> normalizers = new EnumMap<>(SourceType.class);

    public NormalizerRegistry register(SourceType sourceType, RecordNormalizer normalizer) {
        normalizers.put(sourceType, normalizer);
        return this;
    }

    @Override
    public CanonicalDocument normalize(RawRecord rawRecord) {
        var normalizer = normalizers.get(rawRecord.source());
        if (normalizer == null) {
            throw new MalformedRecordException("No normalizer registered for source " + rawRecord.source().wireName());
        }
        try {
            return normalizer.normalize(rawRecord);
        } catch (MalformedRecordException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MalformedRecordException("Could not normalize " + rawRecord.source().wireName() + " record "
                + rawRecord.payload().path("id").asText("?") + ": " + e, e);
        }
    }
}

package org.companyllm.rag.pipeline.normalize;

import org.companyllm.rag.pipeline.error.MalformedRecordException;
import org.companyllm.rag.pipeline.ir.CanonicalDocument;
import org.companyllm.rag.pipeline.ir.RawRecord;

/**
 * Maps a provider-native record to its canonical document. Implementations are pure;
 * malformed optional fields degrade to empty values rather than failing.
 */
@FunctionalInterface
public interface RecordNormalizer {

    /**
     * @throws MalformedRecordException when the record lacks the fields needed to identify it
     */
    CanonicalDocument normalize(RawRecord rawRecord);
}

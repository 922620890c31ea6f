package org.companyllm.rag.connectors.paging;

import java.util.Optional;

import org.companyllm.rag.connectors.http.QueryString;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

/**
 * Offset and limit, e.g. Confluence's {@code start}/{@code limit}: a page shorter than
 * the requested limit is the last one.
 *
 * The offset advances by the number of records actually returned, so a provider that
 * hands back fewer than asked neither skips nor repeats records.
 */
@Builder
public class SizeThresholdPagination implements PaginationStrategy {
    private final String path;
    private final QueryString query;
    private final int pageSize;
    @Builder.Default
    private final String recordsField = "results";
    @Builder.Default
    private final String sizeField = "size";
    @Builder.Default
    private final String offsetParameter = "start";
    @Builder.Default
    private final String limitParameter = "limit";

    @Override
    public PageRequest firstRequest() {
        return requestAt(0);
    }

    @Override
    public PageAdvance advance(PageRequest request, JsonNode response) {
        var records = PaginationStrategy.recordsAt(response, recordsField);
        int returned = response.path(sizeField).isInt() ? response.path(sizeField).asInt() : records.size();
        if (records.isEmpty() || returned < pageSize) {
            return PageAdvance.last(records);
        }
        long offset = Long.parseLong(request.cursor());
        return new PageAdvance(records, Optional.of(requestAt(offset + returned)));
    }

    private PageRequest requestAt(long offset) {
        var q = (query == null ? new QueryString() : query.copy())
            .and(offsetParameter, offset)
            .and(limitParameter, pageSize);
        return new PageRequest(q.appendTo(path), Long.toString(offset));
    }
}

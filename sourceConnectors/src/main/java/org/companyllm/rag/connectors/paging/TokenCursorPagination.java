package org.companyllm.rag.connectors.paging;

import java.util.Optional;

import org.companyllm.rag.connectors.http.QueryString;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

/**
 * Opaque continuation token, e.g. Jira's {@code /search/jql}: each response carries
 * its records, an {@code isLast} flag and possibly a {@code nextPageToken}.
 *
 * Stops on an empty page, on {@code isLast}, or when no new token comes back. A token
 * equal to the one just sent also stops, since following it would loop. No total
 * count is ever consulted.
 */
@Builder
public class TokenCursorPagination implements PaginationStrategy {
    private final String path;
    private final QueryString query;
    @Builder.Default
    private final String recordsField = "issues";
    @Builder.Default
    private final String tokenParameter = "nextPageToken";
    @Builder.Default
    private final String tokenField = "nextPageToken";
    @Builder.Default
    private final String lastPageField = "isLast";

    @Override
    public PageRequest firstRequest() {
        return new PageRequest(baseQuery().appendTo(path), null);
    }

    @Override
    public PageAdvance advance(PageRequest request, JsonNode response) {
        var records = PaginationStrategy.recordsAt(response, recordsField);
        if (records.isEmpty() || response.path(lastPageField).asBoolean(false)) {
            return PageAdvance.last(records);
        }
        var token = response.path(tokenField);
        if (!token.isTextual() || token.asText().isEmpty() || token.asText().equals(request.cursor())) {
            return PageAdvance.last(records);
        }
        var nextToken = token.asText();
        var target = baseQuery().and(tokenParameter, nextToken).appendTo(path);
        return new PageAdvance(records, Optional.of(new PageRequest(target, nextToken)));
    }

    private QueryString baseQuery() {
        return query == null ? new QueryString() : query.copy();
    }
}

package org.companyllm.rag.connectors.paging;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Explicit next-page link, e.g. Microsoft Graph's {@code @odata.nextLink}. The link is
 * followed verbatim until a response has none.
 */
public class LinkPagination implements PaginationStrategy {
    public static final String ODATA_NEXT_LINK = "@odata.nextLink";

    private final String firstTarget;
    private final String recordsField;
    private final String nextLinkField;

    public LinkPagination(String firstTarget) {
        this(firstTarget, "value", ODATA_NEXT_LINK);
    }

    public LinkPagination(String firstTarget, String recordsField, String nextLinkField) {
        this.firstTarget = firstTarget;
        this.recordsField = recordsField;
        this.nextLinkField = nextLinkField;
    }

    @Override
    public PageRequest firstRequest() {
        return new PageRequest(firstTarget, null);
    }

    @Override
    public PageAdvance advance(PageRequest request, JsonNode response) {
        var records = PaginationStrategy.recordsAt(response, recordsField);
        var link = response.path(nextLinkField);
        if (!link.isTextual() || link.asText().isBlank() || link.asText().equals(request.target())) {
            return PageAdvance.last(records);
        }
        return new PageAdvance(records, Optional.of(new PageRequest(link.asText(), link.asText())));
    }
}

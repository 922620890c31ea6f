package org.companyllm.rag.connectors.paging;

/**
 * One page to fetch.
 *
 * @param target  path or absolute URL to request
 * @param cursor  the cursor value this request carries (token or offset), or null on a first page
 *                that carries none
 */
public record PageRequest(String target, String cursor) {}

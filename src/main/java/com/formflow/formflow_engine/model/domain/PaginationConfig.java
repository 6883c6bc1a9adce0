package com.formflow.formflow_engine.model.domain;

import lombok.Data;

/**
 * Page-driver settings of a PAGINATION loop.
 *
 * <pre>
 * {
 *   "currentPageVariable":  "page",
 *   "hasNextPageCondition": "values.hasMore == true",
 *   "pageSizeVariable":     "size",
 *   "totalPageVariable":    "pages",
 *   "totalItemsVariable":   "response.totalCount",
 *   "requestInterval":      500,
 *   "maxPages":             20
 * }
 * </pre>
 */
@Data
public class PaginationConfig {

    /** Alias under which the page number is exposed, in addition to currentPage. */
    private String currentPageVariable;

    /** Evaluated after every page; the loop ends when it is false. */
    private String hasNextPageCondition;

    private String pageSizeVariable;
    private String totalPageVariable;

    /** Form-state path whose value is exposed as the loop's total. */
    private String totalItemsVariable;

    /** Pause between pages in milliseconds. */
    private Long requestInterval;

    private Integer maxPages;
}

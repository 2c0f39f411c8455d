package com.recbench.evaluation.adapter;

/**
 * Response shapes of the target recommendation services.
 */
public enum ServiceShape {
    /** Per-scenario objects with ranked recommendations and a final_choices shortlist. */
    STRUCTURED,
    /** Same shape as {@link #STRUCTURED} behind a reduced request contract. */
    SIMPLIFIED_STRUCTURED,
    /** One ranked list for the whole query. */
    FLAT_LIST,
    /** Server-sent fragments keyed by recommended item name. */
    STREAMING
}

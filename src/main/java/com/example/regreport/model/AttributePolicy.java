package com.example.regreport.model;

/**
 * How the detailed reports pick a tag's descriptive attributes when its rows disagree.
 */
public enum AttributePolicy {

    /**
     * First row in source order wins; disagreement is logged.
     */
    FIRST_WINS,

    /**
     * Disagreement aborts the run.
     */
    REQUIRE_AGREEMENT
}

package com.example.regreport.exception;

import java.util.List;

/**
 * Rows sharing a tag disagree on an attribute that must be single-valued.
 */
public class AggregationAmbiguityException extends ReportPipelineException {

    private final String tag;
    private final String attribute;

    public AggregationAmbiguityException(String tag, String attribute, List<String> values) {
        super("Tag '" + tag + "' has conflicting values for " + attribute + ": " + values);
        this.tag = tag;
        this.attribute = attribute;
    }

    public String getTag() {
        return tag;
    }

    public String getAttribute() {
        return attribute;
    }
}

package com.tracelake.query;

/**
 * The query shapes offered to the analytics layer
 */
public enum QueryShape {
    AGGREGATE,
    TREND,
    SEARCH
}

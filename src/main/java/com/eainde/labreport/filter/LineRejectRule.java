package com.eainde.labreport.filter;

/**
 * A single reject-predicate of the line validity filter. Rules are independent so
 * each heuristic can be tuned and tested on its own.
 */
public interface LineRejectRule {

    /** Identifier reported when this rule rejects a line. */
    String name();

    boolean rejects(CandidateLine line);
}

package org.carball.docsim.parser;

/**
 * The query is well formed but combines clauses the planner does not support.
 */
public class UnsupportedQueryException extends QueryParseException {

    public UnsupportedQueryException(String message) {
        super(message);
    }
}

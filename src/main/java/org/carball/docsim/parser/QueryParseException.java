package org.carball.docsim.parser;

public class QueryParseException extends IllegalArgumentException {

    public QueryParseException(String message) {
        super(message);
    }
}

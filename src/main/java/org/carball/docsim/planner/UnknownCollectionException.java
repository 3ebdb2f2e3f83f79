package org.carball.docsim.planner;

import lombok.Getter;

/**
 * A plan step references a collection that the active design does not contain.
 */
@Getter
public class UnknownCollectionException extends IllegalStateException {

    private final String collection;

    public UnknownCollectionException(String collection, String context) {
        super("Unknown collection '" + collection + "' in " + context);
        this.collection = collection;
    }
}

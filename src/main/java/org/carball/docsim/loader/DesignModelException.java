package org.carball.docsim.loader;

import lombok.Getter;

/**
 * A design cannot be built because a collection it names is incomplete.
 * The whole design is abandoned.
 */
@Getter
public abstract class DesignModelException extends IllegalStateException {

    private final String designId;
    private final String collection;

    protected DesignModelException(String message, String designId, String collection) {
        super(message);
        this.designId = designId;
        this.collection = collection;
    }
}

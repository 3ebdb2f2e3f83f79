package org.carball.docsim.loader;

public class MissingSchemaException extends DesignModelException {

    public MissingSchemaException(String designId, String collection) {
        super("Design " + designId + " uses collection " + collection + " which has no schema",
                designId, collection);
    }
}

package org.carball.docsim.loader;

public class MissingStatsException extends DesignModelException {

    public MissingStatsException(String designId, String collection) {
        super("Design " + designId + " uses collection " + collection + " which has no statistics",
                designId, collection);
    }
}

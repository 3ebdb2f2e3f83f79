package org.carball.docsim.model.plan;

public class AggregateConfigException extends IllegalArgumentException {

    public AggregateConfigException(String message) {
        super(message);
    }
}

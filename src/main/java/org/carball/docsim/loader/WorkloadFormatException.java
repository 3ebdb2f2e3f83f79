package org.carball.docsim.loader;

public class WorkloadFormatException extends IllegalStateException {

    public WorkloadFormatException(String message) {
        super(message);
    }
}

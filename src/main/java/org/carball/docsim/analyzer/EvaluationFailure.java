package org.carball.docsim.analyzer;

/**
 * A failed evaluation. {@code queryId} is null when the design itself could not be built.
 */
public record EvaluationFailure(String designId, String queryId, String errorType, String message) {

    public boolean isDesignFailure() {
        return queryId == null;
    }
}

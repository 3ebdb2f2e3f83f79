package org.carball.docsim.analyzer;

import lombok.Getter;

@Getter
public class WorkloadEvaluationException extends RuntimeException {

    private final String designId;
    private final String queryId;

    public WorkloadEvaluationException(String designId, String queryId, RuntimeException cause) {
        super(describe(designId, queryId) + ": " + cause.getMessage(), cause);
        this.designId = designId;
        this.queryId = queryId;
    }

    private static String describe(String designId, String queryId) {
        return queryId == null
                ? "Design " + designId + " could not be built"
                : "Query " + queryId + " failed under design " + designId;
    }
}

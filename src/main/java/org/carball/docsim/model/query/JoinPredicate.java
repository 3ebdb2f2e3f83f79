package org.carball.docsim.model.query;

public record JoinPredicate(String leftCollection, String leftField, String rightCollection, String rightField) {

    public boolean involves(String collection) {
        return leftCollection.equals(collection) || rightCollection.equals(collection);
    }
}

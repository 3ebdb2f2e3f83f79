package org.carball.docsim.analyzer;

import org.carball.docsim.model.cost.QueryResult;
import org.carball.docsim.model.query.QuerySpec;

public record QueryEvaluation(String designId, QuerySpec query, QueryResult result) {}

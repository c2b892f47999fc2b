package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.analysis.model.AnalysisFragment;
import com.salesBoard.biAgent.analysis.model.BoardSnapshot;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.QueryIntent;

/**
 * Answers one category of question over a board snapshot.
 * 
 * Implementations are stateless; the same snapshot and intent always give the same fragment
 * regardless of record order.
 */
public interface DomainAnalyzer {

    QueryCategory getCategory();

    AnalysisFragment analyze(BoardSnapshot snapshot, QueryIntent intent);
}

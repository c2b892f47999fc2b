package com.salesBoard.biAgent.query.service;

import com.salesBoard.biAgent.query.model.FilterDimension;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.query.model.TimeRange;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryInterpreterTest {

    private final QueryInterpreter interpreter = new QueryInterpreter();

    @Test
    void pipelineQuestionIsRecognized() {
        QueryIntent intent = interpreter.interpret("How's our pipeline looking?");

        assertThat(intent.getCategory()).isEqualTo(QueryCategory.PIPELINE_OVERVIEW);
        assertThat(intent.getConfidence()).isGreaterThan(0.0);
        assertThat(intent.getMatchedTerms()).containsExactly("pipeline");
        assertThat(intent.getTimeRange()).isEqualTo(TimeRange.ALL_TIME);
    }

    @Test
    void gibberishIsUnknownWithZeroConfidence() {
        QueryIntent intent = interpreter.interpret("asdf qwerty zzz");

        assertThat(intent.getCategory()).isEqualTo(QueryCategory.UNKNOWN);
        assertThat(intent.getConfidence()).isZero();
        assertThat(intent.getFilters()).isEmpty();
    }

    @Test
    void blankAndNullQueriesAreUnknown() {
        assertThat(interpreter.interpret("").getCategory()).isEqualTo(QueryCategory.UNKNOWN);
        assertThat(interpreter.interpret(null).getCategory()).isEqualTo(QueryCategory.UNKNOWN);
    }

    @Test
    void eachCategoryHasARecognizableQuestion() {
        assertThat(interpreter.interpret("What revenue should we expect?").getCategory())
                .isEqualTo(QueryCategory.REVENUE_FORECAST);
        assertThat(interpreter.interpret("How many work orders are on hold?").getCategory())
                .isEqualTo(QueryCategory.EXECUTION_STATUS);
        assertThat(interpreter.interpret("Prepare a leadership update").getCategory())
                .isEqualTo(QueryCategory.LEADERSHIP_UPDATE);
    }

    @Test
    void tiesGoToTheHigherPriorityCategory() {
        assertThat(interpreter.interpret("revenue pipeline").getCategory()).isEqualTo(QueryCategory.PIPELINE_OVERVIEW);
        assertThat(interpreter.interpret("leadership revenue").getCategory()).isEqualTo(QueryCategory.LEADERSHIP_UPDATE);
    }

    @Test
    void confidenceGrowsWithMatchedTermsAndSaturates() {
        double one = interpreter.interpret("pipeline").getConfidence();
        double two = interpreter.interpret("pipeline win rate").getConfidence();
        double many = interpreter.interpret("pipeline win rate funnel conversion deals").getConfidence();

        assertThat(two).isGreaterThan(one);
        assertThat(many).isEqualTo(1.0);
    }

    @Test
    void timePhrasesAreDetected() {
        assertThat(interpreter.interpret("pipeline this quarter").getTimeRange()).isEqualTo(TimeRange.THIS_QUARTER);
        assertThat(interpreter.interpret("revenue last quarter").getTimeRange()).isEqualTo(TimeRange.LAST_QUARTER);
        assertThat(interpreter.interpret("revenue YTD").getTimeRange()).isEqualTo(TimeRange.THIS_YEAR);
        assertThat(interpreter.interpret("deals closed in the last 30 days").getTimeRange()).isEqualTo(TimeRange.LAST_30_DAYS);
        assertThat(interpreter.interpret("pipeline next quarter").getTimeRange()).isEqualTo(TimeRange.NEXT_QUARTER);
    }

    @Test
    void sectorAndStageFiltersAreExtracted() {
        QueryIntent intent = interpreter.interpret("Show energy and software deals in negotiation");

        assertThat(intent.filterValues(FilterDimension.SECTOR)).containsExactly("Energy", "Technology");
        assertThat(intent.filterValues(FilterDimension.STAGE)).containsExactly("Negotiation");
        assertThat(intent.hasFilter(FilterDimension.STATUS)).isFalse();
    }

    @Test
    void commonWordsDoNotBecomeFilters() {
        QueryIntent intent = interpreter.interpret("Is it a new health update for the work delivered?");

        assertThat(intent.getFilters()).isEmpty();
    }

    @Test
    void statusFilterIsExtracted() {
        QueryIntent intent = interpreter.interpret("Which work orders are paused?");

        assertThat(intent.filterValues(FilterDimension.STATUS)).containsExactly("On Hold");
    }

    @Test
    void sameTextGivesSameIntent() {
        String query = "Energy pipeline health this quarter";

        assertThat(interpreter.interpret(query)).isEqualTo(interpreter.interpret(query));
    }

    @Test
    void originalTextIsKept() {
        assertThat(interpreter.interpret("  Pipeline?  ").getOriginalQuery()).isEqualTo("  Pipeline?  ");
    }
}

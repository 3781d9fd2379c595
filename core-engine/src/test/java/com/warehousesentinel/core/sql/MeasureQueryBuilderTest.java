package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.TestDefinitions;
import com.warehousesentinel.core.model.Aggregation;
import com.warehousesentinel.core.model.FilterCondition;
import com.warehousesentinel.core.model.Measure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MeasureQueryBuilder}.
 */
class MeasureQueryBuilderTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 1, 31);

    private MeasureQueryBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new MeasureQueryBuilder();
    }

    @Test
    @DisplayName("Should slice the measure by dimensions with bound dates and filter values")
    void shouldBuildParameterizedQuery() {
        MeasureQuery query = new MeasureQuery(START, END,
                List.of("campaign_id", "date"),
                List.of("clicks", "impressions"),
                List.of(FilterCondition.of("channel", "in", List.of("search", "social")),
                        FilterCondition.of("campaign_name", "contains", "brand"),
                        FilterCondition.of("account_id", "=", null)));

        ParameterizedQuery result = builder.buildQuery(TestDefinitions.dailySpend(),
                TestDefinitions.adPerformance(), query);

        assertThat(result.sql()).isEqualTo("SELECT\n"
                + "  `campaign_id`,\n"
                + "  `date`,\n"
                + "  SUM(`spend`) AS value,\n"
                + "  SUM(`clicks`) AS `clicks`,\n"
                + "  SUM(`impressions`) AS `impressions`\n"
                + "FROM `entities.ad_performance`\n"
                + "WHERE `date` >= @start_date\n"
                + "  AND `date` <= @end_date\n"
                + "  AND `channel` IN UNNEST(@f0)\n"
                + "  AND `campaign_name` LIKE CONCAT('%', @f1, '%')\n"
                + "  AND `account_id` IS NULL\n"
                + "GROUP BY `campaign_id`, `date`\n"
                + "ORDER BY `date` ASC");
        assertThat(result.params())
                .containsEntry(MeasureQueryBuilder.START_DATE_PARAM, START)
                .containsEntry(MeasureQueryBuilder.END_DATE_PARAM, END)
                .containsEntry("f0", List.of("search", "social"))
                .containsEntry("f1", "brand")
                .hasSize(4);
    }

    @Test
    @DisplayName("Should apply the measure's own filters before the caller's")
    void shouldMergeMeasureFilters() {
        Measure measure = new Measure("paid_clicks", "ad_performance", null, null,
                Measure.Value.of("clicks", Aggregation.SUM), List.of("date"),
                List.of(FilterCondition.of("channel", "!=", "organic")));
        MeasureQuery query = new MeasureQuery(START, END, List.of("date"), List.of(),
                List.of(FilterCondition.of("spend", ">", 10)));

        ParameterizedQuery result = builder.buildQuery(measure, TestDefinitions.adPerformance(), query);

        assertThat(result.sql())
                .contains("  AND `channel` != @f0\n  AND `spend` > @f1\n");
        assertThat(result.params()).containsEntry("f0", "organic").containsEntry("f1", 10);
    }

    @Test
    @DisplayName("Should use the raw expression for expression measures")
    void shouldRenderExpressionMeasure() {
        Measure measure = new Measure("cpc", "ad_performance", null, null,
                Measure.Value.expression("SAFE_DIVIDE(SUM(spend), SUM(clicks))"), List.of(), List.of());

        ParameterizedQuery result = builder.buildQuery(measure, TestDefinitions.adPerformance(),
                new MeasureQuery(START, END, List.of("date"), List.of(), List.of()));

        assertThat(result.sql()).contains("  SAFE_DIVIDE(SUM(spend), SUM(clicks)) AS value\n");
        assertThat(measure.metricName()).isEqualTo("cpc");
    }

    @Test
    @DisplayName("Should reject ordering operators against null")
    void shouldRejectNullComparison() {
        MeasureQuery query = new MeasureQuery(START, END, List.of("date"), List.of(),
                List.of(FilterCondition.of("spend", ">", null)));

        assertThatThrownBy(() -> builder.buildQuery(TestDefinitions.dailySpend(),
                TestDefinitions.adPerformance(), query))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("needs a value");
    }

    @Test
    @DisplayName("Should reject an inverted date range")
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> new MeasureQuery(END, START, List.of(), List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

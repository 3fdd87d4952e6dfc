package it.floro.marginboard.service;

import it.floro.marginboard.config.DashboardProperties;
import it.floro.marginboard.domain.ChartCell;
import it.floro.marginboard.domain.ChartRow;
import it.floro.marginboard.domain.ProductPeriodMetric;
import it.floro.marginboard.domain.Quarter;
import it.floro.marginboard.domain.RawRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static it.floro.marginboard.service.RevenueAggregatorTest.assertDecimal;
import static it.floro.marginboard.service.RevenueAggregatorTest.rec;
import static org.junit.jupiter.api.Assertions.*;

public class ChartTableBuilderTest {

    private static final List<String> PRODUCTS = List.of("Widget Pro", "Widget Standard");
    private static final List<String> PERIODS = List.of("2023 Q1", "2023 Q2", "2023 Q3");

    private final RevenueAggregator aggregator = new RevenueAggregator();
    private final MetricsGridBuilder gridBuilder = new MetricsGridBuilder(
            aggregator, new HealthClassifier(DashboardProperties.defaults()));
    private final ChartTableBuilder chartBuilder = new ChartTableBuilder(aggregator);

    private final List<RawRecord> records = List.of(
            rec("Widget Pro", 2023, Quarter.Q1, "1000", "400"),
            rec("Widget Pro", 2023, Quarter.Q2, "1000", "150"),
            rec("Widget Standard", 2023, Quarter.Q1, "200", "50"),
            rec("Service Package", 2023, Quarter.Q2, "500", "100"));

    private List<ChartRow> chart(String excluded) {
        List<ProductPeriodMetric> grid = gridBuilder.build(records, PRODUCTS, PERIODS);
        return chartBuilder.build(grid, records, PRODUCTS, PERIODS, excluded);
    }

    @Test
    void oneRowPerPeriodWithProductColumnsInOrder() {
        List<ChartRow> rows = chart("2023 Q1");

        assertEquals(PERIODS, rows.stream().map(ChartRow::period).toList());
        for (ChartRow row : rows) {
            assertEquals(PRODUCTS, List.copyOf(row.productMargins().keySet()));
        }
    }

    @Test
    void excludedPeriodKeepsLabelButIsNotPlottable() {
        ChartRow first = chart("2023 Q1").get(0);

        assertEquals("2023 Q1", first.period());
        assertTrue(first.isExcluded());
        assertSame(ChartCell.EXCLUDED, first.totalRevenue());
        first.productMargins().values().forEach(c -> assertSame(ChartCell.EXCLUDED, c));
    }

    @Test
    void productCellsCarryTheGridMargin() {
        ChartRow q2 = chart("2023 Q1").get(1);
        assertDecimal("0.15", q2.productMargins().get("Widget Pro").value());
    }

    @Test
    void missingMarginBecomesZero() {
        List<ChartRow> rows = chart("2023 Q1");
        assertDecimal("0", rows.get(1).productMargins().get("Widget Standard").value());
        assertDecimal("0", rows.get(2).productMargins().get("Widget Pro").value());
        assertFalse(rows.get(2).isExcluded());
    }

    @Test
    void totalRevenueComesFromRawRecords() {
        List<ChartRow> rows = chart("2023 Q1");
        // Service Package non è una colonna del grafico ma conta nel totale
        assertDecimal("1500", rows.get(1).totalRevenue().value());
        assertDecimal("0", rows.get(2).totalRevenue().value());
    }

    @Test
    void blankExcludedPeriodExcludesNothing() {
        List<ChartRow> rows = chart(" ");
        assertFalse(rows.get(0).isExcluded());
        assertDecimal("1200", rows.get(0).totalRevenue().value());
        assertDecimal("0.25", rows.get(0).productMargins().get("Widget Standard").value());
    }

    @Test
    void unknownExcludedPeriodLeavesTableIntact() {
        List<ChartRow> rows = chart("2019 Q1");
        assertTrue(rows.stream().noneMatch(ChartRow::isExcluded));
    }

    @Test
    void chartColumnsCanDifferFromGridProducts() {
        List<ProductPeriodMetric> grid = gridBuilder.build(records, PRODUCTS, PERIODS);
        List<ChartRow> rows = chartBuilder.build(grid, records, List.of("Widget Standard"), PERIODS, "2023 Q3");

        assertEquals(List.of("Widget Standard"), List.copyOf(rows.get(0).productMargins().keySet()));
        assertTrue(rows.get(2).isExcluded());
    }

    @Test
    void malformedPeriodYieldsZeroTotal() {
        List<String> periods = List.of("2023 Q1", "2023/Q2");
        List<ProductPeriodMetric> grid = gridBuilder.build(records, PRODUCTS, periods);
        List<ChartRow> rows = chartBuilder.build(grid, records, PRODUCTS, periods, "2023 Q1");

        assertEquals("2023/Q2", rows.get(1).period());
        assertDecimal("0", rows.get(1).totalRevenue().value());
        assertDecimal("0", rows.get(1).productMargins().get("Widget Pro").value());
    }
}

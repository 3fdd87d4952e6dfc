package it.floro.marginboard.service;

import it.floro.marginboard.config.DashboardProperties;
import it.floro.marginboard.domain.ChartRow;
import it.floro.marginboard.domain.DashboardReport;
import it.floro.marginboard.domain.HealthStatus;
import it.floro.marginboard.domain.ProductPeriodMetric;
import it.floro.marginboard.error.EmptyDatasetException;
import it.floro.marginboard.error.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static it.floro.marginboard.service.RevenueAggregatorTest.assertDecimal;
import static org.junit.jupiter.api.Assertions.*;

public class MarginDashboardServiceTest {

    private static final List<Object> HEADER = List.of("Order ID", "Year", "Quarter", "Product", "Revenue", "Cost", "Margin");

    private static final List<List<Object>> SHEET = List.of(
            HEADER,
            List.of("SO-1", 2023, "Q1", "Widget Pro", 1000, 600, 400),
            List.of("SO-2", 2023, "Q2", "Widget Pro", 1000, 850, 150),
            List.of("SO-3", 2023, "Q2", "Service Package", 500, 400, 100));

    private static MarginDashboardService service(DashboardProperties props) {
        RevenueAggregator aggregator = new RevenueAggregator();
        return new MarginDashboardService(
                props,
                new RawDataLoader(props),
                new MetricsGridBuilder(aggregator, new HealthClassifier(props)),
                new ChartTableBuilder(aggregator));
    }

    @Test
    void computesGridAndChartFromSheet() {
        DashboardReport report = service(DashboardProperties.defaults()).compute(SHEET);

        assertEquals(32, report.grid().size());
        assertEquals(8, report.chart().size());

        ProductPeriodMetric q2 = report.grid().get(1);
        assertEquals("Widget Pro", q2.product());
        assertEquals("2023 Q2", q2.period());
        assertDecimal("0.15", q2.weightedAvgMargin());
        assertDecimal("-0.25", q2.trailingDelta());
        assertEquals(HealthStatus.AT_RISK, q2.health());

        ChartRow first = report.chart().get(0);
        assertEquals("2023 Q1", first.period());
        assertTrue(first.isExcluded());

        ChartRow second = report.chart().get(1);
        assertDecimal("0.15", second.productMargins().get("Widget Pro").value());
        assertDecimal("0.2", second.productMargins().get("Service Package").value());
        assertDecimal("0", second.productMargins().get("Accessory Kit").value());
        assertDecimal("1500", second.totalRevenue().value());
    }

    @Test
    void configurationDrivesProductsPeriodsAndExclusion() {
        DashboardProperties props = new DashboardProperties(null,
                List.of("Widget Pro"),
                List.of("Widget Pro", "Service Package"),
                List.of("2023 Q1", "2023 Q2"),
                "",
                null, null);

        DashboardReport report = service(props).compute(SHEET);

        assertEquals(2, report.grid().size());
        assertEquals(2, report.chart().size());
        assertFalse(report.chart().get(0).isExcluded());
        assertDecimal("1000", report.chart().get(0).totalRevenue().value());
        assertEquals(List.of("Widget Pro", "Service Package"),
                List.copyOf(report.chart().get(1).productMargins().keySet()));
    }

    @Test
    void outOfRangeCellDoesNotAbortTheBatch() {
        DashboardReport report = service(DashboardProperties.defaults()).compute(List.of(
                HEADER,
                List.of("SO-1", 2023, "Q2", "Widget Pro", "1e999999999", 0, 10),
                List.of("SO-2", 2023, "Q2", "Widget Pro", 1000, 600, 400)));

        ProductPeriodMetric q2 = report.grid().get(1);
        assertDecimal("1000", q2.totalRevenue());
        assertDecimal("0.41", q2.weightedAvgMargin());
        assertDecimal("1000", report.chart().get(1).totalRevenue().value());
    }

    @Test
    void schemaErrorsAbortTheComputation() {
        MarginDashboardService service = service(DashboardProperties.defaults());

        assertThrows(EmptyDatasetException.class, () -> service.compute(List.of(HEADER)));
        SchemaException ex = assertThrows(SchemaException.class, () -> service.compute(List.of(
                List.of("Year", "Quarter", "Product"),
                List.of(2023, "Q1", "Widget Pro"))));
        assertEquals(List.of("Revenue", "Margin"), ex.getMissingHeaders());
    }
}

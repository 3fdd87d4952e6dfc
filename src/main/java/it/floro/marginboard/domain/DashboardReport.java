package it.floro.marginboard.domain;

import java.util.List;

/**
 * Le due tabelle calcolate, consegnate in sola lettura al renderer esterno.
 */
public record DashboardReport(
        List<ProductPeriodMetric> grid,     // Ordinata per prodotto, poi per periodo
        List<ChartRow> chart                // Ordinata per periodo
) {}

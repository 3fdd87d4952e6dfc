package it.floro.marginboard.domain;

import java.math.BigDecimal;

/**
 * Riga della griglia metriche: un prodotto in un periodo.
 *
 * I campi nullable valgono null quando il dato non è disponibile (N/A).
 * Invarianti:
 * - weightedAvgMargin è null esattamente quando totalRevenue è zero
 * - health è NOT_AVAILABLE esattamente quando weightedAvgMargin è null
 */
public record ProductPeriodMetric(
        String product,                     // Prodotto
        String period,                      // Etichetta periodo "YYYY Qn"
        BigDecimal totalRevenue,            // Somma ricavi del prodotto nel periodo
        BigDecimal weightedAvgMargin,       // Margine / ricavo (nullable)
        BigDecimal trailingDelta,           // Variazione vs trimestre precedente (nullable)
        BigDecimal yoyDelta,                // Variazione vs stesso trimestre anno precedente (nullable)
        HealthStatus health                 // Classificazione del margine
) {

    public boolean hasMargin() {
        return weightedAvgMargin != null;
    }
}

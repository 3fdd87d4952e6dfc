package it.floro.marginboard.service;

import it.floro.marginboard.domain.Period;
import it.floro.marginboard.domain.ProductPeriodMetric;
import it.floro.marginboard.domain.RawRecord;
import it.floro.marginboard.error.PeriodFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Service che costruisce la griglia metriche prodotto × periodo.
 *
 * Per ogni prodotto (blocco contiguo) e per ogni periodo della sequenza, in ordine:
 * 1. Ricavo totale: somma ricavi del prodotto nel periodo
 * 2. Margine medio ponderato: somma margini / ricavo (null se ricavo = 0)
 * 3. Trailing delta: margine - margine della riga precedente nello stesso blocco prodotto
 * 4. YoY delta: margine - margine dello stesso prodotto, stesso trimestre, anno precedente
 * 5. Health: classificazione del margine
 *
 * Le colonne 3 e 4 leggono righe già calcolate, per cui la costruzione avviene
 * in due passate: prima ricavi e margini per tutta la griglia, poi i delta.
 *
 * Etichette di periodo non valide non interrompono il calcolo: la riga
 * corrispondente esce con ricavo 0 e tutti i campi N/A.
 */
@Service
public class MetricsGridBuilder {

    private static final Logger logger = LoggerFactory.getLogger(MetricsGridBuilder.class);

    private final RevenueAggregator aggregator;
    private final HealthClassifier classifier;

    public MetricsGridBuilder(RevenueAggregator aggregator, HealthClassifier classifier) {
        this.aggregator = aggregator;
        this.classifier = classifier;
    }

    /**
     * Costruisce la griglia completa.
     *
     * @param records Record grezzi
     * @param products Prodotti della griglia, nell'ordine dei blocchi
     * @param periodLabels Sequenza ordinata di etichette "YYYY Qn"
     * @return Lista immutabile ordinata per prodotto, poi per periodo
     */
    public List<ProductPeriodMetric> build(List<RawRecord> records, List<String> products, List<String> periodLabels) {
        List<Period> periods = parsePeriods(periodLabels);
        Integer firstYear = periods.stream()
                .filter(Objects::nonNull)
                .findFirst()
                .map(Period::year)
                .orElse(null);

        // ===== PASSATA 1: RICAVI E MARGINI =====
        List<List<Cell>> blocks = new ArrayList<>(products.size());
        List<Cell> gridOrder = new ArrayList<>(products.size() * periodLabels.size());
        for (String product : products) {
            List<Cell> block = new ArrayList<>(periodLabels.size());
            for (int i = 0; i < periodLabels.size(); i++) {
                Period period = periods.get(i);
                Cell cell = (period == null)
                        ? new Cell(product, periodLabels.get(i), null, BigDecimal.ZERO, null)
                        : revenueAndMargin(records, product, periodLabels.get(i), period);
                block.add(cell);
                gridOrder.add(cell);
            }
            blocks.add(block);
        }

        // ===== PASSATA 2: DELTA E CLASSIFICAZIONE =====
        List<ProductPeriodMetric> grid = new ArrayList<>(gridOrder.size());
        for (List<Cell> block : blocks) {
            for (int i = 0; i < block.size(); i++) {
                Cell cell = block.get(i);
                BigDecimal trailing = (i == 0 || cell.period() == null)
                        ? null
                        : delta(cell.margin(), block.get(i - 1).margin());
                BigDecimal yoy = yoyDelta(cell, gridOrder, firstYear);

                grid.add(new ProductPeriodMetric(
                        cell.product(),
                        cell.label(),
                        cell.revenue(),
                        cell.margin(),
                        trailing,
                        yoy,
                        classifier.classify(cell.margin())
                ));
            }
        }

        logger.debug("Griglia metriche costruita: {} prodotti × {} periodi", products.size(), periodLabels.size());
        return Collections.unmodifiableList(grid);
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    private Cell revenueAndMargin(List<RawRecord> records, String product, String label, Period period) {
        BigDecimal revenue = aggregator.sumRevenue(records, product, period);
        BigDecimal margin = null;
        if (revenue.signum() != 0) {
            margin = aggregator.sumMargin(records, product, period).divide(revenue, MathContext.DECIMAL64);
        }
        return new Cell(product, label, period, revenue, margin);
    }

    /**
     * Cerca, in ordine di griglia, la prima riga dello stesso prodotto nello stesso
     * trimestre dell'anno precedente. Con righe duplicate vince la prima.
     */
    private static BigDecimal yoyDelta(Cell cell, List<Cell> gridOrder, Integer firstYear) {
        if (cell.period() == null || firstYear == null || cell.period().year() == firstYear) {
            return null;
        }
        Period target = cell.period().sameQuarterPreviousYear();
        return gridOrder.stream()
                .filter(c -> c.product().equals(cell.product()) && target.equals(c.period()))
                .findFirst()
                .map(prior -> delta(cell.margin(), prior.margin()))
                .orElse(null);
    }

    private static BigDecimal delta(BigDecimal current, BigDecimal previous) {
        if (current == null || previous == null) return null;
        return current.subtract(previous);
    }

    private static List<Period> parsePeriods(List<String> labels) {
        List<Period> out = new ArrayList<>(labels.size());
        for (String label : labels) {
            try {
                out.add(Period.parse(label));
            } catch (PeriodFormatException e) {
                logger.warn("Periodo non valido, riga impostata a N/A: {}", e.getMessage());
                out.add(null);
            }
        }
        return out;
    }

    /** Stato intermedio di una riga tra le due passate. */
    private record Cell(String product, String label, Period period, BigDecimal revenue, BigDecimal margin) {}
}

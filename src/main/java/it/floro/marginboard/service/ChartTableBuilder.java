package it.floro.marginboard.service;

import it.floro.marginboard.domain.ChartCell;
import it.floro.marginboard.domain.ChartRow;
import it.floro.marginboard.domain.Period;
import it.floro.marginboard.domain.ProductPeriodMetric;
import it.floro.marginboard.domain.RawRecord;
import it.floro.marginboard.error.PeriodFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service che rimodella la griglia metriche nella tabella "Chart Data".
 *
 * Struttura di output: una riga per periodo, una colonna per prodotto
 * (margine medio ponderato) e la colonna "Total Revenue".
 *
 * Regole:
 * - Margine N/A → 0, così ogni riga resta numerica
 * - Total Revenue è calcolato direttamente dai record grezzi, non dalle colonne prodotto
 * - La riga del periodo escluso mantiene l'etichetta ma tutte le celle diventano "#N/A"
 */
@Service
public class ChartTableBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ChartTableBuilder.class);

    private final RevenueAggregator aggregator;

    public ChartTableBuilder(RevenueAggregator aggregator) {
        this.aggregator = aggregator;
    }

    /**
     * Costruisce la tabella sorgente del grafico.
     *
     * @param grid Griglia metriche completa
     * @param records Record grezzi (per il ricavo totale per periodo)
     * @param chartProducts Colonne prodotto, nell'ordine di visualizzazione
     * @param periodLabels Sequenza ordinata di etichette "YYYY Qn"
     * @param excludedPeriod Etichetta del periodo da non tracciare (blank = nessuno)
     * @return Lista immutabile di ChartRow ordinata per periodo
     */
    public List<ChartRow> build(List<ProductPeriodMetric> grid,
                                List<RawRecord> records,
                                List<String> chartProducts,
                                List<String> periodLabels,
                                String excludedPeriod) {
        List<ChartRow> rows = new ArrayList<>(periodLabels.size());

        for (String label : periodLabels) {
            String key = label.trim();

            Map<String, ChartCell> margins = new LinkedHashMap<>();
            for (String product : chartProducts) {
                margins.put(product, ChartCell.of(marginOf(grid, product, key)));
            }

            rows.add(new ChartRow(key, Collections.unmodifiableMap(margins), ChartCell.of(totalRevenue(records, key))));
        }

        // Periodo escluso: etichetta visibile, nessun punto tracciato
        if (excludedPeriod != null && !excludedPeriod.isBlank()) {
            String excludedKey = excludedPeriod.trim();
            boolean found = false;
            for (int i = 0; i < rows.size(); i++) {
                if (rows.get(i).period().equals(excludedKey)) {
                    rows.set(i, excluded(rows.get(i)));
                    found = true;
                }
            }
            if (!found) {
                logger.warn("Periodo escluso '{}' non presente nella sequenza dei periodi", excludedKey);
            }
        }

        return Collections.unmodifiableList(rows);
    }

    // ========= METODI HELPER PRIVATI =========

    /**
     * Somma dei margini delle righe di griglia per (prodotto, periodo), N/A contato come 0.
     * Con una griglia senza duplicati restituisce il margine della singola riga.
     */
    private static BigDecimal marginOf(List<ProductPeriodMetric> grid, String product, String periodKey) {
        return grid.stream()
                .filter(m -> m.period().trim().equals(periodKey) && m.product().equals(product))
                .map(m -> m.hasMargin() ? m.weightedAvgMargin() : BigDecimal.ZERO)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private BigDecimal totalRevenue(List<RawRecord> records, String periodKey) {
        try {
            return aggregator.sumRevenueByPeriod(records, Period.parse(periodKey));
        } catch (PeriodFormatException e) {
            logger.warn("Ricavo totale impostato a 0: {}", e.getMessage());
            return BigDecimal.ZERO;
        }
    }

    private static ChartRow excluded(ChartRow row) {
        Map<String, ChartCell> blank = new LinkedHashMap<>();
        row.productMargins().keySet().forEach(p -> blank.put(p, ChartCell.EXCLUDED));
        return new ChartRow(row.period(), Collections.unmodifiableMap(blank), ChartCell.EXCLUDED);
    }
}

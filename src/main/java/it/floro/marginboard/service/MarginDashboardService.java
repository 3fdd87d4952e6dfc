package it.floro.marginboard.service;

import it.floro.marginboard.config.DashboardProperties;
import it.floro.marginboard.domain.ChartRow;
import it.floro.marginboard.domain.DashboardReport;
import it.floro.marginboard.domain.ProductPeriodMetric;
import it.floro.marginboard.domain.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service centralizzato che esegue la pipeline del dashboard margini.
 *
 * Flusso (unidirezionale, ogni stadio consuma per intero l'output del precedente):
 * 1. RawDataLoader: matrice di valori → RawRecord tipizzati
 * 2. MetricsGridBuilder: RawRecord → griglia prodotto × periodo (usa RevenueAggregator)
 * 3. ChartTableBuilder: griglia + RawRecord → tabella "Chart Data"
 *
 * Le liste fisse (prodotti, periodi, periodo escluso) arrivano dalla configurazione
 * e vengono passate esplicitamente a ogni stadio.
 */
@Service
public class MarginDashboardService {

    private static final Logger logger = LoggerFactory.getLogger(MarginDashboardService.class);

    private final DashboardProperties properties;
    private final RawDataLoader loader;
    private final MetricsGridBuilder gridBuilder;
    private final ChartTableBuilder chartBuilder;

    public MarginDashboardService(DashboardProperties properties,
                                  RawDataLoader loader,
                                  MetricsGridBuilder gridBuilder,
                                  ChartTableBuilder chartBuilder) {
        this.properties = properties;
        this.loader = loader;
        this.gridBuilder = gridBuilder;
        this.chartBuilder = chartBuilder;
    }

    /**
     * Calcola griglia e tabella grafico per un foglio dati grezzi.
     *
     * @param values Matrice di celle, prima riga = intestazioni
     * @return Report con le due tabelle
     * @throws it.floro.marginboard.error.EmptyDatasetException se non ci sono righe dati
     * @throws it.floro.marginboard.error.SchemaException se mancano intestazioni obbligatorie
     */
    public DashboardReport compute(List<? extends List<?>> values) {
        return computeFromRecords(loader.load(values));
    }

    /**
     * Calcola griglia e tabella grafico per record già caricati.
     */
    public DashboardReport computeFromRecords(List<RawRecord> records) {
        List<ProductPeriodMetric> grid = gridBuilder.build(records, properties.products(), properties.periods());
        List<ChartRow> chart = chartBuilder.build(grid, records, properties.chartProducts(),
                properties.periods(), properties.excludedPeriod());

        logger.info("Dashboard calcolato: {} record grezzi, {} righe griglia, {} righe grafico",
                records.size(), grid.size(), chart.size());
        return new DashboardReport(grid, chart);
    }
}

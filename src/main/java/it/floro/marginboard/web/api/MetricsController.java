package it.floro.marginboard.web.api;

import it.floro.marginboard.domain.ChartRow;
import it.floro.marginboard.domain.DashboardReport;
import it.floro.marginboard.domain.ProductPeriodMetric;
import it.floro.marginboard.service.MarginDashboardService;
import it.floro.marginboard.service.RawDataService;
import it.floro.marginboard.web.dto.DatasetRequest;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller REST che espone le tabelle calcolate del dashboard margini.
 *
 * Mapping base: /api/metrics
 *
 * Flusso tipico:
 * 1. Client chiama GET /api/metrics/report → griglia + tabella grafico del dataset corrente
 * 2. Client carica un nuovo foglio con PUT /api/metrics/dataset
 * 3. Client calcola un foglio "al volo" con POST /api/metrics/report senza salvarlo
 */
@RestController
@RequestMapping("/api/metrics")
public class MetricsController {

    private final MarginDashboardService dashboardService;
    private final RawDataService rawDataService;

    public MetricsController(MarginDashboardService dashboardService, RawDataService rawDataService) {
        this.dashboardService = dashboardService;
        this.rawDataService = rawDataService;
    }

    /**
     * Griglia metriche prodotto × periodo del dataset corrente.
     *
     * Esempio di elemento (JSON):
     * {
     *   "product": "Widget Pro",
     *   "period": "2023 Q2",
     *   "totalRevenue": 1000,
     *   "weightedAvgMargin": 0.15,
     *   "trailingDelta": -0.25,
     *   "yoyDelta": null,
     *   "health": "AT_RISK"
     * }
     */
    @GetMapping("/grid")
    public List<ProductPeriodMetric> grid() {
        return currentReport().grid();
    }

    /**
     * Tabella "Chart Data" del dataset corrente. Le celle del periodo escluso valgono "#N/A".
     */
    @GetMapping("/chart")
    public List<ChartRow> chart() {
        return currentReport().chart();
    }

    @GetMapping("/report")
    public DashboardReport report() {
        return currentReport();
    }

    /**
     * Calcola il report per il foglio nel body, senza sostituire il dataset corrente.
     */
    @PostMapping("/report")
    public DashboardReport compute(@RequestBody DatasetRequest request) {
        return dashboardService.compute(request.values());
    }

    /**
     * Sostituisce il dataset corrente e restituisce il report ricalcolato.
     * Un foglio non valido (400) lascia invariato il dataset.
     */
    @PutMapping("/dataset")
    public DashboardReport replaceDataset(@RequestBody DatasetRequest request) {
        return dashboardService.computeFromRecords(rawDataService.replace(request.values()));
    }

    /**
     * Ripristina il dataset di esempio generato dal simulatore.
     */
    @PostMapping("/dataset/regenerate")
    public DashboardReport regenerate() {
        rawDataService.regenerate();
        return currentReport();
    }

    private DashboardReport currentReport() {
        return dashboardService.computeFromRecords(rawDataService.getRecords());
    }
}

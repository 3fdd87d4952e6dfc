package it.floro.marginboard.web;

import it.floro.marginboard.config.DashboardProperties;
import it.floro.marginboard.domain.ChartCell;
import it.floro.marginboard.domain.ChartRow;
import it.floro.marginboard.domain.DashboardReport;
import it.floro.marginboard.domain.ProductPeriodMetric;
import it.floro.marginboard.service.MarginDashboardService;
import it.floro.marginboard.service.RawDataService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Export CSV compatibile Excel ITA delle due tabelle calcolate:
 * - Separatore di campo: ';'
 * - Decimali con virgola
 * - BOM UTF-8 per migliorare riconoscimento in Excel
 * - Valori non disponibili: "N/A" nella griglia, "#N/A" nel grafico
 */
@Controller
public class ExportController {

    private static final char DELIMITER = ';';
    private static final String NEWLINE = "\n";
    private static final String NOT_AVAILABLE = "N/A";
    private static final String FORMULA_PREFIXES = "=+-@";
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final MediaType CSV_UTF8 = MediaType.parseMediaType("text/csv; charset=UTF-8");

    private final MarginDashboardService dashboardService;
    private final RawDataService rawDataService;
    private final DashboardProperties properties;

    public ExportController(MarginDashboardService dashboardService,
                            RawDataService rawDataService,
                            DashboardProperties properties) {
        this.dashboardService = dashboardService;
        this.rawDataService = rawDataService;
        this.properties = properties;
    }

    @GetMapping("/export/grid")
    public ResponseEntity<byte[]> exportGrid() {
        List<ProductPeriodMetric> grid = currentReport().grid();

        StringBuilder sb = new StringBuilder(128 + grid.size() * 96);
        sb.append(String.join(String.valueOf(DELIMITER),
                "Product",
                "Quarter",
                "Total Revenue",
                "Weighted Avg Margin",
                "Rolling Trend",
                "YoY Margin Delta",
                "Health"
        )).append(NEWLINE);

        for (ProductPeriodMetric m : grid) {
            sb.append(safe(m.product()))
                    .append(DELIMITER).append(safe(m.period()))
                    .append(DELIMITER).append(numIt(m.totalRevenue(), 2))
                    .append(DELIMITER).append(numIt(m.weightedAvgMargin(), 4))
                    .append(DELIMITER).append(numIt(m.trailingDelta(), 4))
                    .append(DELIMITER).append(numIt(m.yoyDelta(), 4))
                    .append(DELIMITER).append(m.health().label())
                    .append(NEWLINE);
        }

        return csv(sb, "dashboard_grid.csv");
    }

    @GetMapping("/export/chart")
    public ResponseEntity<byte[]> exportChart() {
        List<ChartRow> chart = currentReport().chart();

        List<String> header = new ArrayList<>();
        header.add("Quarter");
        header.addAll(properties.chartProducts());
        header.add("Total Revenue");

        StringBuilder sb = new StringBuilder(128 + chart.size() * 96);
        sb.append(String.join(String.valueOf(DELIMITER), header.stream().map(this::safe).toList())).append(NEWLINE);

        for (ChartRow row : chart) {
            sb.append(safe(row.period()));
            for (ChartCell cell : row.productMargins().values()) {
                sb.append(DELIMITER).append(cellIt(cell, 4));
            }
            sb.append(DELIMITER).append(cellIt(row.totalRevenue(), 2)).append(NEWLINE);
        }

        return csv(sb, "dashboard_chart.csv");
    }

    // ===================== Helpers =====================

    private DashboardReport currentReport() {
        return dashboardService.computeFromRecords(rawDataService.getRecords());
    }

    private ResponseEntity<byte[]> csv(StringBuilder sb, String filename) {
        byte[] body = sb.toString().getBytes(StandardCharsets.UTF_8);
        byte[] bytes = Arrays.copyOf(UTF8_BOM, UTF8_BOM.length + body.length);
        System.arraycopy(body, 0, bytes, UTF8_BOM.length, body.length);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(CSV_UTF8)
                .contentLength(bytes.length)
                .body(bytes);
    }

    /**
     * Nomi prodotto e periodi: niente apici né a-capo; apostrofo davanti a = + - @
     * perché Excel non li interpreti come formula.
     */
    private String safe(String s) {
        if (s == null) return "";
        String cleaned = s.replace("\"", "").replaceAll("[\r\n]", " ");
        if (!cleaned.isEmpty() && FORMULA_PREFIXES.indexOf(cleaned.charAt(0)) >= 0) {
            return "'" + cleaned;
        }
        return cleaned;
    }

    /**
     * Formatta con la scala indicata, punto → virgola (locale ITA), senza grouping.
     */
    private String numIt(BigDecimal v, int scale) {
        if (v == null) return NOT_AVAILABLE;
        return v.setScale(scale, RoundingMode.HALF_UP).toPlainString().replace('.', ',');
    }

    private String cellIt(ChartCell cell, int scale) {
        return cell.isExcluded() ? ChartCell.NOT_PLOTTABLE : numIt(cell.value(), scale);
    }
}

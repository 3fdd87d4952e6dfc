package it.floro.marginboard.service;

import it.floro.marginboard.config.DashboardProperties;
import it.floro.marginboard.domain.HealthStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Classifica il margine medio ponderato in fasce di salute.
 *
 * Regole (default):
 * - null → NOT_AVAILABLE
 * - margine > 0.35 → STRONG (0.35 esatto è Moderate)
 * - 0.20 ≤ margine ≤ 0.35 → MODERATE
 * - margine < 0.20 → AT_RISK
 */
@Component
public class HealthClassifier {

    private final BigDecimal strongAbove;
    private final BigDecimal moderateFrom;

    public HealthClassifier(DashboardProperties properties) {
        this.strongAbove = properties.health().strongAbove();
        this.moderateFrom = properties.health().moderateFrom();
    }

    public HealthStatus classify(BigDecimal margin) {
        if (margin == null) return HealthStatus.NOT_AVAILABLE;
        if (margin.compareTo(strongAbove) > 0) return HealthStatus.STRONG;
        if (margin.compareTo(moderateFrom) >= 0) return HealthStatus.MODERATE;
        return HealthStatus.AT_RISK;
    }
}

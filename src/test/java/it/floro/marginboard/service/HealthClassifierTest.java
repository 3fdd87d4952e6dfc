package it.floro.marginboard.service;

import it.floro.marginboard.config.DashboardProperties;
import it.floro.marginboard.domain.HealthStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class HealthClassifierTest {

    private final HealthClassifier classifier = new HealthClassifier(DashboardProperties.defaults());

    @Test
    void strongBoundaryIsExclusive() {
        assertEquals(HealthStatus.MODERATE, classifier.classify(new BigDecimal("0.35")));
        assertEquals(HealthStatus.STRONG, classifier.classify(new BigDecimal("0.3500001")));
    }

    @Test
    void moderateBoundaryIsInclusive() {
        assertEquals(HealthStatus.MODERATE, classifier.classify(new BigDecimal("0.20")));
        assertEquals(HealthStatus.AT_RISK, classifier.classify(new BigDecimal("0.1999")));
    }

    @Test
    void negativeMarginIsAtRisk() {
        assertEquals(HealthStatus.AT_RISK, classifier.classify(new BigDecimal("-0.05")));
    }

    @Test
    void missingMarginIsNotAvailable() {
        assertEquals(HealthStatus.NOT_AVAILABLE, classifier.classify(null));
    }

    @Test
    void thresholdsAreConfigurable() {
        DashboardProperties props = new DashboardProperties(null, null, null, null, null,
                new DashboardProperties.Health(new BigDecimal("0.50"), new BigDecimal("0.10")), null);
        HealthClassifier custom = new HealthClassifier(props);

        assertEquals(HealthStatus.MODERATE, custom.classify(new BigDecimal("0.40")));
        assertEquals(HealthStatus.MODERATE, custom.classify(new BigDecimal("0.10")));
        assertEquals(HealthStatus.STRONG, custom.classify(new BigDecimal("0.51")));
    }
}

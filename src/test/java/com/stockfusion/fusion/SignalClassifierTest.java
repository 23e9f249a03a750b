package com.stockfusion.fusion;

import com.stockfusion.config.FusionParams;
import com.stockfusion.model.ConfidenceLevel;
import com.stockfusion.model.RiskLevel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalClassifierTest {
    private final SignalClassifier classifier = new SignalClassifier();
    private final FusionParams params = FusionParams.defaults();

    @Test
    void agreeingStrongSignalsShouldBeHighConfidenceLowRisk() {
        assertTrue(classifier.signsAgree(0.95, 1.8));
        assertEquals(0.9, classifier.confidenceRaw(0.95, 1.8), 1e-9);
        assertEquals(ConfidenceLevel.HIGH, classifier.confidence(0.95, 1.8, params));
        assertEquals(0.1, classifier.riskRaw(0.95, 1.8, null), 1e-9);
        assertEquals(RiskLevel.LOW, classifier.risk(0.95, 1.8, null, params));
    }

    @Test
    void disagreementShouldUseStrengthGap() {
        assertFalse(classifier.signsAgree(0.9, -0.4));
        assertEquals(0.6, classifier.confidenceRaw(0.9, -0.4), 1e-9);
        assertEquals(ConfidenceLevel.MEDIUM, classifier.confidence(0.9, -0.4, params));

        assertEquals(0.0, classifier.confidenceRaw(0.7, -0.8), 1e-9);
        assertEquals(ConfidenceLevel.LOW, classifier.confidence(0.7, -0.8, params));
    }

    @Test
    void factorStrengthShouldSaturateAtTwo() {
        assertEquals(1.0, classifier.factorStrength(5.0), 1e-12);
        assertEquals(1.0, classifier.factorStrength(-2.0), 1e-12);
        assertEquals(0.25, classifier.factorStrength(0.5), 1e-12);
    }

    @Test
    void missingProbabilityShouldCountAsNoSignal() {
        assertFalse(classifier.signsAgree(null, 1.0));
        assertEquals(0.0, classifier.mlStrength(null));
        assertEquals(0.25, classifier.confidenceRaw(null, 1.0), 1e-12);
        assertEquals(0.75, classifier.riskRaw(null, 1.0, null), 1e-12);
        assertEquals(RiskLevel.HIGH, classifier.risk(null, 1.0, null, params));
    }

    @Test
    void volatilityShouldBlendIntoRisk() {
        assertEquals(0.5, classifier.riskRaw(0.95, 1.8, 0.9), 1e-9);
        assertEquals(RiskLevel.MEDIUM, classifier.risk(0.95, 1.8, 0.9, params));
        assertEquals(0.55, classifier.riskRaw(0.95, 1.8, 3.0), 1e-9);
        assertEquals(0.1, classifier.riskRaw(0.95, 1.8, Double.NaN), 1e-9);
        assertEquals(0.1, classifier.riskRaw(0.95, 1.8, -1.0), 1e-9);
    }

    @Test
    void thresholdsShouldComeFromParameters() {
        FusionParams strict = params.toBuilder().confidenceThreshold(0.95).riskThreshold(0.05).build();

        assertEquals(ConfidenceLevel.MEDIUM, classifier.confidence(0.95, 1.8, strict));
        assertEquals(RiskLevel.MEDIUM, classifier.risk(0.95, 1.8, null, strict));
    }
}

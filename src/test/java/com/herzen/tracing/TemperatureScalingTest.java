package com.herzen.tracing;

import com.herzen.tracing.calibration.CalibrationModels;
import com.herzen.tracing.calibration.TemperatureScaling;
import com.herzen.tracing.error.DegenerateCalibrationException;
import com.herzen.tracing.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemperatureScalingTest {
    private final TemperatureScaling scaling = new TemperatureScaling(TestProperties.defaults());

    @Test
    void separableDataEndsAtFiniteBound() {
        CalibrationModels.FitResult r = scaling.fit(List.of(-2.0, -1.0, 1.0, 2.0), List.of(0.0, 0.0, 1.0, 1.0));
        assertTrue(Double.isFinite(r.temperature()));
        assertEquals(0.05, r.temperature(), 1e-9);
    }

    @Test
    void overconfidentLogitsAreSoftened() {
        List<Double> logits = new ArrayList<>();
        List<Double> labels = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            logits.add(4.0);
            labels.add(i < 7 ? 1.0 : 0.0);
            logits.add(-4.0);
            labels.add(i < 7 ? 0.0 : 1.0);
        }
        CalibrationModels.FitResult r = scaling.fit(logits, labels);

        assertEquals(4.0 / Math.log(7.0 / 3.0), r.temperature(), 1e-3);
        assertTrue(r.nllAfter() < r.nllBefore());
        assertTrue(r.eceAfter() < r.eceBefore());
        assertEquals(20, r.sampleCount());
    }

    @Test
    void singleClassLabelsAreDegenerate() {
        assertThrows(DegenerateCalibrationException.class,
                () -> scaling.fit(List.of(0.5, 1.5, -0.3), List.of(1.0, 1.0, 1.0)));
    }

    @Test
    void malformedInputIsValidationError() {
        assertThrows(ValidationException.class, () -> scaling.fit(List.of(), List.of()));
        assertThrows(ValidationException.class, () -> scaling.fit(List.of(1.0, 2.0), List.of(1.0)));
        assertThrows(ValidationException.class, () -> scaling.fit(List.of(1.0, Double.NaN), List.of(1.0, 0.0)));
        assertThrows(ValidationException.class, () -> scaling.fit(List.of(1.0, 2.0), List.of(1.0, 0.5)));
    }

    @Test
    void applyWithUnitTemperatureIsIdentity() {
        assertEquals(0.8, TemperatureScaling.apply(0.8, 1.0), 1e-9);
        assertTrue(TemperatureScaling.apply(0.9, 3.0) < 0.9);
        assertTrue(TemperatureScaling.apply(0.9, 3.0) > 0.5);
        assertTrue(TemperatureScaling.apply(0.1, 3.0) > 0.1);
    }
}

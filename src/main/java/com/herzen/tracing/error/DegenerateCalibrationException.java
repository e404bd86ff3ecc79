package com.herzen.tracing.error;

public class DegenerateCalibrationException extends TracingException {
    public DegenerateCalibrationException(String message) {
        super("DEGENERATE_CALIBRATION_INPUT", message);
    }
}

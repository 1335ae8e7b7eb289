package de.anton.cv.analyser.cv_analyzer.model;

/**
 * One measurement of a calibration series: the analyte concentration of a scan and the peak height found in it.
 */
public record CalibrationPoint(int cycleNumber, double concentration, double peakHeight) {

    public CalibrationPoint {
        if (!Double.isFinite(concentration) || !Double.isFinite(peakHeight)) {
            throw new IllegalArgumentException(String.format(
                "Calibration point of cycle %d must be finite (concentration=%s, height=%s).",
                cycleNumber, concentration, peakHeight));
        }
    }
}

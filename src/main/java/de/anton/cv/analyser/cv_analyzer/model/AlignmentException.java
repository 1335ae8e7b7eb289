package de.anton.cv.analyser.cv_analyzer.model;

/**
 * Raised when a curve and a baseline disagree on the voltage at some index.
 */
public class AlignmentException extends CurveAnalysisException {

    private final int index;
    private final double curveVoltage;
    private final double baselineVoltage;

    public AlignmentException(int index, double curveVoltage, double baselineVoltage) {
        super(String.format("Voltage mismatch at index %d: curve voltage = %s, baseline voltage = %s",
                index, curveVoltage, baselineVoltage));
        this.index = index;
        this.curveVoltage = curveVoltage;
        this.baselineVoltage = baselineVoltage;
    }

    public int getIndex() { return index; }
    public double getCurveVoltage() { return curveVoltage; }
    public double getBaselineVoltage() { return baselineVoltage; }
}

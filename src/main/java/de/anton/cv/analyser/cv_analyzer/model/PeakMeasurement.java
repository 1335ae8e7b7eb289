package de.anton.cv.analyser.cv_analyzer.model;

import java.util.OptionalDouble;

/**
 * The dominant peak of one sweep.
 *
 * @param voltage          peak potential in Volts
 * @param current          raw (uncorrected) current at the peak
 * @param correctedCurrent baseline-corrected current at the peak
 * @param height           raw current minus nearest baseline current, empty if it could not be determined
 */
public record PeakMeasurement(double voltage, double current, double correctedCurrent, OptionalDouble height) {
}

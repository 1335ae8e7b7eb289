package de.anton.cv.analyser.cv_analyzer.model;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Exports per-cycle peak results to an Excel workbook (.xlsx), one row per cycle.
 */
public class PeakReportExporter {

    private static final Logger logger = LoggerFactory.getLogger(PeakReportExporter.class);

    static final String SHEET_NAME = "Peaks";
    static final List<String> COLUMN_NAMES = List.of(
            "Cycle",
            "Anodic Peak (V)", "Anodic Current (A)", "Anodic Height (A)",
            "Cathodic Peak (V)", "Cathodic Current (A)", "Cathodic Height (A)",
            "Status");
    private static final int COLUMN_WIDTH = 20 * 256; // POI units: 1/256 of a character

    /**
     * Writes the results sorted by cycle number. Absent peaks and heights become blank cells,
     * failed cycles get their error message in the status column.
     *
     * @throws IOException if the workbook cannot be written.
     */
    public void exportResults(List<CycleAnalysisResult> results, String filePath) throws IOException, InterruptedException {
        Objects.requireNonNull(results, "Result list cannot be null.");
        if (filePath == null || filePath.trim().isEmpty()) { throw new IllegalArgumentException("Output file path cannot be null or empty."); }
        if (results.isEmpty()) { logger.warn("No results provided for Excel export to {}", filePath); }

        List<CycleAnalysisResult> sorted = results.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(CycleAnalysisResult::getCycleNumber))
                .collect(Collectors.toList());

        logger.info("Starting peak report export of {} cycles to: {}", sorted.size(), filePath);
        try (Workbook workbook = new XSSFWorkbook(); FileOutputStream fileOut = new FileOutputStream(filePath)) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(headerFont);

            Row headerRow = sheet.createRow(0);
            for (int i = 0; i < COLUMN_NAMES.size(); i++) {
                Cell cell = headerRow.createCell(i);
                cell.setCellValue(COLUMN_NAMES.get(i));
                cell.setCellStyle(headerStyle);
                sheet.setColumnWidth(i, COLUMN_WIDTH);
            }

            int rowNum = 1;
            for (CycleAnalysisResult result : sorted) {
                if (Thread.currentThread().isInterrupted()) { throw new InterruptedException("Peak report export cancelled during data writing."); }
                Row row = sheet.createRow(rowNum++);
                int cellNum = 0;
                row.createCell(cellNum++).setCellValue(result.getCycleNumber());
                cellNum = writePeak(row, cellNum, result.getAnodicPeak().orElse(null));
                cellNum = writePeak(row, cellNum, result.getCathodicPeak().orElse(null));
                row.createCell(cellNum).setCellValue(result.getError().orElse("OK"));
            }

            workbook.write(fileOut);
            logger.info("Peak report export completed successfully to: {}", filePath);
        } catch (IOException e) {
            logger.error("IOException during peak report export to {}", filePath, e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during peak report export to {}", filePath, e);
            throw new IOException("Unexpected error during peak report export: " + e.getMessage(), e);
        }
    }

    private int writePeak(Row row, int cellNum, PeakMeasurement peak) {
        if (peak == null) {
            for (int i = 0; i < 3; i++) row.createCell(cellNum++, CellType.BLANK);
            return cellNum;
        }
        createNumericCell(row, cellNum++, peak.voltage());
        createNumericCell(row, cellNum++, peak.current());
        OptionalDouble height = peak.height();
        createNumericCell(row, cellNum++, height.isPresent() ? height.getAsDouble() : Double.NaN);
        return cellNum;
    }

    private void createNumericCell(Row row, int colIndex, double value) { if (!Double.isNaN(value) && !Double.isInfinite(value)) { row.createCell(colIndex).setCellValue(value); } else { row.createCell(colIndex, CellType.BLANK); } }
}

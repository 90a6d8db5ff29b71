package com.mossbauer.common.ingestion;

import com.mossbauer.common.exception.DataFormatException;
import com.mossbauer.common.exception.DataTypeException;
import com.mossbauer.common.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an uploaded file into a validated, normalized {@link Spectrum}.
 *
 * <p>Column 0 is velocity, column 1 is absorption; any further columns only take part
 * in the missing-value check. Either a complete spectrum is returned or an exception is
 * thrown; there is no partial result.
 */
public final class SpectrumReader {

    private static final Logger log = LoggerFactory.getLogger(SpectrumReader.class);

    static final String TOO_FEW_COLUMNS = "File must contain at least 2 columns (velocity and absorption)";
    static final String TOO_FEW_ROWS = "Insufficient data points (minimum " + Spectrum.MIN_POINTS + " required)";

    private SpectrumReader() {}

    /**
     * @param fileName           original upload name; its extension selects the parser
     * @param raw                file contents
     * @param baselineCorrection whether the 95th-percentile baseline division may apply
     * @throws DataFormatException unsupported extension, fewer than 2 columns or 10 complete rows
     * @throws DataTypeException   a velocity/absorption cell is not numeric
     */
    public static Spectrum read(String fileName, byte[] raw, boolean baselineCorrection) {
        SpectrumFormat format = SpectrumFormat.fromFileName(fileName);
        if (raw == null || raw.length == 0) {
            throw new DataFormatException(TOO_FEW_ROWS);
        }
        RawTable table = switch (format) {
            case SPREADSHEET    -> SpreadsheetParser.parse(raw);
            case DELIMITED_TEXT -> DelimitedTextParser.parse(raw);
        };
        return toSpectrum(table, baselineCorrection, fileName);
    }

    static Spectrum toSpectrum(RawTable table, boolean baselineCorrection, String source) {
        RawTable complete = table.dropMissing();
        if (complete.columnCount() < 2) {
            throw new DataFormatException(TOO_FEW_COLUMNS);
        }
        if (complete.rowCount() < Spectrum.MIN_POINTS) {
            throw new DataFormatException(TOO_FEW_ROWS);
        }

        int n = complete.rowCount();
        double[] velocity = new double[n];
        double[] absorption = new double[n];
        for (int r = 0; r < n; r++) {
            RawTable.Line line = complete.rows().get(r);
            velocity[r] = number(line.cells()[0], line.sourceIndex(), 0);
            absorption[r] = number(line.cells()[1], line.sourceIndex(), 1);
        }

        double[] normalized = SpectrumNormalizer.normalize(absorption, baselineCorrection);
        Spectrum spectrum = Spectrum.of(velocity, normalized);
        log.info("[Ingestion] Spectrum loaded. source={} points={} droppedRows={} velocityRange=[{}, {}]",
            source, n, table.rowCount() - n, spectrum.minVelocity(), spectrum.maxVelocity());
        return spectrum;
    }

    private static double number(String cell, int row, int column) {
        try {
            double value = Double.parseDouble(cell.trim());
            if (!Double.isFinite(value)) {
                throw new DataTypeException(row, column, cell);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new DataTypeException(row, column, cell);
        }
    }
}

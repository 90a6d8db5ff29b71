package com.mossbauer.common.exception;

/**
 * A velocity or absorption cell could not be read as a number. {@link #getRow()} is the
 * zero-based row of the uploaded file (blank, dropped and header rows included); the
 * message shows it one-based.
 */
public class DataTypeException extends SpectrumAnalysisException {
    private final int row;
    private final int column;
    private final String rawValue;

    public DataTypeException(int row, int column, String rawValue) {
        super("Ingestion", String.format("Non-numeric value '%s' at row %d, column %d",
            rawValue, row + 1, column + 1));
        this.row = row;
        this.column = column;
        this.rawValue = rawValue;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public String getRawValue() {
        return rawValue;
    }
}

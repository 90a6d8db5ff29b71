package com.mossbauer.common.ingestion;

import com.mossbauer.common.exception.DataFormatException;

import java.util.Locale;

/**
 * File formats accepted for upload, resolved from the file name's extension.
 */
public enum SpectrumFormat {
    /** Excel workbook; first sheet, first row is a header. */
    SPREADSHEET,
    /** Headerless delimited text with an unknown delimiter. */
    DELIMITED_TEXT;

    static final String UNSUPPORTED = "Unsupported file format. Please use .xlsx, .txt, or .csv";

    /**
     * @throws DataFormatException for any extension other than .xlsx, .txt or .csv
     */
    public static SpectrumFormat fromFileName(String fileName) {
        if (fileName == null) {
            throw new DataFormatException(UNSUPPORTED);
        }
        String lower = fileName.trim().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".xlsx")) return SPREADSHEET;
        if (lower.endsWith(".txt") || lower.endsWith(".csv")) return DELIMITED_TEXT;
        throw new DataFormatException(UNSUPPORTED);
    }
}

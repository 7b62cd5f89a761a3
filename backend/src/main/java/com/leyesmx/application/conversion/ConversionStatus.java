package com.leyesmx.application.conversion;

public enum ConversionStatus {
    /** JSON written to the output tree */
    WRITTEN,
    /** Parsed, but a blocking diagnostic withheld the JSON */
    REJECTED,
    /** Could not be read, parsed or written */
    FAILED
}

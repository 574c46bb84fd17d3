package com.example.invoiceprocessor.domain.model;

/**
 * Non-fatal per-file condition collected during a processing run and returned to the caller.
 *
 * @param fileName file the warning refers to
 * @param kind     warning category
 * @param message  human readable explanation
 */
public record ProcessingWarning(String fileName, Kind kind, String message) {

    public enum Kind {
        /** File could not be read at all; it was skipped. */
        INPUT_FORMAT,
        /** File was read but produced no rows. */
        EXTRACTION,
        /** PDF had no companion text file above the similarity threshold. */
        PAIRING_AMBIGUOUS
    }

    public static ProcessingWarning inputFormat(String fileName, String message) {
        return new ProcessingWarning(fileName, Kind.INPUT_FORMAT, message);
    }

    public static ProcessingWarning extraction(String fileName, String message) {
        return new ProcessingWarning(fileName, Kind.EXTRACTION, message);
    }

    public static ProcessingWarning pairingAmbiguous(String fileName, String message) {
        return new ProcessingWarning(fileName, Kind.PAIRING_AMBIGUOUS, message);
    }
}

package com.example.invoiceprocessor.domain.exception;

/**
 * Raised when every supplied file failed the readability check, so the pipeline has no input.
 */
public class NoProcessableFilesException extends DomainException {

    private final int fileCount;

    /**
     * @param fileCount number of files that were rejected
     */
    public NoProcessableFilesException(int fileCount) {
        super("None of the " + fileCount + " uploaded file(s) could be read.");
        this.fileCount = fileCount;
    }

    public int getFileCount() {
        return fileCount;
    }
}

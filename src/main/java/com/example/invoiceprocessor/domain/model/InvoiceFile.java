package com.example.invoiceprocessor.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Upload tuple handed over by the transport layer: original file name, raw bytes and the
 * type declared by the client (usually the extension).
 */
public record InvoiceFile(String fileName, byte[] content, String declaredType) {

    public InvoiceFile {
        content = content == null ? new byte[0] : content;
        declaredType = declaredType == null ? "" : declaredType.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Creates a file whose declared type is taken from the file name extension.
     *
     * @param fileName original name
     * @param content  raw bytes
     * @return upload tuple
     */
    public static InvoiceFile of(String fileName, byte[] content) {
        return new InvoiceFile(fileName, content, extensionOf(fileName));
    }

    /**
     * @return lower-case extension without the dot, or an empty string
     */
    public String extension() {
        return extensionOf(fileName);
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof InvoiceFile that)) {
            return false;
        }
        return Objects.equals(fileName, that.fileName)
                && Arrays.equals(content, that.content)
                && Objects.equals(declaredType, that.declaredType);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(fileName, declaredType) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "InvoiceFile[fileName=" + fileName + ", bytes=" + content.length + ", declaredType=" + declaredType + "]";
    }
}

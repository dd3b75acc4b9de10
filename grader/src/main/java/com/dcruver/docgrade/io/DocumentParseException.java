package com.dcruver.docgrade.io;

import java.nio.file.Path;

/**
 * Raised when a document's metadata block cannot be parsed.
 */
public class DocumentParseException extends Exception {

    private final transient Path filePath;

    public DocumentParseException(Path filePath, String message, Throwable cause) {
        super(message + ": " + filePath, cause);
        this.filePath = filePath;
    }

    public Path getFilePath() {
        return filePath;
    }
}

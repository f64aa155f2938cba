package org.initscan.cli.commands;

import org.initscan.extractor.api.ExtractionErrorCode;
import org.initscan.extractor.api.ExtractionException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the preprocessed source files handed to the commands.
 */
final class SourceFiles {

    private SourceFiles() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param path A UTF-8 text file.
     * @return Its content with line endings normalized to {@code \n}.
     * @throws ExtractionException with {@link ExtractionErrorCode#IO_ERROR_READING_FILE} if the file cannot be read.
     */
    static String read(Path path) throws ExtractionException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8).replace("\r\n", "\n");
        } catch (IOException e) {
            throw new ExtractionException(ExtractionErrorCode.IO_ERROR_READING_FILE, "file", path.toString(),
                "Cannot read source file", e);
        }
    }
}

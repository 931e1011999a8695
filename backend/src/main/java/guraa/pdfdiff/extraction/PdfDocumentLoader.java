package guraa.pdfdiff.extraction;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.io.MemoryUsageSetting;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;

import java.io.File;
import java.io.IOException;

/**
 * Utility for opening PDF documents, with a fallback for files too large to buffer in
 * memory.
 */
@Slf4j
public final class PdfDocumentLoader {

    private PdfDocumentLoader() {
    }

    /**
     * Load a PDF document.
     *
     * @param file The PDF file to load
     * @return The loaded document; the caller closes it
     * @throws InvalidPasswordException If the document is password protected
     * @throws IOException              If the document cannot be loaded
     */
    public static PDDocument load(File file) throws IOException {
        if (!file.isFile()) {
            throw new IOException("PDF file does not exist: " + file.getPath());
        }

        try {
            return PDDocument.load(file);
        } catch (InvalidPasswordException e) {
            throw e;
        } catch (IOException | OutOfMemoryError e) {
            log.warn("Standard PDF loading failed for {}: {}. Retrying with temp-file buffering",
                    file.getName(), e.getMessage());
        }

        try {
            return PDDocument.load(file, MemoryUsageSetting.setupTempFileOnly());
        } catch (IOException e) {
            throw new IOException("Failed to load PDF document " + file.getName(), e);
        }
    }
}

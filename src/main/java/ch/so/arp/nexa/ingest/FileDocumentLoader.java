package ch.so.arp.nexa.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.nexa.error.UnsupportedFormatException;

/**
 * Reads UTF-8 text and Markdown files as they are and extracts the text of
 * PDF files with PDFBox, in page order.
 */
class FileDocumentLoader implements DocumentLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileDocumentLoader.class);

    private static final Set<String> TEXT_EXTENSIONS = Set.of("txt", "md");
    private static final String PDF_EXTENSION = "pdf";

    @Override
    public boolean supports(Path path) {
        String extension = extension(path);
        return TEXT_EXTENSIONS.contains(extension) || PDF_EXTENSION.equals(extension);
    }

    @Override
    public String load(Path path, byte[] content) throws IOException {
        String extension = extension(path);
        if (TEXT_EXTENSIONS.contains(extension)) {
            return new String(content, StandardCharsets.UTF_8);
        }
        if (PDF_EXTENSION.equals(extension)) {
            try (PDDocument document = Loader.loadPDF(content)) {
                PDFTextStripper stripper = new PDFTextStripper();
                stripper.setSortByPosition(true);
                String text = stripper.getText(document);
                LOGGER.debug("Extracted {} characters from {} pages of {}", text.length(),
                        document.getNumberOfPages(), path.getFileName());
                return text;
            }
        }
        throw new UnsupportedFormatException(path.toString(), extension.isEmpty() ? "<none>" : extension);
    }

    private static String extension(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

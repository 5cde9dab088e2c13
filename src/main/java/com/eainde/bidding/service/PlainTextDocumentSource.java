package com.eainde.bidding.service;

import com.eainde.bidding.error.EmptyDocumentException;
import com.eainde.bidding.error.UnsupportedFormatException;
import com.eainde.bidding.model.Document;
import com.eainde.bidding.provider.DocumentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Loads UTF-8 text files ({@code .txt}, {@code .md}). A form feed marks a page break, the
 * convention of most PDF-to-text converters; it is replaced by a newline so offsets stay
 * aligned with the page table.
 *
 * <p>Binary formats (PDF, DOCX) are converted upstream and rejected here.</p>
 */
public class PlainTextDocumentSource implements DocumentSource {

    private static final Logger log = LoggerFactory.getLogger(PlainTextDocumentSource.class);

    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of("txt", "md", "text");
    private static final char PAGE_BREAK = '\f';

    @Override
    public Document loadText(Path file) {
        String extension = extensionOf(file);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new UnsupportedFormatException("Unsupported document format '" + extension
                    + "' for " + file.getFileName() + ", expected one of " + SUPPORTED_EXTENSIONS);
        }

        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            throw new UnsupportedFormatException(file.getFileName() + " is not valid UTF-8 text", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
        if (raw.isBlank()) {
            throw new EmptyDocumentException("Document " + file.getFileName() + " is empty");
        }

        List<Integer> pageOffsets = new ArrayList<>();
        pageOffsets.add(0);
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) == PAGE_BREAK && i + 1 < raw.length()) {
                pageOffsets.add(i + 1);
            }
        }
        String text = raw.replace(PAGE_BREAK, '\n');

        String documentId = UUID.nameUUIDFromBytes(raw.getBytes(StandardCharsets.UTF_8)).toString();
        log.info("Loaded {} ({} chars, {} pages)", file.getFileName(), text.length(), pageOffsets.size());
        return new Document(documentId, file.getFileName().toString(), text, pageOffsets);
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

package com.glottocatalog.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glottocatalog.bibtex.BibtexCorpusReader;
import com.glottocatalog.config.CatalogProperties;
import com.glottocatalog.model.BibRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Imports {data-dir}/{version}/refs.bib at startup and writes the change log of the run to
 * refs.json next to it. Enabled with catalog.import.run-on-startup=true.
 */
@Component
@ConditionalOnProperty(prefix = "catalog.import", name = "run-on-startup", havingValue = "true")
public class ReferenceImportRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ReferenceImportRunner.class);

    static final String CORPUS_FILE = "refs.bib";
    static final String CHANGE_LOG_FILE = "refs.json";

    private final ReferenceImportService importService;
    private final CatalogProperties properties;
    private final ObjectMapper objectMapper;

    public ReferenceImportRunner(ReferenceImportService importService, CatalogProperties properties,
                                 ObjectMapper objectMapper) {
        this.importService = importService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        CatalogProperties.Import settings = properties.getImport();
        Path versionDir = settings.versionDir();

        List<BibRecord> records = BibtexCorpusReader.read(versionDir.resolve(CORPUS_FILE));
        log.info("Read {} records from {}", records.size(), versionDir.resolve(CORPUS_FILE));

        ImportSummary summary = importService.run(records, settings.getMode());
        log.info("Import finished: {}", summary);

        writeChangeLog(versionDir.resolve(CHANGE_LOG_FILE), summary.getChangeLog());
    }

    void writeChangeLog(Path file, ChangeLog changeLog) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), changeLog);
            log.info("Wrote changes of {} references to {}", changeLog.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write change log " + file, e);
        }
    }
}

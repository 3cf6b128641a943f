package de.vzg.reposis.crossref.io;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.vzg.reposis.crossref.deposit.CrossrefDeposit;

/**
 * Writes deposits to {@code <output-dir>/<batch id>.xml}.
 */
@Service
public class DepositFileWriter {

    private static final Logger log = LoggerFactory.getLogger(DepositFileWriter.class);

    /**
     * @param indent the indentation for pretty printing, or null for the raw serialization
     * @return the written file
     */
    public Path write(CrossrefDeposit deposit, Path outputDir, String indent) throws IOException {
        Files.createDirectories(outputDir);
        Path outputPath = outputDir.resolve(deposit.getBatchId() + ".xml");
        String xml = indent == null ? deposit.toXml() : deposit.toXml(indent);
        try (OutputStreamWriter fileWriter = new OutputStreamWriter(
            new BufferedOutputStream(Files.newOutputStream(outputPath)), StandardCharsets.UTF_8)) {
            fileWriter.write(xml);
        }
        log.info("Wrote deposit {} to {}", deposit.getBatchId(), outputPath);
        return outputPath;
    }
}

package com.portkit.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes report files below an output directory, creating directories as needed
 * and overwriting earlier reports.
 */
public class FileSystemReportWriter {

    private static final Logger log = LoggerFactory.getLogger(FileSystemReportWriter.class);

    /**
     * @param files report files
     * @param outputDir target directory
     * @throws IllegalStateException if a directory or file cannot be written
     */
    public void write(List<ReportFile> files, Path outputDir) {
        log.debug("Writing {} report files to: {}", files.size(), outputDir);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create report directory: " + outputDir, e);
        }

        for (ReportFile file : files) {
            Path targetPath = outputDir.resolve(file.relativePath());
            try {
                Path parentDir = targetPath.getParent();
                if (parentDir != null) {
                    Files.createDirectories(parentDir);
                }
                Files.writeString(targetPath, file.content());
                log.info("Wrote report: {} ({} bytes)", targetPath, file.content().length());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to write report file: " + file.relativePath(), e);
            }
        }
    }
}

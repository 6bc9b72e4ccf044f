package com.naag.docsync.transform;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Converts slide decks to PDF with a headless LibreOffice subprocess, one PDF page per slide.
 */
@Slf4j
public class SlideDeckConverter {

    private final String sofficeBinary;
    private final Duration timeout;

    public SlideDeckConverter(String sofficeBinary, Duration timeout) {
        this.sofficeBinary = sofficeBinary;
        this.timeout = timeout;
    }

    /**
     * @throws ContentExtractionException when the converter is missing, fails, or times out
     */
    public byte[] toPdf(byte[] deck, String filename) {
        Path workDir = null;
        Process process = null;
        try {
            workDir = Files.createTempDirectory("docsync-deck-");
            String inputName = "input" + extensionOf(filename);
            Path input = workDir.resolve(inputName);
            Files.write(input, deck);

            process = new ProcessBuilder(command(workDir, input))
                    .redirectErrorStream(true)
                    .redirectOutput(workDir.resolve("convert.log").toFile())
                    .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ContentExtractionException("Slide conversion timed out after " + timeout.toSeconds() + "s for " + filename);
            }
            if (process.exitValue() != 0) {
                throw new ContentExtractionException("Slide conversion exited with " + process.exitValue() + " for " + filename);
            }

            Path pdf = workDir.resolve("input.pdf");
            if (!Files.exists(pdf)) {
                throw new ContentExtractionException("Slide conversion produced no PDF for " + filename);
            }
            log.debug("Converted {} to PDF", filename);
            return Files.readAllBytes(pdf);
        } catch (IOException e) {
            throw new ContentExtractionException("Slide conversion failed for " + filename + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContentExtractionException("Slide conversion interrupted for " + filename, e);
        } finally {
            destroy(process);
            deleteQuietly(workDir);
        }
    }

    /**
     * Each conversion gets its own LibreOffice profile under the work directory, so concurrent
     * conversions do not contend for the shared user installation lock.
     */
    List<String> command(Path workDir, Path input) {
        return List.of(sofficeBinary,
                "-env:UserInstallation=" + workDir.resolve("profile").toUri(),
                "--headless", "--convert-to", "pdf",
                "--outdir", workDir.toString(), input.toString());
    }

    private static void destroy(Process process) {
        if (process == null || !process.isAlive()) return;
        // soffice is a launcher script, the office process is its child
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        log.debug("Killed slide converter process {}", process.pid());
    }

    private static String extensionOf(String filename) {
        int dot = filename == null ? -1 : filename.lastIndexOf('.');
        return dot < 0 ? ".pptx" : filename.substring(dot).toLowerCase();
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) return;
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.debug("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}

package com.naag.docsync.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@EnabledOnOs({OS.LINUX, OS.MAC})
class SlideDeckConverterTest {

    @TempDir
    Path tempDir;

    private Path script(String name, String body) throws IOException {
        Path script = tempDir.resolve(name);
        Files.writeString(script, "#!/bin/sh\n" + body, StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }

    @Test
    @DisplayName("Should give every conversion its own LibreOffice profile")
    void shouldUsePrivateProfilePerConversion() throws IOException {
        Path argsLog = tempDir.resolve("args.log");
        // copies the input next to itself as input.pdf, the way soffice names its output
        Path soffice = script("soffice", ""
                + "for arg in \"$@\"; do echo \"$arg\" >> '" + argsLog + "'; last=\"$arg\"; done\n"
                + "cp \"$last\" \"$(dirname \"$last\")/input.pdf\"\n");
        SlideDeckConverter converter = new SlideDeckConverter(soffice.toString(), Duration.ofSeconds(10));
        byte[] deck = "deck bytes".getBytes(StandardCharsets.UTF_8);

        assertThat(converter.toPdf(deck, "a.pptx")).isEqualTo(deck);
        assertThat(converter.toPdf(deck, "b.pptx")).isEqualTo(deck);

        List<String> profiles = Files.readAllLines(argsLog).stream()
                .filter(arg -> arg.startsWith("-env:UserInstallation=file:"))
                .toList();
        assertThat(profiles).hasSize(2);
        assertThat(profiles.get(0)).endsWith("/profile");
        assertThat(profiles.get(0)).isNotEqualTo(profiles.get(1));
    }

    @Test
    @DisplayName("Should kill the converter when the calling thread is interrupted")
    void shouldKillConverterOnInterrupt() throws Exception {
        Path pidFile = tempDir.resolve("soffice.pid");
        Path soffice = script("soffice-hang", "echo $$ > '" + pidFile + "'\nexec sleep 30\n");
        SlideDeckConverter converter = new SlideDeckConverter(soffice.toString(), Duration.ofSeconds(60));
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread caller = new Thread(() -> {
            try {
                converter.toPdf(new byte[] {1}, "hang.pptx");
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        caller.start();
        long pid = awaitPid(pidFile);

        caller.interrupt();
        caller.join(5_000);

        assertThat(caller.isAlive()).isFalse();
        assertThat(failure.get())
                .isInstanceOf(ContentExtractionException.class)
                .hasMessageContaining("interrupted");
        assertThat(awaitExit(pid)).isTrue();
    }

    private static long awaitPid(Path pidFile) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            if (Files.exists(pidFile)) {
                String text = Files.readString(pidFile).trim();
                if (!text.isEmpty()) return Long.parseLong(text);
            }
            Thread.sleep(20);
        }
        throw new AssertionError("converter never started");
    }

    private static boolean awaitExit(long pid) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            Optional<ProcessHandle> handle = ProcessHandle.of(pid);
            if (handle.isEmpty() || !handle.get().isAlive()) return true;
            Thread.sleep(20);
        }
        return false;
    }
}

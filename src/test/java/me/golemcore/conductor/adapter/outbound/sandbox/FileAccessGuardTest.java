package me.golemcore.conductor.adapter.outbound.sandbox;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileAccessGuardTest {

    @TempDir
    Path root;

    private Path attached;
    private Path outputDir;
    private FileAccessGuard guard;

    @BeforeEach
    void setUp() throws IOException {
        attached = Files.writeString(root.resolve("input.csv"), "a,b\n1,2\n");
        Files.writeString(root.resolve("secret.txt"), "nope");
        outputDir = Files.createDirectories(root.resolve("out"));
        guard = new FileAccessGuard(List.of(attached), outputDir);
    }

    @Test
    void shouldAllowReadingAttachedFile() {
        assertEquals(FileAccessGuard.canonical(attached), guard.checkRead(attached.toString()));
    }

    @Test
    void shouldDenyReadingUnattachedSibling() {
        SandboxViolationException error = assertThrows(SandboxViolationException.class,
                () -> guard.checkRead(root.resolve("secret.txt").toString()));

        assertEquals("Read access denied: " + root.resolve("secret.txt"), error.getMessage());
    }

    @Test
    void shouldDenyTraversalOutOfOutputDirectory() {
        assertThrows(SandboxViolationException.class, () -> guard.checkRead("../secret.txt"));
        assertThrows(SandboxViolationException.class, () -> guard.checkWrite("../escape.txt"));
    }

    @Test
    void shouldResolveRelativeWritesUnderOutputDirectory() {
        Path target = guard.checkWrite("report.txt");

        assertEquals(FileAccessGuard.canonical(outputDir).resolve("report.txt"), target);
    }

    @Test
    void shouldDenyWritingOverAttachedInput() {
        assertThrows(SandboxViolationException.class, () -> guard.checkWrite(attached.toString()));
    }

    @Test
    void shouldDenyAllWritesWithoutOutputDirectory() {
        FileAccessGuard readOnly = new FileAccessGuard(List.of(attached), null);

        SandboxViolationException error = assertThrows(SandboxViolationException.class,
                () -> readOnly.checkWrite("/tmp/x.txt"));

        assertEquals("Write access denied: no output directory for this run", error.getMessage());
    }

    @Test
    void shouldNotFollowSymlinkOutOfOutputDirectory() throws IOException {
        Path link = outputDir.resolve("sneaky");
        try {
            Files.createSymbolicLink(link, root);
        } catch (UnsupportedOperationException | IOException e) {
            // Filesystem without symlink support; nothing to check.
            return;
        }

        assertThrows(SandboxViolationException.class, () -> guard.checkRead("sneaky/secret.txt"));
    }

    @Test
    void shouldRejectEmptyPath() {
        assertThrows(SandboxViolationException.class, () -> guard.checkRead(" "));
    }
}

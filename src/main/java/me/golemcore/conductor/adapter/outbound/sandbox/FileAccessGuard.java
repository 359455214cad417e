package me.golemcore.conductor.adapter.outbound.sandbox;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Path policy for one sandboxed run: reads only from the allowed paths (files
 * or directories) and the output directory, writes only beneath the output
 * directory.
 */
public class FileAccessGuard {

    private final List<Path> readable;
    private final Path outputDir;

    public FileAccessGuard(List<Path> allowedPaths, Path outputDir) {
        this.readable = new ArrayList<>();
        if (allowedPaths != null) {
            for (Path path : allowedPaths) {
                readable.add(canonical(path));
            }
        }
        this.outputDir = outputDir != null ? canonical(outputDir) : null;
        if (this.outputDir != null) {
            readable.add(this.outputDir);
        }
    }

    public Path checkRead(String rawPath) {
        Path path = resolve(rawPath);
        for (Path root : readable) {
            if (path.startsWith(root)) {
                return path;
            }
        }
        throw new SandboxViolationException("Read access denied: " + rawPath);
    }

    public Path checkWrite(String rawPath) {
        if (outputDir == null) {
            throw new SandboxViolationException("Write access denied: no output directory for this run");
        }
        Path path = resolve(rawPath);
        if (!path.startsWith(outputDir) || path.equals(outputDir)) {
            throw new SandboxViolationException("Write access denied: " + rawPath
                    + " (writes are only allowed under " + outputDir + ")");
        }
        return path;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    private Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new SandboxViolationException("Empty path");
        }
        Path path = Path.of(rawPath);
        if (!path.isAbsolute() && outputDir != null) {
            path = outputDir.resolve(path);
        }
        return canonical(path);
    }

    /**
     * Absolute, normalized, and with symlinks resolved for the longest existing
     * prefix, so a link inside an allowed directory cannot point outside it.
     */
    static Path canonical(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        Path existing = absolute;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return absolute;
        }
        try {
            Path real = existing.toRealPath();
            return real.resolve(existing.relativize(absolute)).normalize();
        } catch (IOException e) {
            return absolute;
        }
    }
}

package me.golemcore.conductor.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites model-supplied tool arguments before dispatch.
 *
 * <ul>
 * <li>file references given as a basename (or a guessed path whose basename is
 * known) are replaced by the absolute path from the file map</li>
 * <li>a relative {@code output_path} is placed under the output directory</li>
 * <li>{@code access_token} is never taken from the model; it is injected from
 * the credential store for tools that need it</li>
 * </ul>
 */
@Component
@Slf4j
public class ToolArgumentResolver {

    public static final String ACCESS_TOKEN = "access_token";

    static final Set<String> PATH_KEYS = Set.of(
            "image_path", "input_path", "pdf_path", "file_path", "path", "docx_path", "pptx_path", "xlsx_path");
    static final Set<String> PATH_LIST_KEYS = Set.of("image_paths", "file_paths");
    static final String OUTPUT_PATH = "output_path";

    public Map<String, Object> resolve(Map<String, Object> arguments, Map<String, String> fileMap, Path outputDir,
            String accessToken) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (arguments != null) {
            resolved.putAll(arguments);
        }
        resolved.remove(ACCESS_TOKEN);

        if (fileMap != null && !fileMap.isEmpty()) {
            for (String key : PATH_KEYS) {
                if (resolved.get(key) instanceof String value) {
                    resolved.put(key, resolvePath(value, fileMap));
                }
            }
            for (String key : PATH_LIST_KEYS) {
                if (resolved.get(key) instanceof List<?> values) {
                    List<Object> paths = new ArrayList<>(values.size());
                    for (Object value : values) {
                        paths.add(value instanceof String s ? resolvePath(s, fileMap) : value);
                    }
                    resolved.put(key, paths);
                }
            }
        }

        if (outputDir != null && resolved.get(OUTPUT_PATH) instanceof String output && !output.isBlank()) {
            Path path = Path.of(output);
            if (!path.isAbsolute()) {
                resolved.put(OUTPUT_PATH, outputDir.resolve(path).toAbsolutePath().normalize().toString());
            }
        }

        if (accessToken != null) {
            resolved.put(ACCESS_TOKEN, accessToken);
        }
        return resolved;
    }

    private String resolvePath(String value, Map<String, String> fileMap) {
        String direct = fileMap.get(value);
        if (direct != null) {
            return direct;
        }
        Path fileName = safeFileName(value);
        if (fileName != null) {
            String byBasename = fileMap.get(fileName.toString());
            if (byBasename != null) {
                log.debug("[Tools] Resolved '{}' to attached file {}", value, byBasename);
                return byBasename;
            }
        }
        return value;
    }

    private static Path safeFileName(String value) {
        try {
            return Path.of(value).getFileName();
        } catch (InvalidPathException e) {
            return null;
        }
    }
}

package me.golemcore.conductor.tools;

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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates page selections such as {@code all}, {@code 3}, {@code 1-5} and
 * {@code 1-3, 7}. Pages are numbered from 1.
 */
public final class PageRangeValidator {

    private static final Pattern SINGLE = Pattern.compile("\\d+");
    private static final Pattern RANGE = Pattern.compile("(\\d+)\\s*-\\s*(\\d+)");

    private PageRangeValidator() {
    }

    /**
     * @return the reason the selection is rejected, or empty when it is valid
     */
    public static Optional<String> validate(String pages) {
        if (pages == null || pages.isBlank() || "all".equalsIgnoreCase(pages.trim())) {
            return Optional.empty();
        }
        for (String part : pages.split(",")) {
            String item = part.trim();
            if (SINGLE.matcher(item).matches()) {
                if (parse(item) < 1) {
                    return Optional.of("Page " + item + " is out of range: pages start at 1");
                }
                continue;
            }
            Matcher range = RANGE.matcher(item);
            if (!range.matches()) {
                return Optional.of("Invalid page selection '" + item + "'. Use 'all', 'N', 'A-B' or a comma list.");
            }
            long start = parse(range.group(1));
            long end = parse(range.group(2));
            if (start < 1) {
                return Optional.of("Page range " + item + " is out of range: pages start at 1");
            }
            if (end < start) {
                return Optional.of("Page range " + item + " is out of range: end is before start");
            }
        }
        return Optional.empty();
    }

    private static long parse(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}

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

package me.golemcore.conductor.adapter.outbound.sandbox;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static pass over submitted JavaScript, run before anything executes.
 *
 * <p>
 * Tokenizes the source (comments dropped, string and template literals kept as
 * single tokens) and rejects module imports outside {@link #ALLOWED_MODULES},
 * any import on {@link #DENIED_MODULES}, dynamic imports, and calls or
 * identifiers that reach for evaluation or host-escape primitives. The run-time
 * gates enforce the same lists; this pass only fails earlier and with a clearer
 * message.
 */
public final class SourceValidator {

    public static final Set<String> ALLOWED_MODULES = Set.of("encoding", "figures", "files", "stats");

    public static final Set<String> DENIED_MODULES = Set.of(
            "child_process", "fs", "fs/promises", "net", "http", "https", "http2", "os", "process", "vm",
            "worker_threads", "cluster", "dgram", "dns", "tls", "module", "path", "readline", "inspector",
            "v8", "java", "polyglot");

    /** Never allowed, as an identifier or as a property name. */
    private static final Set<String> DENIED_IDENTIFIERS = Set.of(
            "Java", "Polyglot", "Graal", "Packages", "loadWithNewGlobal", "__proto__",
            "__defineGetter__", "__defineSetter__", "__lookupGetter__", "__lookupSetter__");

    /** Not allowed as free identifiers; fine as property names (e.g. {@code obj.eval}). */
    private static final Set<String> DENIED_GLOBALS = Set.of("eval", "Function");

    /** Not allowed as free-standing calls. */
    private static final Set<String> DENIED_CALLS = Set.of("load", "quit", "exit", "importScripts");

    private static final Set<String> REGEX_PREFIX_KEYWORDS = Set.of(
            "return", "typeof", "instanceof", "in", "of", "new", "delete", "void", "throw", "case", "do", "else");

    private SourceValidator() {
    }

    /**
     * @return a message naming the first offending import or call, or empty when
     *         the source passes
     */
    public static Optional<String> findViolation(String source) {
        List<Token> tokens;
        try {
            tokens = tokenize(source == null ? "" : source);
        } catch (IllegalArgumentException e) {
            return Optional.of(e.getMessage());
        }

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.kind() != Kind.IDENT) {
                continue;
            }
            String name = token.text();
            boolean property = isProperty(tokens, i);

            if ("require".equals(name) && !property && isPunct(tokens, i + 1, "(")) {
                Optional<String> violation = checkRequire(tokens, i, token.line());
                if (violation.isPresent()) {
                    return violation;
                }
            } else if ("import".equals(name) && !property) {
                Optional<String> violation = checkImport(tokens, i, token.line());
                if (violation.isPresent()) {
                    return violation;
                }
            } else if (DENIED_IDENTIFIERS.contains(name)) {
                return Optional.of("Access to '" + name + "' is not allowed (line " + token.line() + ")");
            } else if (DENIED_GLOBALS.contains(name) && !property) {
                return Optional.of("Call to '" + name + "' is not allowed (line " + token.line() + ")");
            } else if (DENIED_CALLS.contains(name) && !property && isPunct(tokens, i + 1, "(")) {
                return Optional.of("Call to '" + name + "()' is not allowed (line " + token.line() + ")");
            } else if ("constructor".equals(name) && property && i >= 2
                    && tokens.get(i - 2).kind() == Kind.IDENT && "constructor".equals(tokens.get(i - 2).text())) {
                return Optional.of("Access to 'constructor.constructor' is not allowed (line " + token.line() + ")");
            }
        }
        return Optional.empty();
    }

    /**
     * Explains why {@code module} may not be loaded, or returns empty if it may.
     */
    public static Optional<String> checkModule(String module) {
        if (DENIED_MODULES.contains(module) || module.startsWith("node:")) {
            return Optional.of("Import of '" + module + "' is not allowed: blocked module");
        }
        if (!ALLOWED_MODULES.contains(module)) {
            return Optional.of("Import of '" + module + "' is not allowed. Available modules: "
                    + String.join(", ", ALLOWED_MODULES.stream().sorted().toList()));
        }
        return Optional.empty();
    }

    private static Optional<String> checkRequire(List<Token> tokens, int index, int line) {
        Token argument = index + 2 < tokens.size() ? tokens.get(index + 2) : null;
        if (argument == null || argument.kind() != Kind.STRING || !isPunct(tokens, index + 3, ")")) {
            return Optional.of("Dynamic require() is not allowed; use a string literal (line " + line + ")");
        }
        return checkModule(argument.text()).map(msg -> msg + " (line " + line + ")");
    }

    private static Optional<String> checkImport(List<Token> tokens, int index, int line) {
        if (isPunct(tokens, index + 1, "(")) {
            return Optional.of("Dynamic import() is not allowed (line " + line + ")");
        }
        if (isPunct(tokens, index + 1, ".")) {
            return Optional.of("Access to 'import.meta' is not allowed (line " + line + ")");
        }
        for (int j = index + 1; j < tokens.size(); j++) {
            Token next = tokens.get(j);
            if (next.kind() == Kind.STRING) {
                return checkModule(next.text()).map(msg -> msg + " (line " + line + ")");
            }
            if (next.kind() == Kind.PUNCT && ";".equals(next.text())) {
                break;
            }
        }
        return Optional.of("Malformed import statement (line " + line + ")");
    }

    private static boolean isProperty(List<Token> tokens, int index) {
        return index > 0 && (isPunct(tokens, index - 1, ".") || isPunct(tokens, index - 1, "?."));
    }

    private static boolean isPunct(List<Token> tokens, int index, String text) {
        if (index < 0 || index >= tokens.size()) {
            return false;
        }
        Token token = tokens.get(index);
        return token.kind() == Kind.PUNCT && token.text().equals(text);
    }

    // ==================== Lexer ====================

    enum Kind {
        IDENT, STRING, NUMBER, PUNCT
    }

    record Token(Kind kind, String text, int line) {
    }

    static List<Token> tokenize(String src) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int line = 1;
        int n = src.length();
        while (i < n) {
            char c = src.charAt(i);
            if (c == '\n') {
                line++;
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '/' && i + 1 < n && src.charAt(i + 1) == '/') {
                while (i < n && src.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && i + 1 < n && src.charAt(i + 1) == '*') {
                int end = src.indexOf("*/", i + 2);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated comment (line " + line + ")");
                }
                line += countNewlines(src, i, end);
                i = end + 2;
            } else if (c == '"' || c == '\'' || c == '`') {
                StringBuilder value = new StringBuilder();
                int start = line;
                i++;
                while (i < n && src.charAt(i) != c) {
                    char ch = src.charAt(i);
                    if (ch == '\\' && i + 1 < n) {
                        value.append(src.charAt(i + 1));
                        i += 2;
                        continue;
                    }
                    if (ch == '\n') {
                        if (c != '`') {
                            throw new IllegalArgumentException("Unterminated string literal (line " + start + ")");
                        }
                        line++;
                    }
                    value.append(ch);
                    i++;
                }
                if (i >= n) {
                    throw new IllegalArgumentException("Unterminated string literal (line " + start + ")");
                }
                i++;
                tokens.add(new Token(Kind.STRING, value.toString(), start));
            } else if (c == '/' && regexAllowed(tokens)) {
                i = skipRegex(src, i, line);
                tokens.add(new Token(Kind.STRING, "", line));
            } else if (Character.isJavaIdentifierStart(c)) {
                int start = i;
                while (i < n && Character.isJavaIdentifierPart(src.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(Kind.IDENT, src.substring(start, i), line));
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '.'
                        || src.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(Kind.NUMBER, src.substring(start, i), line));
            } else if (c == '?' && i + 1 < n && src.charAt(i + 1) == '.'
                    && !(i + 2 < n && Character.isDigit(src.charAt(i + 2)))) {
                tokens.add(new Token(Kind.PUNCT, "?.", line));
                i += 2;
            } else {
                tokens.add(new Token(Kind.PUNCT, String.valueOf(c), line));
                i++;
            }
        }
        return tokens;
    }

    private static boolean regexAllowed(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return true;
        }
        Token previous = tokens.get(tokens.size() - 1);
        return switch (previous.kind()) {
        case PUNCT -> !")".equals(previous.text()) && !"]".equals(previous.text())
                && !"}".equals(previous.text());
        case IDENT -> REGEX_PREFIX_KEYWORDS.contains(previous.text());
        default -> false;
        };
    }

    private static int skipRegex(String src, int start, int line) {
        int i = start + 1;
        boolean inClass = false;
        while (i < src.length()) {
            char ch = src.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == '\n') {
                throw new IllegalArgumentException("Unterminated regular expression (line " + line + ")");
            }
            if (ch == '[') {
                inClass = true;
            } else if (ch == ']') {
                inClass = false;
            } else if (ch == '/' && !inClass) {
                i++;
                while (i < src.length() && Character.isLetter(src.charAt(i))) {
                    i++;
                }
                return i;
            }
            i++;
        }
        throw new IllegalArgumentException("Unterminated regular expression (line " + line + ")");
    }

    private static int countNewlines(String src, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (src.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}

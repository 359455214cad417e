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

import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Capabilities a sandboxed run can opt into through {@code require(name)} and
 * the global {@code open(path, mode)}. Everything is exposed as polyglot
 * proxies, so guest code never sees a host object.
 */
class SandboxModules {

    private final FileAccessGuard guard;
    private final FigureRegistry figures;
    private final Map<String, ProxyObject> modules = new HashMap<>();

    SandboxModules(FileAccessGuard guard, FigureRegistry figures) {
        this.guard = guard;
        this.figures = figures;
        modules.put("files", filesModule());
        modules.put("figures", figuresModule());
        modules.put("encoding", encodingModule());
        modules.put("stats", statsModule());
    }

    ProxyExecutable requireFunction() {
        return args -> {
            if (args.length == 0 || !args[0].isString()) {
                throw new SandboxViolationException("require() expects a module name string");
            }
            String name = args[0].asString();
            SourceValidator.checkModule(name).ifPresent(message -> {
                throw new SandboxViolationException(message);
            });
            return modules.get(name);
        };
    }

    ProxyExecutable openFunction() {
        return args -> {
            String path = stringArg(args, 0, "open");
            String mode = args.length > 1 && args[1].isString() ? args[1].asString() : "r";
            return switch (mode) {
            case "r" -> readHandle(guard.checkRead(path));
            case "w" -> writeHandle(truncate(guard.checkWrite(path)));
            case "a" -> writeHandle(guard.checkWrite(path));
            default -> throw new IllegalArgumentException("Unsupported open() mode: " + mode);
            };
        };
    }

    // ==================== files ====================

    private ProxyObject filesModule() {
        Map<String, Object> members = new HashMap<>();
        members.put("readText", (ProxyExecutable) args -> readString(guard.checkRead(stringArg(args, 0, "readText"))));
        members.put("writeText", (ProxyExecutable) args -> {
            Path target = guard.checkWrite(stringArg(args, 0, "writeText"));
            String text = args.length > 1 ? text(args[1]) : "";
            writeString(target, text, false);
            return target.toString();
        });
        members.put("exists", (ProxyExecutable) args -> Files.exists(guard.checkRead(stringArg(args, 0, "exists"))));
        members.put("list", (ProxyExecutable) args -> {
            Path dir = guard.checkRead(stringArg(args, 0, "list"));
            try (Stream<Path> entries = Files.list(dir)) {
                List<Object> names = new ArrayList<>();
                entries.map(p -> p.getFileName().toString()).sorted().forEach(names::add);
                return ProxyArray.fromList(names);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot list " + dir + ": " + e.getMessage(), e);
            }
        });
        if (guard.getOutputDir() != null) {
            members.put("outputDir", guard.getOutputDir().toString());
        }
        return ProxyObject.fromMap(members);
    }

    private ProxyObject readHandle(Path path) {
        Map<String, Object> members = new HashMap<>();
        members.put("read", (ProxyExecutable) args -> readString(path));
        members.put("readLines", (ProxyExecutable) args -> {
            List<Object> lines = new ArrayList<>(readString(path).lines().toList());
            return ProxyArray.fromList(lines);
        });
        members.put("close", (ProxyExecutable) args -> null);
        members.put("name", path.toString());
        return ProxyObject.fromMap(members);
    }

    private ProxyObject writeHandle(Path path) {
        Map<String, Object> members = new HashMap<>();
        members.put("write", (ProxyExecutable) args -> {
            String text = args.length > 0 ? text(args[0]) : "";
            writeString(path, text, true);
            return text.length();
        });
        members.put("close", (ProxyExecutable) args -> null);
        members.put("name", path.toString());
        return ProxyObject.fromMap(members);
    }

    // ==================== figures ====================

    private ProxyObject figuresModule() {
        Map<String, Object> members = new HashMap<>();
        members.put("svg", (ProxyExecutable) args -> figures.register(optionalString(args, 1),
                stringArg(args, 0, "svg")));
        members.put("lineChart", (ProxyExecutable) args -> figures.register(optionalString(args, 2),
                FigureRegistry.lineChart(numbers(args, 0, "lineChart"), optionalString(args, 1))));
        members.put("barChart", (ProxyExecutable) args -> figures.register(optionalString(args, 3),
                FigureRegistry.barChart(strings(args, 0), numbers(args, 1, "barChart"), optionalString(args, 2))));
        return ProxyObject.fromMap(members);
    }

    // ==================== encoding ====================

    private ProxyObject encodingModule() {
        Map<String, Object> members = new HashMap<>();
        members.put("base64Encode", (ProxyExecutable) args -> Base64.getEncoder()
                .encodeToString(stringArg(args, 0, "base64Encode").getBytes(StandardCharsets.UTF_8)));
        members.put("base64Decode", (ProxyExecutable) args -> new String(
                Base64.getDecoder().decode(stringArg(args, 0, "base64Decode")), StandardCharsets.UTF_8));
        members.put("urlEncode", (ProxyExecutable) args -> URLEncoder.encode(stringArg(args, 0, "urlEncode"),
                StandardCharsets.UTF_8));
        members.put("urlDecode", (ProxyExecutable) args -> URLDecoder.decode(stringArg(args, 0, "urlDecode"),
                StandardCharsets.UTF_8));
        members.put("utf8Length", (ProxyExecutable) args -> stringArg(args, 0, "utf8Length")
                .getBytes(StandardCharsets.UTF_8).length);
        return ProxyObject.fromMap(members);
    }

    // ==================== stats ====================

    private ProxyObject statsModule() {
        Map<String, Object> members = new HashMap<>();
        members.put("sum", (ProxyExecutable) args -> numbers(args, 0, "sum").stream()
                .mapToDouble(Double::doubleValue).sum());
        members.put("mean", (ProxyExecutable) args -> mean(nonEmpty(args, "mean")));
        members.put("median", (ProxyExecutable) args -> median(nonEmpty(args, "median")));
        members.put("min", (ProxyExecutable) args -> Collections.min(nonEmpty(args, "min")));
        members.put("max", (ProxyExecutable) args -> Collections.max(nonEmpty(args, "max")));
        members.put("variance", (ProxyExecutable) args -> variance(nonEmpty(args, "variance")));
        members.put("stdev", (ProxyExecutable) args -> Math.sqrt(variance(nonEmpty(args, "stdev"))));
        return ProxyObject.fromMap(members);
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }

    private static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 1 ? sorted.get(mid) : (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    /** Sample variance; zero for a single value. */
    private static double variance(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return squares / (values.size() - 1);
    }

    // ==================== Argument helpers ====================

    /**
     * Converts a guest value to text the way JavaScript's {@code String(v)} does.
     * {@link Value#toString()} is not used: it does not yield the string content
     * for guest strings.
     */
    static String text(Value value) {
        if (value.isString()) {
            return value.asString();
        }
        Value converted = value.getContext().eval(GraalJsSandboxExecutor.LANGUAGE_ID, "String").execute(value);
        return converted.isString() ? converted.asString() : "";
    }

    private static List<Double> nonEmpty(Value[] args, String function) {
        List<Double> values = numbers(args, 0, function);
        if (values.isEmpty()) {
            throw new IllegalArgumentException(function + "() requires at least one value");
        }
        return values;
    }

    private static List<Double> numbers(Value[] args, int index, String function) {
        if (args.length <= index || !args[index].hasArrayElements()) {
            throw new IllegalArgumentException(function + "() expects an array of numbers");
        }
        Value array = args[index];
        List<Double> values = new ArrayList<>();
        for (long i = 0; i < array.getArraySize(); i++) {
            Value element = array.getArrayElement(i);
            if (!element.isNumber()) {
                throw new IllegalArgumentException(function + "() expects an array of numbers");
            }
            values.add(element.asDouble());
        }
        return values;
    }

    private static List<String> strings(Value[] args, int index) {
        List<String> values = new ArrayList<>();
        if (args.length > index && args[index].hasArrayElements()) {
            Value array = args[index];
            for (long i = 0; i < array.getArraySize(); i++) {
                values.add(text(array.getArrayElement(i)));
            }
        }
        return values;
    }

    private static String stringArg(Value[] args, int index, String function) {
        if (args.length <= index || !args[index].isString()) {
            throw new IllegalArgumentException(function + "() expects a string argument");
        }
        return args[index].asString();
    }

    private static String optionalString(Value[] args, int index) {
        return args.length > index && args[index].isString() ? args[index].asString() : null;
    }

    private static String readString(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    private static Path truncate(Path path) {
        writeString(path, "", false);
        return path;
    }

    private static void writeString(Path path, String text, boolean append) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (append) {
                Files.writeString(path, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND);
            } else {
                Files.writeString(path, text, StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + path + ": " + e.getMessage(), e);
        }
    }
}

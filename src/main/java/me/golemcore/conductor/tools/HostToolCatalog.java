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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.component.ToolComponent;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.port.outbound.HostBridgePort;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the host-delegated tools from the classpath catalog
 * ({@code host-tools.json} by default). Each entry names the tool, the host
 * method that implements it, a timeout multiplier, whether it needs the access
 * token, and its JSON Schema.
 */
@Component
@Slf4j
public class HostToolCatalog {

    private final ConductorProperties properties;
    private final HostBridgePort hostBridge;
    private final ObjectMapper objectMapper;
    private List<ToolComponent> tools = Collections.emptyList();

    public HostToolCatalog(ConductorProperties properties, HostBridgePort hostBridge, ObjectMapper objectMapper) {
        this.properties = properties;
        this.hostBridge = hostBridge;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        String location = properties.getTools().getCatalogResource();
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            log.warn("[Tools] No {} found, host tools disabled", location);
            return;
        }
        try (InputStream is = resource.getInputStream()) {
            CatalogFile catalog = objectMapper.readValue(is, CatalogFile.class);
            tools = Collections.unmodifiableList(build(catalog));
            log.info("[Tools] Loaded {} host tools from {}", tools.size(), location);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load host tool catalog " + location, e);
        }
    }

    public List<ToolComponent> getTools() {
        return tools;
    }

    private List<ToolComponent> build(CatalogFile catalog) {
        List<ToolComponent> built = new ArrayList<>();
        for (CatalogEntry entry : catalog.getTools()) {
            validate(entry);
            ToolDefinition definition = ToolDefinition.builder()
                    .name(entry.getName())
                    .description(entry.getDescription())
                    .inputSchema(entry.getInputSchema())
                    .build();
            if (ReadPdfTool.TOOL_NAME.equals(entry.getName())) {
                built.add(new ReadPdfTool(definition, entry.getHostMethod(), entry.getTimeoutMultiplier(),
                        hostBridge, objectMapper));
            } else {
                built.add(new HostDelegatedTool(definition, entry.getHostMethod(), entry.getTimeoutMultiplier(),
                        entry.isRequiresAccessToken(), hostBridge, objectMapper));
            }
        }
        return built;
    }

    private void validate(CatalogEntry entry) {
        if (entry.getName() == null || entry.getName().isBlank()) {
            throw new IllegalStateException("Host tool catalog entry without a name");
        }
        if (entry.getTimeoutMultiplier() <= 0) {
            throw new IllegalStateException("Host tool " + entry.getName() + " has a non-positive timeout multiplier");
        }
        ToolDefinition probe = ToolDefinition.builder().inputSchema(entry.getInputSchema()).build();
        for (String required : probe.requiredParameters()) {
            if (!probe.declaredProperties().contains(required)) {
                throw new IllegalStateException(
                        "Host tool " + entry.getName() + " requires undeclared parameter " + required);
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CatalogFile {
        private List<CatalogEntry> tools = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CatalogEntry {
        private String name;
        private String description;
        @JsonProperty("host_method")
        private String hostMethod;
        @JsonProperty("timeout_multiplier")
        private double timeoutMultiplier = 1.0;
        @JsonProperty("requires_access_token")
        private boolean requiresAccessToken;
        @JsonProperty("input_schema")
        private Map<String, Object> inputSchema = new LinkedHashMap<>();
    }
}

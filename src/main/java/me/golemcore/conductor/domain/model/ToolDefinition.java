package me.golemcore.conductor.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tool catalog entry: {@code {name, description, input_schema}}. The schema is
 * sent verbatim to the model and used to validate invocation arguments.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    public static ToolDefinition simple(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    public Set<String> declaredProperties() {
        Set<String> names = new LinkedHashSet<>();
        if (inputSchema != null && inputSchema.get("properties") instanceof Map<?, ?> properties) {
            for (Object key : properties.keySet()) {
                names.add(String.valueOf(key));
            }
        }
        return names;
    }

    public List<String> requiredParameters() {
        List<String> required = new ArrayList<>();
        if (inputSchema != null && inputSchema.get("required") instanceof List<?> list) {
            for (Object item : list) {
                required.add(String.valueOf(item));
            }
        }
        return required;
    }
}

package com.quantpulsar.spantrace.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.quantpulsar.spantrace.chat.SchemaViolation.require;

/**
 * Chat tool definition schema, tagged by {@code type}. Only {@code function} tools exist today.
 *
 * @author Quantpulsar 2025-2026
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type", visible = true)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ChatTool.FunctionTool.class, name = "function")
})
public sealed interface ChatTool {

    String type();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record FunctionTool(String type, FunctionDefinition function) implements ChatTool {
        public FunctionTool {
            require(function, "function");
        }
    }

    /** Name, description and JSON-schema parameters of a callable function. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record FunctionDefinition(String name, String description, FunctionParameters parameters, Boolean strict) {
        public FunctionDefinition {
            require(name, "name");
        }
    }

    /** Top-level parameter schema; always an object, whether or not {@code type} is given. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record FunctionParameters(String type,
                              Map<String, ParameterProperty> properties,
                              List<String> required,
                              Boolean additionalProperties) {
        public FunctionParameters {
            if (type != null && !"object".equals(type)) {
                throw new SchemaViolation("type", "parameters must be of type 'object', got '" + type + "'");
            }
            if (required != null && properties != null) {
                for (String name : required) {
                    if (!properties.containsKey(name)) {
                        throw new SchemaViolation("required", "'" + name + "' is not a declared property");
                    }
                }
            }
        }
    }

    /** Schema of a single parameter. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ParameterProperty(String type,
                             String description,
                             @JsonProperty("enum") List<Object> enumValues,
                             ParameterProperty items) {

        static final Set<String> JSON_TYPES = Set.of("string", "number", "integer", "object", "array", "boolean", "null");

        public ParameterProperty {
            require(type, "type");
            if (!JSON_TYPES.contains(type)) {
                throw new SchemaViolation("type", "unsupported parameter type '" + type + "'");
            }
        }
    }
}

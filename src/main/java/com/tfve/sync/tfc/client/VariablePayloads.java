package com.tfve.sync.tfc.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tfve.sync.core.model.RemoteVariable;
import com.tfve.sync.core.model.VariableTarget;
import com.tfve.sync.core.value.Classification;
import com.tfve.sync.core.value.ValueCodec;
import com.tfve.sync.core.value.ValueCodecException;

/**
 * JSON:API documents of the workspace-variables endpoint.
 *
 * <pre>
 * {"data": {"type": "vars", "id": "var-...",
 *           "attributes": {"key": ..., "value": ..., "description": ..., "category": "terraform", "hcl": ...}}}
 * </pre>
 *
 * The {@code value} attribute always carries the encoded raw value as a JSON string.
 */
public class VariablePayloads {

    static final String TYPE = "vars";

    private final ObjectMapper mapper;
    private final ValueCodec codec;

    public VariablePayloads(ObjectMapper mapper, ValueCodec codec) {
        this.mapper = mapper;
        this.codec = codec;
    }

    /**
     * Request body for create ({@code variableId == null}) or update.
     */
    public String write(String variableId, VariableTarget target) {
        Classification classification = codec.classify(target.value());

        ObjectNode root = mapper.createObjectNode();
        ObjectNode data = root.putObject("data");
        data.put("type", TYPE);
        if (variableId != null) {
            data.put("id", variableId);
        }
        ObjectNode attributes = data.putObject("attributes");
        attributes.put("key", target.name());
        attributes.put("value", codec.encode(target.value()));
        attributes.put("description", target.description() == null ? "" : target.description());
        attributes.put("category", RemoteVariable.TERRAFORM_CATEGORY);
        attributes.put("hcl", classification.hcl());

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ValueCodecException("Cannot write payload for variable " + target.name(), e);
        }
    }

    /**
     * Reads one element of {@code data}, as found in list, create and update responses.
     */
    public RemoteVariable read(JsonNode element) {
        JsonNode attributes = element.path("attributes");
        String id = element.path("id").asText(null);
        String key = attributes.path("key").asText(null);
        if (id == null || key == null) {
            throw new IllegalArgumentException("Variable document lacks id or key: " + element);
        }
        return new RemoteVariable(
                id,
                key,
                attributes.path("hcl").asBoolean(false),
                textOrNull(attributes.path("value")),
                textOrNull(attributes.path("description")),
                textOrNull(attributes.path("category")));
    }

    private static String textOrNull(JsonNode node) {
        return (node.isMissingNode() || node.isNull()) ? null : node.asText();
    }
}

package com.minicrm.backend.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.io.IOException;

/**
 * Entry of a rule group as it travels over the API and is stored on a segment:
 * either a {@link RuleDefinition} or a nested {@link RuleGroupDefinition}.
 */
@JsonDeserialize(using = RuleNodeDefinition.Deserializer.class)
public interface RuleNodeDefinition {

    String getId();

    /**
     * An entry is a group when it carries neither a {@code field} nor an {@code operator}.
     */
    class Deserializer extends JsonDeserializer<RuleNodeDefinition> {
        @Override
        public RuleNodeDefinition deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.getCodec().readTree(p);
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.isObject()) {
                return ctxt.reportInputMismatch(RuleNodeDefinition.class,
                        "Rule entries must be JSON objects, got %s", node.getNodeType());
            }
            if (node.has("field") || node.has("operator")) {
                return p.getCodec().treeToValue(node, RuleDefinition.class);
            }
            return p.getCodec().treeToValue(node, RuleGroupDefinition.class);
        }
    }
}

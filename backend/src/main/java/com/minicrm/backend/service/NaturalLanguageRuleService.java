package com.minicrm.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicrm.backend.model.RuleGroupDefinition;
import com.minicrm.backend.rules.FallbackRuleTable;
import com.minicrm.backend.rules.FieldCatalog;
import com.minicrm.backend.rules.FieldDefinition;
import com.minicrm.backend.rules.Operator;
import com.minicrm.backend.rules.RuleGroup;
import com.minicrm.backend.rules.RuleTreeMapper;
import com.minicrm.backend.rules.RuleValidationException;
import com.minicrm.backend.rules.RuleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a plain-language audience description into a validated rule group.
 * <p>
 * The language model answer goes through the same mapping and validation as rules
 * written by hand. When the model is unavailable or its answer is unusable, the
 * {@link FallbackRuleTable} supplies a LOW confidence rule instead.
 */
@Service
public class NaturalLanguageRuleService {

    private static final Logger log = LoggerFactory.getLogger(NaturalLanguageRuleService.class);

    private static final String PATH = "ruleGroup";

    private final LanguageModelService languageModelService;
    private final RuleTreeMapper ruleTreeMapper;
    private final RuleValidator ruleValidator;
    private final FieldCatalog fieldCatalog;
    private final FallbackRuleTable fallbackRuleTable;
    private final ObjectMapper objectMapper;

    public NaturalLanguageRuleService(LanguageModelService languageModelService,
            RuleTreeMapper ruleTreeMapper,
            RuleValidator ruleValidator,
            FieldCatalog fieldCatalog,
            FallbackRuleTable fallbackRuleTable,
            ObjectMapper objectMapper) {
        this.languageModelService = languageModelService;
        this.ruleTreeMapper = ruleTreeMapper;
        this.ruleValidator = ruleValidator;
        this.fieldCatalog = fieldCatalog;
        this.fallbackRuleTable = fallbackRuleTable;
        this.objectMapper = objectMapper;
    }

    public RuleConversionResult convert(String query) {
        return convert(query, languageModelService.defaultTimeout());
    }

    /**
     * @param timeout upper bound for the language model call
     */
    public RuleConversionResult convert(String query, Duration timeout) {
        String reason;
        try {
            JsonNode answer = languageModelService.completeJson(buildMessages(query), 1000, 0.1, timeout);
            JsonNode groupNode = answer.has("ruleGroup") ? answer.get("ruleGroup") : answer;
            RuleGroupDefinition definition = objectMapper.treeToValue(groupNode, RuleGroupDefinition.class);
            RuleGroup group = ruleTreeMapper.toRuleGroup(definition, PATH);
            if (group.isEmpty()) {
                throw new BridgeUnavailableException("Language model returned an empty rule group");
            }
            ruleValidator.validate(group, PATH);

            JsonNode description = answer.get("description");
            log.info("Converted query to rules: {}", query);
            return RuleConversionResult.success(group, ruleTreeMapper.toDefinition(group),
                    description != null && description.isTextual() ? description.asText() : null);
        } catch (BridgeUnavailableException e) {
            reason = e.getMessage();
        } catch (RuleValidationException e) {
            reason = "Generated rules are invalid at " + e.getPath() + ": " + e.getMessage();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            reason = "Generated rules could not be read: " + e.getMessage();
        }
        log.warn("Falling back to keyword rules for query '{}': {}", query, reason);
        return fallback(query, reason);
    }

    private RuleConversionResult fallback(String query, String reason) {
        FallbackRuleTable.Entry entry = fallbackRuleTable.match(query).orElse(null);
        if (entry == null) {
            return RuleConversionResult.failure("No fallback rule applies: " + reason);
        }
        RuleGroup group = entry.getRuleGroup();
        try {
            ruleValidator.validate(group, "fallback");
        } catch (RuleValidationException e) {
            log.error("Fallback rule for '{}' in table {} is invalid: {}", entry.getKeyword(),
                    fallbackRuleTable.getVersion(), e.getMessage());
            return RuleConversionResult.failure("Fallback rule is invalid: " + e.getMessage());
        }
        return RuleConversionResult.fallback(group, ruleTreeMapper.toDefinition(group), entry.getDescription(),
                reason, fallbackRuleTable.getVersion());
    }

    private List<Map<String, String>> buildMessages(String query) {
        String fields = fieldCatalog.fields().stream()
                .map(this::describeField)
                .collect(Collectors.joining("\n"));

        String prompt = "Convert this audience description into segmentation rules:\n\"" + query + "\"\n\n"
                + "Available fields (name: type, operators, allowed values):\n" + fields + "\n\n"
                + "Rules:\n"
                + "- Use only the fields and operators listed above\n"
                + "- Every rule needs field, operator, value and dataType\n"
                + "- in and not_in take a list, between takes [low, high]\n"
                + "- last_n_days and next_n_days take a whole number of days\n"
                + "- Dates are ISO-8601 strings\n"
                + "- Nest groups inside rules to mix AND and OR\n\n"
                + "Return JSON only:\n"
                + "{\n"
                + "  \"ruleGroup\": {\"logic\": \"AND\", \"rules\": [\n"
                + "    {\"field\": \"totalSpent\", \"operator\": \"greater_than\", \"value\": 1000, \"dataType\": \"number\"}\n"
                + "  ]},\n"
                + "  \"description\": \"Short description of the audience\"\n"
                + "}";

        return List.of(
                Map.of("role", "system", "content",
                        "You are a CRM segmentation expert. You translate audience descriptions into "
                                + "structured customer filters. Always return valid JSON."),
                Map.of("role", "user", "content", prompt));
    }

    private String describeField(FieldDefinition field) {
        String operators = field.getOperators().stream()
                .map(Operator::getCode)
                .collect(Collectors.joining(", "));
        String line = "- " + field.getName() + ": " + field.getDataType().getCode() + ", " + operators;
        return field.hasOptions() ? line + ", values " + field.getOptions() : line;
    }
}

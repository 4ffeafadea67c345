package com.minicrm.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicrm.backend.dto.MessageSuggestion;
import com.minicrm.backend.dto.MessageSuggestionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Campaign copywriting suggestions from the language model, with fixed messages per
 * campaign type when it is unavailable.
 */
@Service
public class MessageSuggestionService {

    private static final Logger log = LoggerFactory.getLogger(MessageSuggestionService.class);

    static final String DEFAULT_CAMPAIGN_TYPE = "nurture";

    private static final Map<String, List<MessageSuggestion>> FALLBACK_MESSAGES = Map.of(
            "promotional", List.of(MessageSuggestion.builder()
                    .title("Limited Time Offer")
                    .message("Hi {{firstName}}, don't miss out on our special offer just for you!")
                    .tone("friendly")
                    .cta("Shop Now")
                    .build()),
            "transactional", List.of(MessageSuggestion.builder()
                    .title("Order Confirmation")
                    .message("Hi {{firstName}}, thank you for your order. We'll keep you updated.")
                    .tone("professional")
                    .cta("Track Order")
                    .build()),
            "nurture", List.of(MessageSuggestion.builder()
                    .title("We Value You")
                    .message("Hi {{firstName}}, thank you for being a valued customer.")
                    .tone("friendly")
                    .cta("Learn More")
                    .build()));

    private final LanguageModelService languageModelService;
    private final ObjectMapper objectMapper;

    public MessageSuggestionService(LanguageModelService languageModelService, ObjectMapper objectMapper) {
        this.languageModelService = languageModelService;
        this.objectMapper = objectMapper;
    }

    public MessageSuggestionResponse generateSuggestions(String campaignType, String audienceDescription,
            String context) {
        String type = normalizeType(campaignType);
        try {
            JsonNode answer = languageModelService.completeJson(buildMessages(type, audienceDescription, context),
                    1500, 0.7, languageModelService.defaultTimeout());
            List<MessageSuggestion> suggestions = new ArrayList<>();
            for (JsonNode node : answer.path("suggestions")) {
                suggestions.add(objectMapper.treeToValue(node, MessageSuggestion.class));
            }
            if (suggestions.isEmpty()) {
                throw new BridgeUnavailableException("Language model returned no suggestions");
            }
            return MessageSuggestionResponse.builder()
                    .campaignType(type)
                    .suggestions(suggestions)
                    .fallback(false)
                    .build();
        } catch (BridgeUnavailableException | JsonProcessingException | IllegalArgumentException e) {
            log.warn("Using fallback messages for {} campaign: {}", type, e.getMessage());
            return fallback(type);
        }
    }

    public MessageSuggestionResponse fallback(String campaignType) {
        String type = normalizeType(campaignType);
        return MessageSuggestionResponse.builder()
                .campaignType(type)
                .suggestions(FALLBACK_MESSAGES.getOrDefault(type, FALLBACK_MESSAGES.get(DEFAULT_CAMPAIGN_TYPE)))
                .fallback(true)
                .build();
    }

    private static String normalizeType(String campaignType) {
        if (campaignType == null || campaignType.isBlank()) {
            return DEFAULT_CAMPAIGN_TYPE;
        }
        return campaignType.trim().toLowerCase(Locale.ROOT);
    }

    private List<Map<String, String>> buildMessages(String campaignType, String audience, String context) {
        String prompt = "Generate 3 personalized message suggestions for a " + campaignType + " campaign.\n\n"
                + "Target audience: " + (audience != null ? audience : "all customers") + "\n"
                + "Campaign context: " + (context != null ? context : "none") + "\n\n"
                + "Requirements:\n"
                + "- Use personalization placeholders like {{firstName}}\n"
                + "- Give each suggestion a different tone\n"
                + "- Keep messages short and end with a clear call to action\n\n"
                + "Return JSON only:\n"
                + "{\"suggestions\": [{\"title\": \"...\", \"message\": \"...\", "
                + "\"tone\": \"professional|friendly|urgent|casual\", \"cta\": \"...\", \"rationale\": \"...\"}]}";

        return List.of(
                Map.of("role", "system", "content",
                        "You are a marketing copywriter who writes personalized campaign messages. "
                                + "Always return valid JSON."),
                Map.of("role", "user", "content", prompt));
    }
}

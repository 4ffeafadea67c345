package com.minicrm.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicrm.backend.dto.MessageSuggestion;
import com.minicrm.backend.dto.MessageSuggestionResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MessageSuggestionServiceTest {

    @Mock
    private LanguageModelService languageModelService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MessageSuggestionService service;

    @BeforeEach
    void setUp() {
        service = new MessageSuggestionService(languageModelService, objectMapper);
    }

    @Test
    void shouldReturnGeneratedSuggestions() throws Exception {
        when(languageModelService.completeJson(anyList(), anyInt(), anyDouble(), any()))
                .thenReturn(objectMapper.readTree("{\"suggestions\":["
                        + "{\"title\":\"Welcome back\",\"message\":\"Hi {{firstName}}, we missed you\","
                        + "\"tone\":\"friendly\",\"cta\":\"Visit\",\"rationale\":\"Re-engagement\"},"
                        + "{\"title\":\"Last chance\",\"message\":\"Hi {{firstName}}, 20% off ends today\","
                        + "\"tone\":\"urgent\",\"cta\":\"Shop Now\"}]}"));

        MessageSuggestionResponse response = service.generateSuggestions("Promotional", "lapsed buyers", null);

        assertFalse(response.isFallback());
        assertEquals("promotional", response.getCampaignType());
        assertEquals(2, response.getSuggestions().size());
        assertEquals("Welcome back", response.getSuggestions().get(0).getTitle());
        assertNull(response.getSuggestions().get(1).getRationale());
    }

    @Test
    void shouldUseFallbackMessagesWhenModelIsUnavailable() {
        when(languageModelService.completeJson(anyList(), anyInt(), anyDouble(), any()))
                .thenThrow(new BridgeUnavailableException("Language model timed out after 15000 ms"));

        MessageSuggestionResponse response = service.generateSuggestions("transactional", null, null);

        assertTrue(response.isFallback());
        assertEquals("Order Confirmation", response.getSuggestions().get(0).getTitle());
    }

    @Test
    void shouldUseFallbackMessagesWhenModelReturnsNoSuggestions() throws Exception {
        when(languageModelService.completeJson(anyList(), anyInt(), anyDouble(), any()))
                .thenReturn(objectMapper.readTree("{\"ideas\":[]}"));

        MessageSuggestionResponse response = service.generateSuggestions("promotional", null, null);

        assertTrue(response.isFallback());
        assertEquals("Limited Time Offer", response.getSuggestions().get(0).getTitle());
    }

    @Test
    void shouldUseFallbackMessagesWhenSuggestionCannotBeConverted() throws Exception {
        ObjectMapper failingMapper = spy(new ObjectMapper());
        doThrow(new IllegalArgumentException("Cannot construct MessageSuggestion"))
                .when(failingMapper).treeToValue(any(JsonNode.class), eq(MessageSuggestion.class));
        when(languageModelService.completeJson(anyList(), anyInt(), anyDouble(), any()))
                .thenReturn(objectMapper.readTree("{\"suggestions\":[{\"title\":\"Hi\"}]}"));
        service = new MessageSuggestionService(languageModelService, failingMapper);

        MessageSuggestionResponse response = service.generateSuggestions("promotional", null, null);

        assertTrue(response.isFallback());
        assertEquals("Limited Time Offer", response.getSuggestions().get(0).getTitle());
    }

    @Test
    void shouldUseNurtureMessagesForUnknownCampaignType() {
        MessageSuggestionResponse response = service.fallback("seasonal");

        assertEquals("seasonal", response.getCampaignType());
        assertEquals("We Value You", response.getSuggestions().get(0).getTitle());
        assertEquals(MessageSuggestionService.DEFAULT_CAMPAIGN_TYPE, service.fallback(null).getCampaignType());
    }
}

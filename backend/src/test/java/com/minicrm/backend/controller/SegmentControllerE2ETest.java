package com.minicrm.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicrm.backend.BaseE2ETest;
import com.minicrm.backend.model.Customer;
import com.minicrm.backend.repository.CustomerRepository;
import com.minicrm.backend.repository.SegmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.oauth2Login;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class SegmentControllerE2ETest extends BaseE2ETest {

    private static final String BIG_SPENDERS = "{\"name\":\"Big spenders\",\"tags\":[\"vip\"],\"ruleGroups\":["
            + "{\"logic\":\"AND\",\"rules\":[{\"id\":\"r1\",\"field\":\"totalSpent\",\"operator\":\"greater_than\","
            + "\"value\":1000,\"dataType\":\"number\"}]}]}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SegmentRepository segmentRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @BeforeEach
    void setUp() {
        segmentRepository.deleteAll();
        customerRepository.deleteAll();
        customerRepository.saveAll(List.of(
                Customer.builder().customerId("c-1").name("Alice").totalSpent(1200.0).build(),
                Customer.builder().customerId("c-2").name("Bob").totalSpent(300.0).build(),
                Customer.builder().customerId("c-3").name("Carol").totalSpent(1500.0).build()));
    }

    private static RequestPostProcessor owner(String sub) {
        return oauth2Login().attributes(attrs -> {
            attrs.put("sub", sub);
            attrs.put("email", sub + "@example.com");
        });
    }

    private String createSegment(String body) throws Exception {
        String response = mockMvc.perform(post("/api/segments")
                        .with(owner("owner-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(response);
        return json.get("id").asText();
    }

    @Test
    void shouldReturnUnauthorizedWithoutAuth() throws Exception {
        mockMvc.perform(get("/api/segments"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void shouldAccessHealthEndpointWithoutAuth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("mini-crm-backend"));
    }

    @Test
    void shouldAccessSwaggerWithoutAuth() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    void shouldListFieldOptions() throws Exception {
        mockMvc.perform(get("/api/segments/fields").with(owner("owner-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fields", hasSize(21)))
                .andExpect(jsonPath("$.fields[?(@.name == 'churnRisk')].options[0]").value("low"))
                .andExpect(jsonPath("$.fields[?(@.name == 'orderCount')].derived").value(true))
                .andExpect(jsonPath("$.operators.boolean", hasSize(2)))
                .andExpect(jsonPath("$.operators.number[0].value").value("equals"));
    }

    @Test
    void shouldCreateAndGetSegment() throws Exception {
        String id = createSegment(BIG_SPENDERS);

        mockMvc.perform(get("/api/segments/" + id).with(owner("owner-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Big spenders"))
                .andExpect(jsonPath("$.audienceSize").value(2))
                .andExpect(jsonPath("$.createdBy").value("owner-1"))
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.ruleGroups[0].rules[0].operator").value("greater_than"));
    }

    @Test
    void shouldReportInvalidRulesWithPath() throws Exception {
        String body = "{\"name\":\"Broken\",\"ruleGroups\":[{\"logic\":\"AND\",\"rules\":["
                + "{\"id\":\"bad\",\"field\":\"creditScore\",\"operator\":\"greater_than\",\"value\":700,"
                + "\"dataType\":\"number\"}]}]}";

        mockMvc.perform(post("/api/segments")
                        .with(owner("owner-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNKNOWN_FIELD"))
                .andExpect(jsonPath("$.path").value("ruleGroups[0].rules[0]"))
                .andExpect(jsonPath("$.ruleId").value("bad"));
    }

    @Test
    void shouldRejectRequestWithoutName() throws Exception {
        mockMvc.perform(post("/api/segments")
                        .with(owner("owner-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ruleGroups\":[{\"logic\":\"AND\",\"rules\":[]}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldNotExposeOtherOwnersSegments() throws Exception {
        String id = createSegment(BIG_SPENDERS);

        mockMvc.perform(get("/api/segments/" + id).with(owner("owner-2")))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/segments/" + id).with(owner("owner-2")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void shouldListSegmentsAsPage() throws Exception {
        createSegment(BIG_SPENDERS);

        mockMvc.perform(get("/api/segments").param("search", "big").with(owner("owner-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.content[0].name").value("Big spenders"));
        mockMvc.perform(get("/api/segments").param("tags", "other").with(owner("owner-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(0));
    }

    @Test
    void shouldUpdateAndDeactivateSegment() throws Exception {
        String id = createSegment(BIG_SPENDERS);

        mockMvc.perform(put("/api/segments/" + id)
                        .with(owner("owner-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ruleGroups\":[{\"rules\":[{\"field\":\"totalSpent\",\"operator\":\">=\","
                                + "\"value\":300,\"dataType\":\"number\"}]}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.audienceSize").value(3))
                .andExpect(jsonPath("$.name").value("Big spenders"));

        mockMvc.perform(delete("/api/segments/" + id).with(owner("owner-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));
    }

    @Test
    void shouldPreviewAudience() throws Exception {
        mockMvc.perform(post("/api/segments/preview")
                        .with(owner("owner-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ruleGroups\":[{\"logic\":\"OR\",\"rules\":["
                                + "{\"field\":\"name\",\"operator\":\"starts_with\",\"value\":\"a\",\"dataType\":\"string\"},"
                                + "{\"field\":\"name\",\"operator\":\"equals\",\"value\":\"Bob\",\"dataType\":\"string\"}"
                                + "]}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.sampleCustomers[0].customerId").value("c-1"))
                .andExpect(jsonPath("$.sampleCustomers[1].name").value("Bob"))
                .andExpect(jsonPath("$.rules[0].logic").value("OR"));
    }

    @Test
    void shouldRejectPreviewWithMismatchedValue() throws Exception {
        mockMvc.perform(post("/api/segments/preview")
                        .with(owner("owner-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ruleGroups\":[{\"rules\":[{\"field\":\"totalSpent\",\"operator\":\"between\","
                                + "\"value\":[500,100],\"dataType\":\"number\"}]}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_RULE"));
    }

    @Test
    void shouldPageSegmentCustomersAndRecalculate() throws Exception {
        String id = createSegment(BIG_SPENDERS);

        mockMvc.perform(get("/api/segments/" + id + "/customers")
                        .param("page", "0")
                        .param("size", "1")
                        .with(owner("owner-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(2))
                .andExpect(jsonPath("$.content", hasSize(1)))
                .andExpect(jsonPath("$.content[0].customerId").value("c-1"));

        customerRepository.save(Customer.builder().customerId("c-4").name("Dan").totalSpent(9000.0).build());

        mockMvc.perform(post("/api/segments/" + id + "/recalculate").with(owner("owner-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.audienceSize").value(3));
    }
}

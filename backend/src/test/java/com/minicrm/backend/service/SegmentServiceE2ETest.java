package com.minicrm.backend.service;

import com.minicrm.backend.BaseE2ETest;
import com.minicrm.backend.dto.CreateSegmentRequest;
import com.minicrm.backend.dto.CustomerSummary;
import com.minicrm.backend.dto.PreviewResponse;
import com.minicrm.backend.dto.RecalculationSummary;
import com.minicrm.backend.dto.UpdateSegmentRequest;
import com.minicrm.backend.model.Customer;
import com.minicrm.backend.model.RuleDefinition;
import com.minicrm.backend.model.RuleGroupDefinition;
import com.minicrm.backend.model.Segment;
import com.minicrm.backend.pubsub.SegmentEventPublisher.EventType;
import com.minicrm.backend.repository.CustomerRepository;
import com.minicrm.backend.repository.SegmentRepository;
import com.minicrm.backend.rules.InvalidRuleException;
import com.minicrm.backend.rules.UnknownFieldException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

class SegmentServiceE2ETest extends BaseE2ETest {

    private static final String OWNER = "owner-1";

    @Autowired
    private SegmentService segmentService;

    @Autowired
    private SegmentRepository segmentRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @BeforeEach
    void setUp() {
        segmentRepository.deleteAll();
        customerRepository.deleteAll();
        customerRepository.saveAll(List.of(
                customer("c-1", "Alice", 1200.0),
                customer("c-2", "Bob", 300.0),
                customer("c-3", "Carol", 1500.0)));
    }

    private static Customer customer(String customerId, String name, double totalSpent) {
        return Customer.builder()
                .customerId(customerId)
                .name(name)
                .email(name.toLowerCase() + "@example.com")
                .totalSpent(totalSpent)
                .status("active")
                .build();
    }

    private static List<RuleGroupDefinition> spentOver(Object amount) {
        return List.of(RuleGroupDefinition.builder()
                .logic("AND")
                .rules(List.of(RuleDefinition.builder()
                        .id("r1")
                        .field("totalSpent")
                        .operator(">")
                        .value(amount)
                        .dataType("number")
                        .build()))
                .build());
    }

    private Segment create(String name, Object amount) {
        return segmentService.createSegment(OWNER, CreateSegmentRequest.builder()
                .name(name)
                .description("Customers who spent over " + amount)
                .ruleGroups(spentOver(amount))
                .tags(List.of("spend"))
                .build());
    }

    @Test
    void shouldCreateSegmentWithAudienceSize() {
        // When
        Segment segment = create("Big spenders", 1000);

        // Then
        assertNotNull(segment.getId());
        assertEquals(2, segment.getAudienceSize());
        assertEquals(OWNER, segment.getCreatedBy());
        assertTrue(segment.isActive());
        assertNotNull(segment.getLastCalculated());
        assertNotNull(segment.getCreatedAt());

        // Stored rules are canonical
        Segment stored = segmentRepository.findById(segment.getId()).orElseThrow();
        RuleDefinition rule = (RuleDefinition) stored.getRuleGroups().get(0).getRules().get(0);
        assertEquals("greater_than", rule.getOperator());
        assertEquals("r1", rule.getId());
        verify(segmentEventPublisher).publishEvent(eq(segment.getId()), eq(EventType.SEGMENT_CREATED), anyMap());
    }

    @Test
    void shouldNotSaveSegmentWithInvalidRules() {
        CreateSegmentRequest request = CreateSegmentRequest.builder()
                .name("Broken")
                .ruleGroups(List.of(RuleGroupDefinition.builder()
                        .rules(List.of(RuleDefinition.builder()
                                .field("creditScore").operator("greater_than").value(700).dataType("number")
                                .build()))
                        .build()))
                .build();

        UnknownFieldException e = assertThrows(UnknownFieldException.class,
                () -> segmentService.createSegment(OWNER, request));
        assertEquals("ruleGroups[0].rules[0]", e.getPath());
        assertEquals(0, segmentRepository.count());
    }

    @Test
    void shouldListOwnSegmentsWithFilters() {
        create("Big spenders", 1000);
        create("Small spenders", 100);
        segmentService.createSegment("someone-else", CreateSegmentRequest.builder()
                .name("Big spenders elsewhere")
                .ruleGroups(spentOver(1000))
                .build());

        Page<Segment> all = segmentService.listSegments(OWNER, null, null, null, PageRequest.of(0, 10));
        assertEquals(2, all.getTotalElements());
        assertEquals("Small spenders", all.getContent().get(0).getName());

        Page<Segment> search = segmentService.listSegments(OWNER, "BIG", null, null, PageRequest.of(0, 10));
        assertEquals(1, search.getTotalElements());

        Page<Segment> tagged = segmentService.listSegments(OWNER, null, true, List.of("spend", "other"),
                PageRequest.of(0, 1));
        assertEquals(2, tagged.getTotalElements());
        assertEquals(1, tagged.getContent().size());
    }

    @Test
    void shouldTreatRegexCharactersInSearchLiterally() {
        create("Big spenders", 1000);

        Page<Segment> result = segmentService.listSegments(OWNER, "Big.*", null, null, PageRequest.of(0, 10));

        assertEquals(0, result.getTotalElements());
    }

    @Test
    void shouldRecountWhenRulesChange() {
        Segment segment = create("Big spenders", 1000);

        Segment updated = segmentService.updateSegment(segment.getId(), OWNER, UpdateSegmentRequest.builder()
                .name("Everyone over 200")
                .ruleGroups(spentOver(200))
                .build());

        assertEquals(3, updated.getAudienceSize());
        assertEquals("Everyone over 200", updated.getName());
        assertEquals("Customers who spent over 1000", updated.getDescription());
        verify(segmentEventPublisher).publishEvent(eq(segment.getId()), eq(EventType.SEGMENT_UPDATED), anyMap());
    }

    @Test
    void shouldKeepSegmentWhenUpdateRulesAreInvalid() {
        Segment segment = create("Big spenders", 1000);

        assertThrows(InvalidRuleException.class, () -> segmentService.updateSegment(segment.getId(), OWNER,
                UpdateSegmentRequest.builder().ruleGroups(spentOver("lots")).build()));

        Segment stored = segmentRepository.findById(segment.getId()).orElseThrow();
        assertEquals(2, stored.getAudienceSize());
    }

    @Test
    void shouldSoftDeleteSegment() {
        Segment segment = create("Big spenders", 1000);

        segmentService.deleteSegment(segment.getId(), OWNER);

        Segment stored = segmentRepository.findById(segment.getId()).orElseThrow();
        assertFalse(stored.isActive());
        assertEquals(1, segmentService.listSegments(OWNER, null, false, null, PageRequest.of(0, 10))
                .getTotalElements());
    }

    @Test
    void shouldHideOtherOwnersSegments() {
        Segment segment = create("Big spenders", 1000);

        assertTrue(segmentService.findForOwner(segment.getId(), "intruder").isEmpty());
        assertThrows(SegmentNotFoundException.class,
                () -> segmentService.deleteSegment(segment.getId(), "intruder"));
    }

    @Test
    void shouldRecalculateAfterCustomersChange() {
        Segment segment = create("Big spenders", 1000);
        customerRepository.save(customer("c-4", "Dan", 5000.0));

        Segment recalculated = segmentService.recalculate(segment.getId(), OWNER);

        assertEquals(3, recalculated.getAudienceSize());
        assertEquals("Big spenders", recalculated.getName());
        verify(segmentEventPublisher).publishEvent(eq(segment.getId()), eq(EventType.AUDIENCE_RECALCULATED),
                anyMap());
    }

    @Test
    void shouldRecalculateAllActiveSegments() {
        Segment big = create("Big spenders", 1000);
        Segment whales = create("Whales", 2000);
        segmentService.deleteSegment(whales.getId(), OWNER);
        customerRepository.save(customer("c-4", "Dan", 5000.0));

        RecalculationSummary summary = segmentService.recalculateAll();

        assertEquals(1, summary.getTotal());
        assertEquals(1, summary.getUpdated());
        assertEquals(0, summary.getFailed());
        assertEquals(3, segmentRepository.findById(big.getId()).orElseThrow().getAudienceSize());
        // inactive segments keep their last count
        assertEquals(0, segmentRepository.findById(whales.getId()).orElseThrow().getAudienceSize());
    }

    @Test
    void shouldPreviewWithoutSaving() {
        PreviewResponse preview = segmentService.preview(spentOver(1000));

        assertEquals(2, preview.getCount());
        assertEquals(List.of("c-1", "c-3"), preview.getSampleCustomers().stream()
                .map(CustomerSummary::getCustomerId)
                .collect(Collectors.toList()));
        assertEquals("greater_than", ((RuleDefinition) preview.getRules().get(0).getRules().get(0)).getOperator());
        assertEquals(0, segmentRepository.count());
    }

    @Test
    void shouldPageSegmentCustomers() {
        Segment segment = create("Big spenders", 1000);

        var page = segmentService.findCustomers(segment.getId(), OWNER, PageRequest.of(0, 1));

        assertEquals(2, page.getTotalElements());
        assertEquals("c-1", page.getContent().get(0).getCustomerId());
    }
}

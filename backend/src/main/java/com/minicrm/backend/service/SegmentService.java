package com.minicrm.backend.service;

import com.minicrm.backend.dto.AudiencePreview;
import com.minicrm.backend.dto.CreateSegmentRequest;
import com.minicrm.backend.dto.CustomerSummary;
import com.minicrm.backend.dto.PreviewResponse;
import com.minicrm.backend.dto.RecalculationSummary;
import com.minicrm.backend.dto.UpdateSegmentRequest;
import com.minicrm.backend.model.RuleGroupDefinition;
import com.minicrm.backend.model.Segment;
import com.minicrm.backend.pubsub.SegmentEventPublisher;
import com.minicrm.backend.pubsub.SegmentEventPublisher.EventType;
import com.minicrm.backend.repository.SegmentRepository;
import com.minicrm.backend.rules.CompiledQuery;
import com.minicrm.backend.rules.EvaluationException;
import com.minicrm.backend.rules.QueryCompiler;
import com.minicrm.backend.rules.RuleGroup;
import com.minicrm.backend.rules.RuleTreeMapper;
import com.minicrm.backend.rules.RuleValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.data.support.PageableExecutionUtils;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Segment lifecycle: rules are mapped, validated and compiled before anything is saved,
 * and the cached audience size is refreshed whenever the rules change.
 */
@Service
public class SegmentService {

    private static final Logger log = LoggerFactory.getLogger(SegmentService.class);

    private final SegmentRepository segmentRepository;
    private final MongoTemplate mongoTemplate;
    private final RuleTreeMapper ruleTreeMapper;
    private final QueryCompiler queryCompiler;
    private final AudienceEvaluator audienceEvaluator;
    private final SegmentEventPublisher eventPublisher;

    public SegmentService(SegmentRepository segmentRepository,
            MongoTemplate mongoTemplate,
            RuleTreeMapper ruleTreeMapper,
            QueryCompiler queryCompiler,
            AudienceEvaluator audienceEvaluator,
            SegmentEventPublisher eventPublisher) {
        this.segmentRepository = segmentRepository;
        this.mongoTemplate = mongoTemplate;
        this.ruleTreeMapper = ruleTreeMapper;
        this.queryCompiler = queryCompiler;
        this.audienceEvaluator = audienceEvaluator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Create a segment with its audience counted.
     *
     * @throws RuleValidationException if the rules are invalid; nothing is saved
     * @throws EvaluationException     if the audience could not be counted
     */
    public Segment createSegment(String ownerId, CreateSegmentRequest request) {
        List<RuleGroup> groups = ruleTreeMapper.toRuleGroups(request.getRuleGroups());
        CompiledQuery compiled = queryCompiler.compile(groups);
        long audienceSize = audienceEvaluator.count(compiled);

        Segment segment = Segment.builder()
                .name(request.getName())
                .description(request.getDescription())
                .createdBy(ownerId)
                .ruleGroups(ruleTreeMapper.toDefinitions(groups))
                .naturalLanguageQuery(request.getNaturalLanguageQuery())
                .ruleConfidence(request.getRuleConfidence())
                .audienceSize(audienceSize)
                .lastCalculated(compiled.getCompiledAt())
                .tags(request.getTags() != null ? request.getTags() : new ArrayList<>())
                .build();

        segment = segmentRepository.save(segment);
        log.info("Created segment {} for {} with audience {}", segment.getId(), ownerId, audienceSize);
        eventPublisher.publishEvent(segment.getId(), EventType.SEGMENT_CREATED,
                Map.of("audienceSize", audienceSize));
        return segment;
    }

    /**
     * Owner's segments, newest first unless the page asks for another order.
     */
    public Page<Segment> listSegments(String ownerId, String search, Boolean active, List<String> tags,
            Pageable pageable) {
        Query query = new Query(Criteria.where("createdBy").is(ownerId));
        if (search != null && !search.isBlank()) {
            String pattern = Pattern.quote(search.trim());
            query.addCriteria(new Criteria().orOperator(
                    Criteria.where("name").regex(pattern, "i"),
                    Criteria.where("description").regex(pattern, "i")));
        }
        if (active != null) {
            query.addCriteria(Criteria.where("active").is(active));
        }
        if (tags != null && !tags.isEmpty()) {
            query.addCriteria(Criteria.where("tags").in(tags));
        }

        Query countQuery = Query.of(query);
        query.with(pageable);
        if (pageable.getSort().isUnsorted()) {
            query.with(Sort.by(Sort.Direction.DESC, "createdAt"));
        }
        List<Segment> segments = mongoTemplate.find(query, Segment.class);
        return PageableExecutionUtils.getPage(segments, pageable,
                () -> mongoTemplate.count(countQuery, Segment.class));
    }

    public Optional<Segment> findForOwner(String segmentId, String ownerId) {
        return segmentRepository.findByIdAndCreatedBy(segmentId, ownerId);
    }

    /**
     * Apply the non-null fields of {@code request}. New rules are validated and the audience
     * recounted before the segment is saved.
     */
    public Segment updateSegment(String segmentId, String ownerId, UpdateSegmentRequest request) {
        Segment segment = requireOwned(segmentId, ownerId);

        if (request.getRuleGroups() != null) {
            List<RuleGroup> groups = ruleTreeMapper.toRuleGroups(request.getRuleGroups());
            CompiledQuery compiled = queryCompiler.compile(groups);
            segment.setAudienceSize(audienceEvaluator.count(compiled));
            segment.setLastCalculated(compiled.getCompiledAt());
            segment.setRuleGroups(ruleTreeMapper.toDefinitions(groups));
            segment.setRuleConfidence(request.getRuleConfidence());
        }
        if (request.getName() != null) {
            segment.setName(request.getName());
        }
        if (request.getDescription() != null) {
            segment.setDescription(request.getDescription());
        }
        if (request.getNaturalLanguageQuery() != null) {
            segment.setNaturalLanguageQuery(request.getNaturalLanguageQuery());
        }
        if (request.getActive() != null) {
            segment.setActive(request.getActive());
        }
        if (request.getTags() != null) {
            segment.setTags(request.getTags());
        }

        segment = segmentRepository.save(segment);
        eventPublisher.publishEvent(segment.getId(), EventType.SEGMENT_UPDATED,
                Map.of("audienceSize", segment.getAudienceSize()));
        return segment;
    }

    /**
     * Soft delete: the segment is kept but marked inactive.
     */
    public Segment deleteSegment(String segmentId, String ownerId) {
        Segment segment = requireOwned(segmentId, ownerId);
        segment.setActive(false);
        segment = segmentRepository.save(segment);
        log.info("Deactivated segment {}", segmentId);
        eventPublisher.publishEvent(segmentId, EventType.SEGMENT_DELETED, Map.of());
        return segment;
    }

    /**
     * Evaluate rules without saving them.
     */
    public PreviewResponse preview(List<RuleGroupDefinition> ruleGroups) {
        List<RuleGroup> groups = ruleTreeMapper.toRuleGroups(ruleGroups);
        AudiencePreview preview = audienceEvaluator.preview(queryCompiler.compile(groups));
        return PreviewResponse.builder()
                .count(preview.getCount())
                .sampleCustomers(preview.getSampleCustomers())
                .rules(ruleTreeMapper.toDefinitions(groups))
                .previewedAt(preview.getComputedAt())
                .build();
    }

    public Page<CustomerSummary> findCustomers(String segmentId, String ownerId, Pageable pageable) {
        Segment segment = requireOwned(segmentId, ownerId);
        return audienceEvaluator.findCustomers(compile(segment), pageable);
    }

    public Segment recalculate(String segmentId, String ownerId) {
        return recalculate(requireOwned(segmentId, ownerId));
    }

    /**
     * Recount every active segment. A failing segment is logged and skipped.
     */
    public RecalculationSummary recalculateAll() {
        List<Segment> segments = segmentRepository.findByActiveTrue();
        int updated = 0;
        List<String> failed = new ArrayList<>();
        for (Segment segment : segments) {
            try {
                recalculate(segment);
                updated++;
            } catch (RuleValidationException | EvaluationException | SegmentNotFoundException e) {
                log.warn("Failed to recalculate segment {}: {}", segment.getId(), e.getMessage());
                failed.add(segment.getId());
            }
        }
        log.info("Recalculated {} of {} active segment(s)", updated, segments.size());
        return RecalculationSummary.builder()
                .total(segments.size())
                .updated(updated)
                .failed(failed.size())
                .failedSegmentIds(failed)
                .completedAt(Instant.now())
                .build();
    }

    /**
     * Recount and store the audience size with a single atomic {@code $set}.
     */
    private Segment recalculate(Segment segment) {
        CompiledQuery compiled = compile(segment);
        long audienceSize = audienceEvaluator.count(compiled);

        Query query = new Query(Criteria.where("_id").is(segment.getId()));
        Update update = new Update()
                .set("audienceSize", audienceSize)
                .set("lastCalculated", compiled.getCompiledAt());
        Segment saved = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Segment.class);
        if (saved == null) {
            throw new SegmentNotFoundException(segment.getId());
        }

        eventPublisher.publishEvent(segment.getId(), EventType.AUDIENCE_RECALCULATED,
                Map.of("audienceSize", audienceSize));
        return saved;
    }

    private CompiledQuery compile(Segment segment) {
        return queryCompiler.compile(ruleTreeMapper.toRuleGroups(segment.getRuleGroups()));
    }

    private Segment requireOwned(String segmentId, String ownerId) {
        return segmentRepository.findByIdAndCreatedBy(segmentId, ownerId)
                .orElseThrow(() -> new SegmentNotFoundException(segmentId));
    }
}

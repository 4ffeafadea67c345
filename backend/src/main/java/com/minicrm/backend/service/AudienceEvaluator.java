package com.minicrm.backend.service;

import com.minicrm.backend.dto.AudiencePreview;
import com.minicrm.backend.dto.CustomerSummary;
import com.minicrm.backend.rules.CompiledQuery;
import com.minicrm.backend.rules.EvaluationException;
import com.mongodb.MongoException;
import org.bson.Document;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Runs compiled audience queries against the customers collection.
 */
@Service
public class AudienceEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AudienceEvaluator.class);

    static final String CUSTOMERS_COLLECTION = "customers";

    private static final Document SORT = new Document("$sort", new Document("customerId", 1).append("_id", 1));
    private static final Document SUMMARY = new Document("$project", new Document()
            .append("_id", 0)
            .append("customerId", 1)
            .append("name", 1)
            .append("email", 1)
            .append("totalSpent", 1)
            .append("totalVisits", 1)
            .append("lastVisit", 1));

    private final MongoTemplate mongoTemplate;
    private final int sampleSize;

    public AudienceEvaluator(MongoTemplate mongoTemplate,
            @Value("${segments.preview.sample-size:10}") int sampleSize) {
        this.mongoTemplate = mongoTemplate;
        this.sampleSize = sampleSize;
    }

    /**
     * Count the audience and fetch the first customers of it in one query, so both come
     * from the same snapshot.
     */
    public AudiencePreview preview(CompiledQuery compiled) {
        Document facet = new Document("$facet", new Document()
                .append("total", List.of(new Document("$count", "total")))
                .append("sample", List.of(SORT, new Document("$limit", sampleSize), SUMMARY)));
        Document result = first(compiled.pipeline(facet));

        List<CustomerSummary> sample = summaries(result);
        long count = total(result);
        log.debug("Previewed audience of {} customer(s)", count);
        return AudiencePreview.builder()
                .count(count)
                .sampleCustomers(sample)
                .computedAt(compiled.getCompiledAt())
                .build();
    }

    public long count(CompiledQuery compiled) {
        Document result = first(compiled.pipeline(new Document("$count", "total")));
        return result != null ? ((Number) result.get("total")).longValue() : 0L;
    }

    /**
     * One page of the audience in customerId order, with the total audience size.
     */
    public Page<CustomerSummary> findCustomers(CompiledQuery compiled, Pageable pageable) {
        Document facet = new Document("$facet", new Document()
                .append("total", List.of(new Document("$count", "total")))
                .append("sample", List.of(SORT,
                        new Document("$skip", pageable.getOffset()),
                        new Document("$limit", pageable.getPageSize()),
                        SUMMARY)));
        Document result = first(compiled.pipeline(facet));
        return new PageImpl<>(summaries(result), pageable, total(result));
    }

    private Document first(List<Document> pipeline) {
        try {
            return mongoTemplate.getCollection(CUSTOMERS_COLLECTION)
                    .aggregate(pipeline, Document.class)
                    .allowDiskUse(true)
                    .first();
        } catch (MongoException | CodecConfigurationException e) {
            String json = CompiledQuery.toJson(pipeline);
            log.error("Audience query failed: {} pipeline={}", e.getMessage(), json);
            throw new EvaluationException("Audience query failed: " + e.getMessage(), json, e);
        }
    }

    private static long total(Document result) {
        if (result == null) {
            return 0L;
        }
        List<Document> total = result.getList("total", Document.class);
        if (total == null || total.isEmpty()) {
            return 0L;
        }
        return ((Number) total.get(0).get("total")).longValue();
    }

    private static List<CustomerSummary> summaries(Document result) {
        List<CustomerSummary> customers = new ArrayList<>();
        if (result == null) {
            return customers;
        }
        List<Document> sample = result.getList("sample", Document.class);
        if (sample == null) {
            return customers;
        }
        for (Document doc : sample) {
            customers.add(toSummary(doc));
        }
        return customers;
    }

    private static CustomerSummary toSummary(Document doc) {
        Object totalSpent = doc.get("totalSpent");
        Object totalVisits = doc.get("totalVisits");
        Object lastVisit = doc.get("lastVisit");
        return CustomerSummary.builder()
                .customerId(doc.getString("customerId"))
                .name(doc.getString("name"))
                .email(doc.getString("email"))
                .totalSpent(totalSpent instanceof Number n ? n.doubleValue() : null)
                .totalVisits(totalVisits instanceof Number n ? n.intValue() : null)
                .lastVisit(lastVisit instanceof Date d ? d.toInstant() : null)
                .build();
    }
}

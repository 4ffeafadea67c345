package com.minicrm.backend.rules;

import lombok.Value;
import org.bson.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aggregation stages selecting an audience from the {@code customers} collection.
 * Relative date rules are resolved against {@code compiledAt}.
 */
@Value
public class CompiledQuery {

    List<Document> stages;
    Instant compiledAt;
    Set<DerivedField> derivedFields;

    public CompiledQuery(List<Document> stages, Instant compiledAt, Set<DerivedField> derivedFields) {
        this.stages = List.copyOf(stages);
        this.compiledAt = compiledAt;
        this.derivedFields = Set.copyOf(derivedFields);
    }

    /**
     * The audience stages followed by {@code tail}.
     */
    public List<Document> pipeline(Document... tail) {
        List<Document> pipeline = new ArrayList<>(stages);
        pipeline.addAll(Arrays.asList(tail));
        return pipeline;
    }

    public boolean matchesEverything() {
        return stages.isEmpty();
    }

    public String toJson() {
        return toJson(stages);
    }

    public static String toJson(List<Document> pipeline) {
        return pipeline.stream().map(Document::toJson).collect(Collectors.joining(", ", "[", "]"));
    }
}

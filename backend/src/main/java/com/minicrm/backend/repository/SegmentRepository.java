package com.minicrm.backend.repository;

import com.minicrm.backend.model.Segment;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SegmentRepository extends MongoRepository<Segment, String> {

    Optional<Segment> findByIdAndCreatedBy(String id, String createdBy);

    List<Segment> findByActiveTrue();
}

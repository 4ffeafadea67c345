package com.minicrm.backend.service;

/**
 * The segment does not exist or belongs to another user.
 */
public class SegmentNotFoundException extends RuntimeException {

    public SegmentNotFoundException(String segmentId) {
        super("Segment not found: " + segmentId);
    }
}

package io.streamshub.kafkatopics.kafka.model;

import java.util.List;

/**
 * Outcome of a single administrative call.
 *
 * @param error  whether the call failed
 * @param detail failure detail, null on success
 * @param topics topic names returned by a listing, in the order returned,
 *               empty for other operations
 */
public record TopicOperationResult(boolean error, String detail, List<String> topics) {

    public TopicOperationResult {
        topics = topics != null ? List.copyOf(topics) : List.of();
    }

    public static TopicOperationResult success() {
        return new TopicOperationResult(false, null, List.of());
    }

    public static TopicOperationResult listed(List<String> topics) {
        return new TopicOperationResult(false, null, topics);
    }

    public static TopicOperationResult failed(String detail) {
        return new TopicOperationResult(true, detail, List.of());
    }
}

package io.streamshub.kafkatopics.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-operation request data. Each variant carries only the fields its
 * operation accepts.
 */
public sealed interface TopicRequest {

    TopicOperation operation();

    record ListTopics(boolean excludeInternal) implements TopicRequest {
        @Override
        public TopicOperation operation() {
            return TopicOperation.LIST;
        }
    }

    record CreateTopic(String topic, int partitions, int replicationFactor, Map<String, String> configs) implements TopicRequest {
        public CreateTopic {
            Objects.requireNonNull(topic, "topic");
            configs = Collections.unmodifiableMap(new LinkedHashMap<>(configs));
        }

        @Override
        public TopicOperation operation() {
            return TopicOperation.CREATE;
        }
    }

    record DeleteTopic(String topic) implements TopicRequest {
        public DeleteTopic {
            Objects.requireNonNull(topic, "topic");
        }

        @Override
        public TopicOperation operation() {
            return TopicOperation.DELETE;
        }
    }
}

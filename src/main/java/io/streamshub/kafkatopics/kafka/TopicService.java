package io.streamshub.kafkatopics.kafka;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;

import jakarta.enterprise.context.ApplicationScoped;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.CreateTopicsResult;
import org.apache.kafka.clients.admin.DeleteTopicsResult;
import org.apache.kafka.clients.admin.ListTopicsOptions;
import org.apache.kafka.clients.admin.ListTopicsResult;
import org.apache.kafka.clients.admin.NewTopic;
import org.jboss.logging.Logger;

import io.streamshub.kafkatopics.kafka.model.TopicOperationResult;
import io.streamshub.kafkatopics.support.RootCause;

/**
 * Topic operations against a Kafka {@link Admin} client. Each call blocks until
 * the cluster responds and reports failures through the returned
 * {@link TopicOperationResult} rather than by throwing.
 */
@ApplicationScoped
public class TopicService {

    private static final Logger LOGGER = Logger.getLogger(TopicService.class);

    /**
     * List topic names, in the order the client returns them
     */
    public TopicOperationResult listTopics(Admin admin, boolean excludeInternal) {
        ListTopicsOptions options = new ListTopicsOptions().listInternal(!excludeInternal);
        ListTopicsResult result = admin.listTopics(options);

        try {
            Set<String> names = result.names().get();
            return TopicOperationResult.listed(new ArrayList<>(names));
        } catch (ExecutionException e) {
            return failed("list topics", e);
        } catch (InterruptedException e) {
            return interrupted("list topics");
        }
    }

    /**
     * Create a single topic
     */
    public TopicOperationResult createTopic(Admin admin, String name, int partitions, int replicationFactor, Map<String, String> configs) {
        NewTopic newTopic = new NewTopic(name, partitions, (short) replicationFactor);
        if (configs != null && !configs.isEmpty()) {
            newTopic.configs(configs);
        }

        CreateTopicsResult result = admin.createTopics(Collections.singleton(newTopic));

        try {
            result.all().get();
            LOGGER.debugf("Created topic %s with %d partition(s), replication factor %d", name, partitions, replicationFactor);
            return TopicOperationResult.success();
        } catch (ExecutionException e) {
            return failed("create topic " + name, e);
        } catch (InterruptedException e) {
            return interrupted("create topic " + name);
        }
    }

    /**
     * Delete a single topic
     */
    public TopicOperationResult deleteTopic(Admin admin, String name) {
        DeleteTopicsResult result = admin.deleteTopics(Collections.singleton(name));

        try {
            result.all().get();
            LOGGER.debugf("Deleted topic %s", name);
            return TopicOperationResult.success();
        } catch (ExecutionException e) {
            return failed("delete topic " + name, e);
        } catch (InterruptedException e) {
            return interrupted("delete topic " + name);
        }
    }

    private static TopicOperationResult failed(String action, ExecutionException e) {
        LOGGER.debugf(e, "Failed to %s", action);
        return TopicOperationResult.failed(RootCause.describe(e));
    }

    private static TopicOperationResult interrupted(String action) {
        Thread.currentThread().interrupt();
        return TopicOperationResult.failed("Interrupted while waiting to " + action);
    }
}

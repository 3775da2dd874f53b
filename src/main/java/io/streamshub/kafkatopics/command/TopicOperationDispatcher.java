package io.streamshub.kafkatopics.command;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Properties;

import jakarta.enterprise.context.ApplicationScoped;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.common.KafkaException;
import org.jboss.logging.Logger;

import io.streamshub.kafkatopics.kafka.KafkaClientFactory;
import io.streamshub.kafkatopics.kafka.TopicService;
import io.streamshub.kafkatopics.kafka.model.TopicOperationResult;
import io.streamshub.kafkatopics.support.RootCause;

/**
 * Runs the single operation of a validated invocation and renders its outcome.
 */
@ApplicationScoped
public class TopicOperationDispatcher {

    private static final Logger LOGGER = Logger.getLogger(TopicOperationDispatcher.class);

    private final KafkaClientFactory clientFactory;
    private final TopicService topicService;

    public TopicOperationDispatcher(KafkaClientFactory clientFactory, TopicService topicService) {
        this.clientFactory = clientFactory;
        this.topicService = topicService;
    }

    /**
     * @return the process exit code, 0 on success and 1 on any failure
     */
    public int dispatch(TopicInvocation invocation, PrintWriter out, PrintWriter err) {
        Properties adminConfig;

        try {
            adminConfig = clientFactory.adminConfiguration(invocation);
        } catch (UncheckedIOException e) {
            LOGGER.debugf(e, "Failed to load Admin client configuration");
            err.println("Error: " + RootCause.describe(e));
            return 1;
        }

        try (Admin admin = clientFactory.createAdminClient(adminConfig)) {
            TopicRequest request = invocation.request();
            TopicOperationResult result;

            if (request instanceof TopicRequest.ListTopics list) {
                result = topicService.listTopics(admin, list.excludeInternal());
            } else if (request instanceof TopicRequest.CreateTopic create) {
                result = topicService.createTopic(admin, create.topic(), create.partitions(),
                        create.replicationFactor(), create.configs());
            } else {
                TopicRequest.DeleteTopic delete = (TopicRequest.DeleteTopic) request;
                result = topicService.deleteTopic(admin, delete.topic());
            }

            if (result.error()) {
                err.println("Error: " + result.detail());
                return 1;
            }

            render(request, result, out);
            return 0;
        } catch (KafkaException e) {
            LOGGER.debugf(e, "Admin client failure");
            err.println("Error: " + RootCause.describe(e));
            return 1;
        }
    }

    private void render(TopicRequest request, TopicOperationResult result, PrintWriter out) {
        switch (request.operation()) {
            case LIST:
                result.topics().forEach(out::println);
                break;
            case CREATE:
                out.println("Topic \"" + ((TopicRequest.CreateTopic) request).topic() + "\" created.");
                break;
            case DELETE:
                out.println("Topic \"" + ((TopicRequest.DeleteTopic) request).topic() + "\" deleted.");
                break;
        }
        out.flush();
    }
}

package io.streamshub.kafkatopics.command;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import io.streamshub.kafkatopics.support.KeyValueParser;
import picocli.CommandLine;

/**
 * Command line options of the tool. Options that only some operations accept
 * are left unset (null) when absent so that {@link #toInvocation()} can tell
 * "not given" apart from any value.
 */
public class TopicArguments {

    static final String ADMIN_CONFIG = "--admin-config";
    static final String TOPIC_PROPS = "--topic-props";

    @CommandLine.Option(
            names = {"--bootstrap-server"},
            paramLabel = "server",
            order = 1,
            description = "REQUIRED: One broker from the Kafka cluster (host:port)"
    )
    String bootstrapServer;

    @CommandLine.Option(
            names = {ADMIN_CONFIG},
            paramLabel = "key=value",
            arity = "1..*",
            order = 2,
            description = "Properties for the Admin client (e.g. security settings), repeatable"
    )
    List<String> adminConfig;

    @CommandLine.Option(
            names = {"--command-config"},
            paramLabel = "file",
            order = 3,
            description = "Properties or YAML file with configuration for the Admin client"
    )
    Path commandConfig;

    @CommandLine.Option(names = {"--list"}, order = 4, description = "List topics")
    boolean list;

    @CommandLine.Option(names = {"--create"}, order = 5, description = "Create a topic")
    boolean create;

    @CommandLine.Option(names = {"--delete"}, order = 6, description = "Delete a topic")
    boolean delete;

    @CommandLine.Option(
            names = {"--topic"},
            paramLabel = "name",
            order = 7,
            description = "Topic name, REQUIRED for --create and --delete"
    )
    String topic;

    @CommandLine.Option(
            names = {"--partitions"},
            paramLabel = "count",
            order = 8,
            description = "Number of partitions, REQUIRED for --create"
    )
    Integer partitions;

    @CommandLine.Option(
            names = {"--replication-factor"},
            paramLabel = "count",
            order = 9,
            description = "Replication factor, REQUIRED for --create"
    )
    Integer replicationFactor;

    @CommandLine.Option(
            names = {TOPIC_PROPS},
            paramLabel = "key=value",
            arity = "1..*",
            order = 10,
            description = "Topic configuration for --create (e.g. retention.ms=86400000), repeatable"
    )
    List<String> topicProps;

    @CommandLine.Option(
            names = {"--exclude-internal"},
            order = 11,
            description = "Leave internal topics out of --list"
    )
    boolean excludeInternal;

    /**
     * Validate the parsed options and build the invocation they describe.
     *
     * @return the validated invocation
     * @throws IllegalArgumentException when the options do not form a valid
     *         invocation, with a message fit for the user
     */
    public TopicInvocation toInvocation() {
        if (bootstrapServer == null || bootstrapServer.isBlank()) {
            throw new IllegalArgumentException("Missing required option: '--bootstrap-server'");
        }

        TopicRequest request;

        switch (selectedOperation()) {
            case LIST:
                request = listRequest();
                break;
            case CREATE:
                request = createRequest();
                break;
            default:
                request = deleteRequest();
                break;
        }

        Map<String, String> adminOverrides = KeyValueParser.parse(ADMIN_CONFIG, adminConfig);

        return new TopicInvocation(bootstrapServer, Optional.ofNullable(commandConfig), adminOverrides, request);
    }

    private TopicOperation selectedOperation() {
        List<TopicOperation> selected = new ArrayList<>(1);

        if (list) {
            selected.add(TopicOperation.LIST);
        }
        if (create) {
            selected.add(TopicOperation.CREATE);
        }
        if (delete) {
            selected.add(TopicOperation.DELETE);
        }

        if (selected.size() != 1) {
            String options = Arrays.stream(TopicOperation.values())
                    .map(TopicOperation::option)
                    .collect(Collectors.joining("/"));
            throw new IllegalArgumentException("Must choose exactly one operation from '" + options + "'");
        }

        return selected.get(0);
    }

    private TopicRequest listRequest() {
        if (topic != null || partitions != null || replicationFactor != null || topicProps != null) {
            throw new IllegalArgumentException(
                    "The --list operation cannot take any of the '--topic/--partitions/--replication-factor/--topic-props' options");
        }

        return new TopicRequest.ListTopics(excludeInternal);
    }

    private TopicRequest createRequest() {
        if (topic == null || partitions == null || replicationFactor == null) {
            throw new IllegalArgumentException(
                    "The --create operation requires the '--topic/--partitions/--replication-factor' options");
        }
        if (excludeInternal) {
            throw new IllegalArgumentException("The --create operation cannot take the '--exclude-internal' option");
        }

        requireTopicName();

        if (partitions <= 0) {
            throw new IllegalArgumentException("--partitions must be a positive integer, got: " + partitions);
        }
        if (replicationFactor <= 0 || replicationFactor > Short.MAX_VALUE) {
            throw new IllegalArgumentException("--replication-factor must be a positive integer no greater than "
                    + Short.MAX_VALUE + ", got: " + replicationFactor);
        }

        Map<String, String> configs = KeyValueParser.parse(TOPIC_PROPS, topicProps);
        return new TopicRequest.CreateTopic(topic, partitions, replicationFactor, configs);
    }

    private TopicRequest deleteRequest() {
        if (topic == null) {
            throw new IllegalArgumentException("The --delete operation requires the '--topic' option");
        }
        if (partitions != null || replicationFactor != null || topicProps != null || excludeInternal) {
            throw new IllegalArgumentException(
                    "The --delete operation cannot take any of the '--partitions/--replication-factor/--topic-props/--exclude-internal' options");
        }

        requireTopicName();
        return new TopicRequest.DeleteTopic(topic);
    }

    private void requireTopicName() {
        if (topic.isBlank()) {
            throw new IllegalArgumentException("--topic must not be empty");
        }
    }
}

package io.streamshub.kafkatopics.kafka;

import java.util.Properties;

import jakarta.enterprise.context.ApplicationScoped;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.streamshub.kafkatopics.command.TopicInvocation;
import io.streamshub.kafkatopics.config.AdminConfigLoader;

@ApplicationScoped
public class KafkaClientFactory {

    private static final Logger LOGGER = Logger.getLogger(KafkaClientFactory.class);

    private final AdminConfigLoader configLoader;
    private final String clientId;

    public KafkaClientFactory(
            AdminConfigLoader configLoader,
            @ConfigProperty(name = "kafka-topics.client-id", defaultValue = "kafka-topics")
            String clientId) {
        this.configLoader = configLoader;
        this.clientId = clientId;
    }

    /**
     * Build the Admin client configuration for an invocation. Later sources
     * overwrite earlier ones: the client id, then the bootstrap server, then
     * the {@code --command-config} file, then each {@code --admin-config} pair.
     *
     * @throws java.io.UncheckedIOException if the command config file can not be read
     */
    public Properties adminConfiguration(TopicInvocation invocation) {
        Properties props = new Properties();

        props.put(AdminClientConfig.CLIENT_ID_CONFIG, clientId);
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, invocation.bootstrapServer());

        invocation.commandConfig().ifPresent(path -> {
            LOGGER.debugf("Loading Admin client configuration from %s", path);
            props.putAll(configLoader.load(path));
        });

        props.putAll(invocation.adminConfig());

        return props;
    }

    /**
     * Create an Admin client from the given configuration
     *
     * @throws org.apache.kafka.common.KafkaException if the configuration is rejected
     */
    public Admin createAdminClient(Properties props) {
        LOGGER.debugf("Creating Admin client for %s", props.get(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG));
        return Admin.create(props);
    }
}

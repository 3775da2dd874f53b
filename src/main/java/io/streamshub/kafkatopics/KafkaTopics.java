package io.streamshub.kafkatopics;

import java.util.concurrent.Callable;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.apache.kafka.common.utils.AppInfoParser;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import io.quarkus.picocli.runtime.PicocliCommandLineFactory;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import io.streamshub.kafkatopics.command.BaseCommand;
import io.streamshub.kafkatopics.command.TopicArguments;
import io.streamshub.kafkatopics.command.TopicInvocation;
import io.streamshub.kafkatopics.command.TopicOperationDispatcher;
import picocli.CommandLine;
import picocli.CommandLine.IVersionProvider;

@TopCommand
@CommandLine.Command(name = KafkaTopics.NAME,
        mixinStandardHelpOptions = true,
        versionProvider = KafkaTopics.Version.class,
        sortOptions = false,
        description = "List, create and delete Apache Kafka topics"
)
public class KafkaTopics extends BaseCommand implements Callable<Integer> {
    public static final String NAME = "kafka-topics";

    @CommandLine.Mixin
    TopicArguments arguments;

    @Inject
    TopicOperationDispatcher dispatcher;

    @Override
    public Integer call() {
        if (commandSpec.commandLine().getParseResult().originalArgs().isEmpty()) {
            commandSpec.commandLine().usage(out());
            return 0;
        }

        TopicInvocation invocation;

        try {
            invocation = arguments.toInvocation();
        } catch (IllegalArgumentException e) {
            err().println("Error: " + e.getMessage());
            return 1;
        }

        return dispatcher.dispatch(invocation, out(), err());
    }

    /**
     * Usage header, naming the Kafka client library this build runs against.
     */
    public static String[] header() {
        return new String[] {
            "This tool helps in Kafka topic operations",
            "    (with kafka-clients v" + AppInfoParser.getVersion() + ")",
            ""
        };
    }

    @ApplicationScoped
    public static class Customizer {
        @Produces
        CommandLine commandLine(PicocliCommandLineFactory factory) {
            CommandLine commandLine = factory.create();
            commandLine.getCommandSpec().usageMessage().header(header());
            return commandLine;
        }
    }

    @Singleton
    public static class Version implements IVersionProvider {
        @ConfigProperty(name = "quarkus.application.version")
        String applicationVersion;

        @Override
        public String[] getVersion() throws Exception {
            return new String[] {
                NAME + " " + applicationVersion,
                "kafka-clients " + AppInfoParser.getVersion()
            };
        }
    }
}

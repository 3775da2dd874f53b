package io.streamshub.kafkatopics.command;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully validated command line: where to connect, how to configure the admin
 * client and which single operation to run.
 *
 * @param bootstrapServer broker address used to bootstrap the admin client
 * @param commandConfig   optional file of admin client properties
 * @param adminConfig     admin client overrides, in command line order
 * @param request         the selected operation and its fields
 */
public record TopicInvocation(
        String bootstrapServer,
        Optional<Path> commandConfig,
        Map<String, String> adminConfig,
        TopicRequest request) {

    public TopicInvocation {
        Objects.requireNonNull(bootstrapServer, "bootstrapServer");
        Objects.requireNonNull(commandConfig, "commandConfig");
        Objects.requireNonNull(request, "request");
        adminConfig = Collections.unmodifiableMap(new LinkedHashMap<>(adminConfig));
    }

    public TopicOperation operation() {
        return request.operation();
    }
}

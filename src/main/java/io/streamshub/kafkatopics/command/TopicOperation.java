package io.streamshub.kafkatopics.command;

/**
 * The administrative operations the tool can perform. Exactly one is selected
 * per invocation.
 */
public enum TopicOperation {
    LIST("--list"),
    CREATE("--create"),
    DELETE("--delete");

    private final String option;

    TopicOperation(String option) {
        this.option = option;
    }

    /**
     * @return the command line flag selecting this operation
     */
    public String option() {
        return option;
    }
}

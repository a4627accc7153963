package automata.engine.model.action;

/**
 * Discriminator of the {@link TaskAction} union, with its JSON wire name.
 */
public enum ActionType {
    AI_PROMPT("ai-prompt"),
    SEND_EMAIL("send-email"),
    WEBHOOK("webhook"),
    RUN_CODE("run-code"),
    GENERATE_REPORT("generate-report"),
    CHAIN("chain"),
    WEB_SCRAPE("web-scrape"),
    FILE_OPERATION("file-operation"),
    GOOGLE_WORKSPACE("google-workspace");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}

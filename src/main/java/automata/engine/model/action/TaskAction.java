package automata.engine.model.action;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a task does. Closed union keyed by the JSON "type" field;
 * {@link ChainAction} nests further actions.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AiPromptAction.class, name = "ai-prompt"),
        @JsonSubTypes.Type(value = SendEmailAction.class, name = "send-email"),
        @JsonSubTypes.Type(value = WebhookAction.class, name = "webhook"),
        @JsonSubTypes.Type(value = RunCodeAction.class, name = "run-code"),
        @JsonSubTypes.Type(value = GenerateReportAction.class, name = "generate-report"),
        @JsonSubTypes.Type(value = ChainAction.class, name = "chain"),
        @JsonSubTypes.Type(value = WebScrapeAction.class, name = "web-scrape"),
        @JsonSubTypes.Type(value = FileOperationAction.class, name = "file-operation"),
        @JsonSubTypes.Type(value = GoogleWorkspaceAction.class, name = "google-workspace")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface TaskAction
        permits AiPromptAction, SendEmailAction, WebhookAction, RunCodeAction, GenerateReportAction,
        ChainAction, WebScrapeAction, FileOperationAction, GoogleWorkspaceAction {

    ActionType type();
}

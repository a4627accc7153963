package automata.engine.executor;

import automata.engine.config.EngineConfig;
import automata.engine.executor.handler.AiPromptHandler;
import automata.engine.executor.handler.ChainHandler;
import automata.engine.executor.handler.FileOperationHandler;
import automata.engine.executor.handler.GenerateReportHandler;
import automata.engine.executor.handler.GoogleWorkspaceHandler;
import automata.engine.executor.handler.RunCodeHandler;
import automata.engine.executor.handler.SendEmailHandler;
import automata.engine.executor.handler.WebScrapeHandler;
import automata.engine.executor.handler.WebhookHandler;
import automata.engine.integration.Collaborators;
import automata.engine.model.action.AiPromptAction;
import automata.engine.model.action.ChainAction;
import automata.engine.model.action.FileOperationAction;
import automata.engine.model.action.GenerateReportAction;
import automata.engine.model.action.GoogleWorkspaceAction;
import automata.engine.model.action.RunCodeAction;
import automata.engine.model.action.SendEmailAction;
import automata.engine.model.action.TaskAction;
import automata.engine.model.action.WebScrapeAction;
import automata.engine.model.action.WebhookAction;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;

/**
 * Performs the side effect of a task action and returns its JSON result.
 * Throws {@link automata.engine.exception.ActionException} when the action fails;
 * the failure line is already in the execution log at that point.
 */
public class ActionExecutor {

    private final AiPromptHandler aiPrompt;
    private final SendEmailHandler sendEmail;
    private final WebhookHandler webhook;
    private final RunCodeHandler runCode;
    private final GenerateReportHandler generateReport;
    private final ChainHandler chain;
    private final WebScrapeHandler webScrape;
    private final FileOperationHandler fileOperation;
    private final GoogleWorkspaceHandler googleWorkspace;

    public ActionExecutor(Collaborators collaborators, EngineConfig config) {
        this(collaborators, config, Clock.systemUTC());
    }

    public ActionExecutor(Collaborators collaborators, EngineConfig config, Clock clock) {
        this(collaborators, config, clock, new WebhookHandler(config.webhookTimeout()));
    }

    ActionExecutor(Collaborators collaborators, EngineConfig config, Clock clock, WebhookHandler webhook) {
        this.aiPrompt = new AiPromptHandler(collaborators.llm().orElse(null), config.defaultModel());
        this.sendEmail = new SendEmailHandler(collaborators.emailSender().orElse(null));
        this.webhook = webhook;
        this.runCode = new RunCodeHandler(collaborators.codeSandbox().orElse(null), config.logTruncateLength());
        this.generateReport = new GenerateReportHandler(collaborators.llm().orElse(null), config.defaultModel(),
                clock);
        this.chain = new ChainHandler(this);
        this.webScrape = new WebScrapeHandler(collaborators.webScraper().orElse(null));
        this.fileOperation = new FileOperationHandler();
        this.googleWorkspace = new GoogleWorkspaceHandler(collaborators.workspaceClient().orElse(null));
    }

    public JsonNode execute(TaskAction action, ExecutionLog executionLog) {
        switch (action.type()) {
            case AI_PROMPT:
                return aiPrompt.handle((AiPromptAction) action, executionLog);
            case SEND_EMAIL:
                return sendEmail.handle((SendEmailAction) action, executionLog);
            case WEBHOOK:
                return webhook.handle((WebhookAction) action, executionLog);
            case RUN_CODE:
                return runCode.handle((RunCodeAction) action, executionLog);
            case GENERATE_REPORT:
                return generateReport.handle((GenerateReportAction) action, executionLog);
            case CHAIN:
                return chain.handle((ChainAction) action, executionLog);
            case WEB_SCRAPE:
                return webScrape.handle((WebScrapeAction) action, executionLog);
            case FILE_OPERATION:
                return fileOperation.handle((FileOperationAction) action, executionLog);
            case GOOGLE_WORKSPACE:
                return googleWorkspace.handle((GoogleWorkspaceAction) action, executionLog);
            default:
                throw new IllegalArgumentException("Unknown action type: " + action.type());
        }
    }
}

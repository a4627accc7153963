package automata.engine.executor;

import automata.engine.config.EngineConfig;
import automata.engine.exception.ActionException;
import automata.engine.exception.ChainStepException;
import automata.engine.exception.MissingDependencyException;
import automata.engine.integration.Collaborators;
import automata.engine.integration.SandboxResult;
import automata.engine.integration.ScrapeResult;
import automata.engine.model.action.ActionType;
import automata.engine.model.action.AiPromptAction;
import automata.engine.model.action.ChainAction;
import automata.engine.model.action.FileOperationAction;
import automata.engine.model.action.GenerateReportAction;
import automata.engine.model.action.GoogleWorkspaceAction;
import automata.engine.model.action.RunCodeAction;
import automata.engine.model.action.SendEmailAction;
import automata.engine.model.action.WebScrapeAction;
import automata.engine.support.MutableClock;
import automata.engine.support.RecordingEmailSender;
import automata.engine.support.StubLlmClient;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionExecutorTest {

    private final EngineConfig config = EngineConfig.defaults();
    private final MutableClock clock = MutableClock.at("2024-03-01T10:00:00Z");

    private StubLlmClient llm;
    private RecordingEmailSender email;
    private ExecutionLog log;

    @BeforeEach
    void setUp() {
        llm = new StubLlmClient("All systems nominal.");
        email = new RecordingEmailSender();
        log = new ExecutionLog();
    }

    private ActionExecutor executor(Collaborators collaborators) {
        return new ActionExecutor(collaborators, config, clock);
    }

    private ActionExecutor fullExecutor() {
        return executor(Collaborators.builder().llm(llm).emailSender(email).build());
    }

    @Test
    void aiPromptUsesDefaultModelAndReportsUsage() {
        JsonNode result = fullExecutor().execute(new AiPromptAction("Status?", null), log);

        assertEquals("All systems nominal.", result.get("response").asText());
        assertEquals("claude-3-5-sonnet-20241022", result.get("model").asText());
        assertEquals(12, result.get("usage").get("input_tokens").asInt());
        assertEquals(List.of("Status?"), llm.prompts());
        assertEquals(List.of("Executing AI prompt...", "AI response received (20 chars)"), log.lines());
    }

    @Test
    void aiPromptHonoursExplicitModelAndNonTextAnswer() {
        StubLlmClient nonText = StubLlmClient.nonText();
        JsonNode result = executor(Collaborators.builder().llm(nonText).build())
                .execute(new AiPromptAction("Draw a cat", "other-model"), log);

        assertEquals("Non-text response received", result.get("response").asText());
        assertEquals("other-model", result.get("model").asText());
        assertEquals(List.of("other-model"), nonText.models());
    }

    @Test
    void sendEmailDeliversAndReports() {
        JsonNode result = fullExecutor().execute(new SendEmailAction("ops@example.com", "Hi", "Body"), log);

        assertTrue(result.get("sent").asBoolean());
        assertEquals("ops@example.com", result.get("to").asText());
        assertEquals(1, email.sent().size());
        assertEquals(List.of("Sending email to ops@example.com...", "Email sent successfully"), log.lines());
    }

    @Test
    void missingCollaboratorFailsWithDistinctException() {
        ActionExecutor bare = executor(Collaborators.none());

        MissingDependencyException e = assertThrows(MissingDependencyException.class,
                () -> bare.execute(new SendEmailAction("a@b.c", "s", "b"), log));

        assertEquals("Email sender not configured", e.getMessage());
        assertEquals("Email sender", e.dependency());
        assertEquals(List.of("Sending email to a@b.c...", "Email send failed: Email sender not configured"),
                log.lines());

        assertThrows(MissingDependencyException.class,
                () -> bare.execute(new RunCodeAction("python", "print(1)"), new ExecutionLog()));
        assertThrows(MissingDependencyException.class,
                () -> bare.execute(new WebScrapeAction("http://example.com", null), new ExecutionLog()));
        MissingDependencyException workspace = assertThrows(MissingDependencyException.class,
                () -> bare.execute(new GoogleWorkspaceAction("drive", "list", null), new ExecutionLog()));
        assertEquals("Google Workspace client not configured", workspace.getMessage());
    }

    @Test
    void collaboratorErrorsAreWrappedAndLogged() {
        email.failWith(new IllegalStateException("SMTP down"));

        ActionException e = assertThrows(ActionException.class,
                () -> fullExecutor().execute(new SendEmailAction("a@b.c", "s", "b"), log));

        assertEquals("SMTP down", e.getMessage());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(log.contains("Email send failed: SMTP down"));
    }

    @Test
    void runCodeTruncatesOutputInLog() {
        String longOut = "x".repeat(800);
        ActionExecutor executor = executor(Collaborators.builder()
                .codeSandbox((language, code) -> new SandboxResult(longOut, "warn", 3))
                .build());

        JsonNode result = executor.execute(new RunCodeAction("python", "print('x' * 800)"), log);

        assertEquals(800, result.get("stdout").asText().length());
        assertEquals(3, result.get("exitCode").asInt());
        assertEquals("Running python code...", log.lines().get(0));
        assertTrue(log.contains("STDOUT: " + "x".repeat(500)));
        assertTrue(log.contains("STDERR: warn"));
        assertTrue(log.contains("Exit code: 3"));
    }

    @Test
    void generateReportEmbedsConfigInPrompt() {
        JsonNode reportConfig = Json.object().put("topic", "weekly sales");

        JsonNode result = fullExecutor().execute(new GenerateReportAction(reportConfig), log);

        assertEquals("All systems nominal.", result.get("report").asText());
        assertEquals("2024-03-01T10:00:00Z", result.get("generatedAt").asText());
        assertEquals(reportConfig, result.get("config"));
        String prompt = llm.prompts().get(0);
        assertTrue(prompt.contains("\"topic\" : \"weekly sales\""));
        assertTrue(prompt.contains("1. Executive Summary"));
        assertTrue(prompt.endsWith("Format the report in Markdown."));
    }

    @Test
    void generateReportWithoutTextUsesPlaceholder() {
        JsonNode result = executor(Collaborators.builder().llm(StubLlmClient.nonText()).build())
                .execute(new GenerateReportAction(Json.object()), log);

        assertEquals("Failed to generate report", result.get("report").asText());
    }

    @Test
    void webScrapeReturnsItems() {
        ActionExecutor executor = executor(Collaborators.builder()
                .webScraper((url, selector) -> new ScrapeResult(List.of("a", "b"), null))
                .build());

        JsonNode result = executor.execute(new WebScrapeAction("http://example.com", "h2"), log);

        assertEquals(2, result.get("items").size());
        assertFalse(result.has("content"));
        assertEquals(List.of("Scraping http://example.com...", "Scraped 2 items"), log.lines());
    }

    @Test
    void fileOperationIsAcknowledged() {
        JsonNode result = executor(Collaborators.none())
                .execute(new FileOperationAction("archive", "/var/log/app"), log);

        assertTrue(result.get("success").asBoolean());
        assertEquals("archive", result.get("operation").asText());
        assertEquals(List.of("File operation: archive on /var/log/app...", "File operation completed"),
                log.lines());
    }

    @Test
    void googleWorkspaceForwardsParams() {
        ActionExecutor executor = executor(Collaborators.builder()
                .workspaceClient((service, action, params) -> Json.object()
                        .put("service", service)
                        .put("action", action)
                        .set("echo", params))
                .build());

        JsonNode result = executor.execute(
                new GoogleWorkspaceAction("calendar", "createEvent", Json.object().put("title", "Sync")), log);

        assertEquals("calendar", result.get("service").asText());
        assertEquals("Sync", result.get("echo").get("title").asText());
        assertTrue(log.contains("Google Workspace: calendar.createEvent..."));
    }

    @Test
    void chainRunsStepsInOrder() {
        ChainAction chain = ChainAction.of(
                new AiPromptAction("Summarize", null),
                new SendEmailAction("ops@example.com", "Summary", "see result"));

        JsonNode result = fullExecutor().execute(chain, log);

        assertEquals(2, result.get("chainLength").asInt());
        JsonNode results = result.get("results");
        assertEquals(1, results.get(0).get("step").asInt());
        assertEquals("ai-prompt", results.get(0).get("type").asText());
        assertEquals("send-email", results.get(1).get("type").asText());
        assertTrue(results.get(1).get("result").get("sent").asBoolean());
        assertEquals("Executing task chain (2 tasks)...", log.lines().get(0));
        assertEquals("Task chain completed successfully", log.lines().get(log.size() - 1));
    }

    @Test
    void chainStopsAtFirstFailingStep() {
        email.failWith(new IllegalStateException("mailbox full"));
        ChainAction chain = ChainAction.of(
                new AiPromptAction("Summarize", null),
                new SendEmailAction("ops@example.com", "Summary", "see result"),
                new FileOperationAction("archive", "/tmp/summary"));

        ChainStepException e = assertThrows(ChainStepException.class, () -> fullExecutor().execute(chain, log));

        assertEquals(2, e.failedStep());
        assertEquals(ActionType.SEND_EMAIL, e.failedType());
        assertEquals(1, e.completedResults().size());
        assertEquals("Chain step 2/3 (send-email) failed: mailbox full", e.getMessage());

        List<String> lines = log.lines();
        assertTrue(lines.contains("Chain step 1/3: ai-prompt"));
        assertTrue(lines.contains("Chain step 2/3: send-email"));
        assertFalse(lines.contains("Chain step 3/3: file-operation"));
        assertFalse(lines.stream().anyMatch(l -> l.startsWith("File operation")));
        assertEquals("Task chain failed: Chain step 2/3 (send-email) failed: mailbox full",
                lines.get(lines.size() - 1));
    }

    @Test
    void emptyChainSucceeds() {
        JsonNode result = fullExecutor().execute(new ChainAction(List.of()), log);

        assertEquals(0, result.get("chainLength").asInt());
        assertEquals(0, result.get("results").size());
    }
}

package automata.engine.executor.handler;

import automata.engine.exception.MissingDependencyException;
import automata.engine.executor.ExecutionLog;
import automata.engine.integration.Completion;
import automata.engine.integration.LlmClient;
import automata.engine.model.action.GenerateReportAction;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;

/**
 * Asks the language model for a Markdown report built from the action's config.
 */
public class GenerateReportHandler extends AbstractActionHandler<GenerateReportAction> {

    static final String NO_REPORT = "Failed to generate report";

    private final LlmClient llm;
    private final String model;
    private final Clock clock;

    public GenerateReportHandler(LlmClient llm, String model, Clock clock) {
        this.llm = llm;
        this.model = model;
        this.clock = clock;
    }

    @Override
    protected String startMessage(GenerateReportAction action) {
        return "Generating report...";
    }

    @Override
    protected String failurePrefix() {
        return "Report generation failed";
    }

    @Override
    protected JsonNode run(GenerateReportAction action, ExecutionLog executionLog) {
        if (llm == null) {
            throw new MissingDependencyException("LLM client");
        }
        Completion completion = llm.complete(reportPrompt(action.config()), model);
        String report = completion.text() != null ? completion.text() : NO_REPORT;

        executionLog.append("Report generated (" + report.length() + " chars)");

        ObjectNode result = Json.object();
        result.put("report", report);
        result.put("generatedAt", clock.instant().toString());
        result.set("config", action.config());
        return result;
    }

    static String reportPrompt(JsonNode config) {
        return "Generate a comprehensive report based on this configuration:\n\n"
                + Json.pretty(config) + "\n\n"
                + "Please create a detailed, well-structured report with the following sections:\n"
                + "1. Executive Summary\n"
                + "2. Key Findings\n"
                + "3. Detailed Analysis\n"
                + "4. Recommendations\n"
                + "5. Conclusion\n\n"
                + "Format the report in Markdown.";
    }
}

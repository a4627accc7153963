package automata.engine.executor.handler;

import automata.engine.exception.MissingDependencyException;
import automata.engine.executor.ExecutionLog;
import automata.engine.integration.CodeSandbox;
import automata.engine.integration.SandboxResult;
import automata.engine.model.action.RunCodeAction;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Runs code in the sandbox. A non-zero exit code is reported in the result, not as a failure.
 */
public class RunCodeHandler extends AbstractActionHandler<RunCodeAction> {

    private final CodeSandbox sandbox;
    private final int truncateLength;

    public RunCodeHandler(CodeSandbox sandbox, int truncateLength) {
        this.sandbox = sandbox;
        this.truncateLength = truncateLength;
    }

    @Override
    protected String startMessage(RunCodeAction action) {
        return "Running " + action.language() + " code...";
    }

    @Override
    protected String failurePrefix() {
        return "Code execution failed";
    }

    @Override
    protected JsonNode run(RunCodeAction action, ExecutionLog executionLog) {
        if (sandbox == null) {
            throw new MissingDependencyException("Code sandbox");
        }
        SandboxResult outcome = sandbox.execute(action.language(), action.code());

        executionLog.append("Code executed successfully");
        if (outcome.stdout() != null && !outcome.stdout().isEmpty()) {
            executionLog.append("STDOUT: " + truncate(outcome.stdout()));
        }
        if (outcome.stderr() != null && !outcome.stderr().isEmpty()) {
            executionLog.append("STDERR: " + truncate(outcome.stderr()));
        }
        executionLog.append("Exit code: " + outcome.exitCode());

        ObjectNode result = Json.object();
        result.put("stdout", outcome.stdout());
        result.put("stderr", outcome.stderr());
        result.put("exitCode", outcome.exitCode());
        return result;
    }

    private String truncate(String text) {
        return text.length() > truncateLength ? text.substring(0, truncateLength) : text;
    }
}

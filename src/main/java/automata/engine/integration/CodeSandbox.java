package automata.engine.integration;

/**
 * Isolated runtime for user supplied code.
 */
public interface CodeSandbox {

    SandboxResult execute(String language, String code);
}

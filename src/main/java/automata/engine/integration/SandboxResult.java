package automata.engine.integration;

public record SandboxResult(String stdout, String stderr, int exitCode) {
}

package automata.engine.integration;

import java.util.Optional;

/**
 * External services available to action handlers. Each one is optional;
 * an action needing an absent one fails with a MissingDependencyException.
 */
public final class Collaborators {

    private final LlmClient llm;
    private final EmailSender emailSender;
    private final CodeSandbox codeSandbox;
    private final WebScraper webScraper;
    private final WorkspaceClient workspaceClient;

    private Collaborators(Builder builder) {
        this.llm = builder.llm;
        this.emailSender = builder.emailSender;
        this.codeSandbox = builder.codeSandbox;
        this.webScraper = builder.webScraper;
        this.workspaceClient = builder.workspaceClient;
    }

    public static Collaborators none() {
        return new Builder().build();
    }

    public Optional<LlmClient> llm() {
        return Optional.ofNullable(llm);
    }

    public Optional<EmailSender> emailSender() {
        return Optional.ofNullable(emailSender);
    }

    public Optional<CodeSandbox> codeSandbox() {
        return Optional.ofNullable(codeSandbox);
    }

    public Optional<WebScraper> webScraper() {
        return Optional.ofNullable(webScraper);
    }

    public Optional<WorkspaceClient> workspaceClient() {
        return Optional.ofNullable(workspaceClient);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LlmClient llm;
        private EmailSender emailSender;
        private CodeSandbox codeSandbox;
        private WebScraper webScraper;
        private WorkspaceClient workspaceClient;

        public Builder llm(LlmClient llm) {
            this.llm = llm;
            return this;
        }

        public Builder emailSender(EmailSender emailSender) {
            this.emailSender = emailSender;
            return this;
        }

        public Builder codeSandbox(CodeSandbox codeSandbox) {
            this.codeSandbox = codeSandbox;
            return this;
        }

        public Builder webScraper(WebScraper webScraper) {
            this.webScraper = webScraper;
            return this;
        }

        public Builder workspaceClient(WorkspaceClient workspaceClient) {
            this.workspaceClient = workspaceClient;
            return this;
        }

        public Collaborators build() {
            return new Collaborators(this);
        }
    }
}

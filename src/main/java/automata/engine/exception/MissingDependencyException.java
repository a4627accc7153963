package automata.engine.exception;

/**
 * A collaborator required by an action was not configured.
 * Retried like any other action failure, but reported separately to operators.
 */
public class MissingDependencyException extends ActionException {

    private final String dependency;

    public MissingDependencyException(String dependency) {
        super(dependency + " not configured");
        this.dependency = dependency;
    }

    public String dependency() {
        return dependency;
    }
}

package com.parichay.core.error;

/**
 * A collaborator (context directory, file scanner) could not answer.
 * The cause is kept for logs only; callers see the generic code.
 */
public class DependencyUnavailableException extends ChatException {

    public DependencyUnavailableException(String dependency, Throwable cause) {
        super(ErrorKind.DEPENDENCY_UNAVAILABLE, "DEPENDENCY_UNAVAILABLE",
                dependency + " is currently unavailable", cause);
    }
}

package org.stance.github;

/**
 * Thrown when a request cannot be sent, is interrupted, or comes back with a body that is
 * not JSON.
 */
public class GitHubTransportException extends GitHubException {

	public GitHubTransportException(String message) {
		super(message);
	}

	public GitHubTransportException(String message, Throwable cause) {
		super(message, cause);
	}

}

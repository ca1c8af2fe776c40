package org.stance.github;

/**
 * Base class for unrecoverable failures raised by the client.
 *
 * <p>
 * Logical API failures (non-2xx responses) are never reported this way. They surface as
 * an empty result plus {@link GitHub#lastError()}.
 */
public class GitHubException extends RuntimeException {

	public GitHubException(String message) {
		super(message);
	}

	public GitHubException(String message, Throwable cause) {
		super(message, cause);
	}

}

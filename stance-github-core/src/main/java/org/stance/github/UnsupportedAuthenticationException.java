package org.stance.github;

/**
 * Thrown by {@link GitHub#authenticate(String, String)} for any method other than
 * {@code token}.
 */
public class UnsupportedAuthenticationException extends GitHubException {

	private final String method;

	public UnsupportedAuthenticationException(String method) {
		super("unrecognized authentication method '" + method + "'");
		this.method = method;
	}

	public String getMethod() {
		return method;
	}

}

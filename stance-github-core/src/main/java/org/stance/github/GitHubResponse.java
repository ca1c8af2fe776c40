package org.stance.github;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A response as received from the GitHub API, before JSON decoding.
 *
 * @param statusCode the HTTP status code
 * @param headers response headers
 * @param body the response body text (empty when the server sent none)
 */
public record GitHubResponse(int statusCode, Map<String, List<String>> headers, String body) {

	public GitHubResponse {
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
	}

	/**
	 * Creates a response without headers.
	 * @param statusCode the HTTP status code
	 * @param body the body text
	 * @return the response
	 */
	public static GitHubResponse of(int statusCode, String body) {
		return new GitHubResponse(statusCode, Map.of(), body);
	}

	/**
	 * Returns true for 2xx status codes.
	 * @return whether the request succeeded at the HTTP level
	 */
	public boolean isSuccess() {
		return statusCode >= 200 && statusCode < 300;
	}

	/**
	 * Renders the response as text for wire traces.
	 * @return the status line, headers and body
	 */
	public String describe() {
		StringBuilder text = new StringBuilder();
		text.append("HTTP ").append(statusCode).append('\n');
		headers.forEach((name, values) -> values
			.forEach(value -> text.append(name).append(": ").append(value).append('\n')));
		text.append('\n');
		text.append(body).append('\n');
		return text.toString();
	}

}

package org.stance.github;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single request against the GitHub API, fully resolved and ready to be sent.
 *
 * @param method the HTTP method ("GET" or "POST")
 * @param url the absolute request URL
 * @param headers request headers in the order they are sent
 * @param body the JSON request body, or null when there is none
 */
public record GitHubRequest(String method, String url, Map<String, String> headers, @Nullable String body) {

	public static final String AUTHORIZATION = "Authorization";

	static final String REDACTED = "token [REDACTED]";

	public GitHubRequest {
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
	}

	/**
	 * Returns the value of a header, or null when it was not set. Header names are
	 * matched case-insensitively.
	 * @param name the header name
	 * @return the header value, or null
	 */
	@Nullable
	public String header(String name) {
		for (Map.Entry<String, String> entry : headers.entrySet()) {
			if (entry.getKey().equalsIgnoreCase(name)) {
				return entry.getValue();
			}
		}
		return null;
	}

	/**
	 * Renders the request as text for wire traces. The credential in the
	 * {@code Authorization} header is replaced by a placeholder.
	 * @return the request line, headers and body
	 */
	public String describe() {
		StringBuilder text = new StringBuilder();
		text.append(method).append(' ').append(url).append('\n');
		headers.forEach((name, value) -> text.append(name)
			.append(": ")
			.append(AUTHORIZATION.equalsIgnoreCase(name) ? REDACTED : value)
			.append('\n'));
		text.append('\n');
		if (body != null) {
			text.append(body).append('\n');
		}
		return text.toString();
	}

}

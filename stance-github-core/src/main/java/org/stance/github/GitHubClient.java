package org.stance.github;

/**
 * Transport used by {@link GitHub} to talk to the API.
 *
 * <p>
 * Implementations return every response they receive, whatever its status code. Only a
 * failure to send the request at all is reported as an exception. Keeping the transport
 * behind this interface lets tests substitute a double that counts calls.
 */
public interface GitHubClient {

	/**
	 * Send a request and wait for the complete response.
	 * @param request the resolved request
	 * @return the response, including non-2xx responses
	 * @throws GitHubTransportException if the request could not be sent or was
	 * interrupted
	 */
	GitHubResponse send(GitHubRequest request);

}

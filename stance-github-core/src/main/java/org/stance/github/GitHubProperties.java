package org.stance.github;

/**
 * Configuration properties for a {@link GitHub} client.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link GitHubBuilder}. The
 * defaults talk to the public GitHub API with tracing off.
 */
public class GitHubProperties {

	/**
	 * Root of the public GitHub v3 API.
	 */
	public static final String DEFAULT_BASE_ADDRESS = "https://api.github.com";

	/**
	 * Base address that relative paths are resolved against.
	 */
	private String baseAddress = DEFAULT_BASE_ADDRESS;

	/**
	 * Whether full request/response traces are written to the trace stream.
	 */
	private boolean debug = false;

	/**
	 * Value of the User-Agent header sent with every request.
	 */
	private String userAgent = "stance-github/" + GitHub.VERSION;

	/**
	 * Connect timeout for the HTTP transport.
	 */
	private int connectTimeoutSeconds = 30;

	public String getBaseAddress() {
		return baseAddress;
	}

	public void setBaseAddress(String baseAddress) {
		this.baseAddress = baseAddress;
	}

	public boolean isDebug() {
		return debug;
	}

	public void setDebug(boolean debug) {
		this.debug = debug;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

}

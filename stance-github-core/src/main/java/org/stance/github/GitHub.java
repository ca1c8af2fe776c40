package org.stance.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Entry point to the GitHub v3 API.
 *
 * <p>
 * A client authenticates, then hands out {@link Organization} objects, which lead on to
 * {@link Repository} and {@link Issue} objects. Every entity keeps a reference to the
 * client it came from and uses it to fetch its own children lazily, following the URLs
 * GitHub put in the parent's representation.
 *
 * <pre>
 * {@code
 * GitHub github = new GitHub().authenticate("token", System.getenv("GITHUB_TOKEN"));
 *
 * for (Organization org : github.orgs()) {
 *     for (Repository repo : org.repos()) {
 *         for (Issue issue : repo.issues()) {
 *             // ...
 *         }
 *     }
 * }
 * }
 * </pre>
 *
 * <p>
 * Requests that reach GitHub but come back with a non-2xx status do not throw. The call
 * returns an empty result and the decoded error body is kept for {@link #lastError()}.
 * Later successes do not clear it, so only consult it right after a call has come back
 * empty.
 *
 * <p>
 * Instances are not thread-safe.
 */
public class GitHub {

	private static final Logger logger = LoggerFactory.getLogger(GitHub.class);

	public static final String VERSION = "1.0.0";

	/**
	 * The only authentication method understood by {@link #authenticate(String, String)}.
	 */
	public static final String TOKEN_AUTH = "token";

	static final String ORGS_PATH = "/user/orgs";

	static final String APPLICATION_JSON = "application/json";

	private static final Pattern ABSOLUTE_URL = Pattern.compile("^https?:");

	private static final Pattern URI_TEMPLATE = Pattern.compile("\\{.*?\\}");

	private final String baseAddress;

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final PrintStream trace;

	private final Memoized<List<Organization>> orgs = new Memoized<>();

	private boolean debug;

	@Nullable
	private String token;

	@Nullable
	private JsonNode lastError;

	public GitHub() {
		this(GitHubProperties.DEFAULT_BASE_ADDRESS);
	}

	public GitHub(@Nullable String baseAddress) {
		this(baseAddress, new GitHubHttpClient(), ObjectMapperFactory.create());
	}

	public GitHub(@Nullable String baseAddress, GitHubClient client, ObjectMapper objectMapper) {
		this(baseAddress, client, objectMapper, System.err, false);
	}

	GitHub(@Nullable String baseAddress, GitHubClient client, ObjectMapper objectMapper, PrintStream trace,
			boolean debug) {
		this.baseAddress = normalizeBaseAddress(baseAddress);
		this.client = client;
		this.objectMapper = objectMapper;
		this.trace = trace;
		this.debug = debug;
	}

	private static String normalizeBaseAddress(@Nullable String baseAddress) {
		if (baseAddress == null || baseAddress.isEmpty()) {
			return GitHubProperties.DEFAULT_BASE_ADDRESS;
		}
		return baseAddress.endsWith("/") ? baseAddress.substring(0, baseAddress.length() - 1) : baseAddress;
	}

	/**
	 * Sets the credentials used for all subsequent requests. Only the {@code token}
	 * method (personal access tokens) is supported.
	 * @param method the authentication method, must be {@value #TOKEN_AUTH}
	 * @param credential the access token
	 * @return this client, for chaining
	 * @throws UnsupportedAuthenticationException for any other method
	 */
	public GitHub authenticate(String method, String credential) {
		if (TOKEN_AUTH.equals(method)) {
			this.token = credential;
			return this;
		}
		throw new UnsupportedAuthenticationException(method);
	}

	public boolean isAuthenticated() {
		return token != null;
	}

	/**
	 * Turns request/response tracing on or off.
	 * @param on whether to trace
	 * @return this client, for chaining
	 */
	public GitHub debug(boolean on) {
		this.debug = on;
		return this;
	}

	public boolean isDebug() {
		return debug;
	}

	public String getBaseAddress() {
		return baseAddress;
	}

	/**
	 * Resolves a path against the base address.
	 *
	 * <p>
	 * Absolute {@code http(s)} URLs, typically copied out of an earlier response, are
	 * returned as they are except that URI template expressions such as
	 * {@code {/number}} are removed. Anything else is appended to the base address with
	 * exactly one slash in between.
	 * @param relativeOrAbsolute a path such as {@code /user/orgs}, or an absolute URL
	 * @return the absolute URL
	 */
	public String url(@Nullable String relativeOrAbsolute) {
		if (relativeOrAbsolute != null && ABSOLUTE_URL.matcher(relativeOrAbsolute).find()) {
			return URI_TEMPLATE.matcher(relativeOrAbsolute).replaceAll("");
		}

		String relative = (relativeOrAbsolute == null || relativeOrAbsolute.isEmpty()) ? "/" : relativeOrAbsolute;
		if (relative.startsWith("/")) {
			relative = relative.substring(1);
		}
		return baseAddress + "/" + relative;
	}

	/**
	 * Issues a GET request.
	 * @param path a relative path or absolute URL, see {@link #url(String)}
	 * @return the decoded body, or empty when GitHub answered with a non-2xx status
	 * @throws GitHubTransportException if the request could not be sent or the body
	 * could not be decoded
	 */
	public Optional<JsonNode> get(String path) {
		return execute("GET", path, null);
	}

	/**
	 * Issues a POST request without a body.
	 * @param path a relative path or absolute URL, see {@link #url(String)}
	 * @return the decoded body, or empty when GitHub answered with a non-2xx status
	 */
	public Optional<JsonNode> post(String path) {
		return post(path, null);
	}

	/**
	 * Issues a POST request with a JSON body.
	 * @param path a relative path or absolute URL, see {@link #url(String)}
	 * @param payload value encoded as the JSON request body; no body is sent when null
	 * @return the decoded body, or empty when GitHub answered with a non-2xx status
	 * @throws GitHubTransportException if the payload could not be encoded, the request
	 * could not be sent or the body could not be decoded
	 */
	public Optional<JsonNode> post(String path, @Nullable Object payload) {
		return execute("POST", path, payload);
	}

	/**
	 * Returns the error body of the most recent non-2xx response.
	 * @return the decoded error, or empty if no request has failed yet
	 */
	public Optional<JsonNode> lastError() {
		return Optional.ofNullable(lastError);
	}

	/**
	 * Lists the organizations visible to the current credentials. The result is
	 * memoized until {@link #clear()} is called.
	 * @return the organizations in API order; empty when the request failed
	 */
	public List<Organization> orgs() {
		return orgs
			.get(() -> getList(ORGS_PATH)
				.map(items -> items.stream().map(item -> new Organization(this, item)).toList()))
			.orElse(List.of());
	}

	/**
	 * Forgets the memoized organization list. Credentials, debug flag and last error
	 * are kept.
	 * @return this client, for chaining
	 */
	public GitHub clear() {
		orgs.clear();
		return this;
	}

	Optional<List<JsonNode>> getList(String path) {
		return get(path).map(body -> {
			if (!body.isArray()) {
				logger.warn("Expected a JSON array from {} but got {}", url(path), body.getNodeType());
			}
			return JsonNodeUtils.getArray(body);
		});
	}

	Optional<JsonNode> follow(HypermediaLinks links, String relation) {
		Optional<String> href = links.get(relation);
		if (href.isEmpty()) {
			logger.warn("No '{}' link to follow in {}", relation, links);
			return Optional.empty();
		}
		return get(href.get());
	}

	Optional<List<JsonNode>> followList(HypermediaLinks links, String relation) {
		Optional<String> href = links.get(relation);
		if (href.isEmpty()) {
			logger.warn("No '{}' link to follow in {}", relation, links);
			return Optional.empty();
		}
		return getList(href.get());
	}

	private Optional<JsonNode> execute(String method, String path, @Nullable Object payload) {
		Map<String, String> headers = new LinkedHashMap<>();
		headers.put("Accept", APPLICATION_JSON);
		String body = null;
		if ("POST".equals(method)) {
			headers.put("Content-Type", APPLICATION_JSON);
			if (payload != null) {
				body = encode(method, path, payload);
			}
		}
		if (token != null) {
			headers.put(GitHubRequest.AUTHORIZATION, "token " + token);
		}
		GitHubRequest request = new GitHubRequest(method, url(path), headers, body);

		if (debug) {
			trace.println("=====[ " + method + " " + path + " ]========================");
			trace.println(request.describe());
		}

		GitHubResponse response = client.send(request);

		if (debug) {
			trace.println("-----------------------------------------");
			trace.println(response.describe());
			trace.flush();
		}

		JsonNode decoded = decode(request, response);
		if (!response.isSuccess()) {
			logger.warn("{} {} failed with status {}", method, request.url(), response.statusCode());
			this.lastError = decoded;
			return Optional.empty();
		}
		return Optional.of(decoded);
	}

	private String encode(String method, String path, Object payload) {
		try {
			return objectMapper.writeValueAsString(payload);
		}
		catch (JsonProcessingException e) {
			throw new GitHubTransportException(
					"unable to create " + method + " " + path + " request: " + e.getOriginalMessage(), e);
		}
	}

	private JsonNode decode(GitHubRequest request, GitHubResponse response) {
		if (response.body().isBlank()) {
			return NullNode.getInstance();
		}
		try {
			return objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			logger.error("{} {} returned a body that is not JSON (status {})", request.method(), request.url(),
					response.statusCode());
			throw new GitHubTransportException("unable to decode " + request.method() + " " + request.url()
					+ " response: " + e.getOriginalMessage(), e);
		}
	}

}

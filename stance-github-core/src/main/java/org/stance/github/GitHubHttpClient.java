package org.stance.github;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link GitHubClient} backed by the Java 11+ {@link HttpClient}.
 *
 * <p>
 * Non-2xx responses are handed back to the caller untouched. Only I/O failures and
 * interruption become {@link GitHubTransportException}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private final HttpClient httpClient;

	private final String userAgent;

	public GitHubHttpClient() {
		this(new GitHubProperties());
	}

	public GitHubHttpClient(GitHubProperties properties) {
		this.userAgent = properties.getUserAgent();
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public GitHubResponse send(GitHubRequest request) {
		logger.debug("{} {}", request.method(), request.url());
		long start = System.currentTimeMillis();

		HttpRequest httpRequest = toHttpRequest(request);
		try {
			HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
			logger.debug("{} {} returned {} in {}ms ({} bytes)", request.method(), request.url(),
					response.statusCode(), System.currentTimeMillis() - start, response.body().length());
			return new GitHubResponse(response.statusCode(), response.headers().map(), response.body());
		}
		catch (IOException e) {
			logger.error("{} {} failed: {}", request.method(), request.url(), e.getMessage());
			throw new GitHubTransportException(
					"unable to send " + request.method() + " " + request.url() + " request: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubTransportException(request.method() + " " + request.url() + " request interrupted", e);
		}
	}

	private HttpRequest toHttpRequest(GitHubRequest request) {
		HttpRequest.Builder builder;
		try {
			builder = HttpRequest.newBuilder().uri(URI.create(request.url()));
		}
		catch (IllegalArgumentException e) {
			throw new GitHubTransportException(
					"unable to create " + request.method() + " " + request.url() + " request: " + e.getMessage(), e);
		}

		builder.header("User-Agent", userAgent);
		request.headers().forEach(builder::header);

		HttpRequest.BodyPublisher body = request.body() != null ? HttpRequest.BodyPublishers.ofString(request.body())
				: HttpRequest.BodyPublishers.noBody();
		return builder.method(request.method(), body).build();
	}

}

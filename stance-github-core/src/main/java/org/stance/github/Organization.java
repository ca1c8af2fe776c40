package org.stance.github;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * A single GitHub organization, as listed by {@link GitHub#orgs()}.
 *
 * <p>
 * Keeps the {@code id}, {@code login} and {@code description} of the listing entry and
 * the links it carries. The full representation and the repository list are fetched on
 * first use and memoized until {@link #clear()}.
 */
public class Organization {

	static final String REPOS = "repos";

	private final GitHub github;

	@Nullable
	private final Long id;

	@Nullable
	private final String login;

	@Nullable
	private final String description;

	private final HypermediaLinks urls;

	private final Memoized<JsonNode> details = new Memoized<>();

	private final Memoized<List<Repository>> repos = new Memoized<>();

	public Organization(GitHub github, JsonNode object) {
		this.github = github;
		this.id = JsonNodeUtils.getLong(object, "id").orElse(null);
		this.login = JsonNodeUtils.getString(object, "login").orElse(null);
		this.description = JsonNodeUtils.getString(object, "description").orElse(null);
		this.urls = HypermediaLinks.from(object);
	}

	@Nullable
	public Long id() {
		return id;
	}

	@Nullable
	public String login() {
		return login;
	}

	@Nullable
	public String description() {
		return description;
	}

	public HypermediaLinks urls() {
		return urls;
	}

	/**
	 * Fetches the full API representation of this organization. Memoized.
	 * @return the decoded object, or empty when the request failed
	 */
	public Optional<JsonNode> details() {
		return details.get(() -> github.follow(urls, HypermediaLinks.MAIN));
	}

	/**
	 * Lists the repositories of this organization. Memoized.
	 * @return the repositories in API order; empty when the request failed
	 */
	public List<Repository> repos() {
		return repos
			.get(() -> github.followList(urls, REPOS)
				.map(items -> items.stream().map(item -> new Repository(github, item)).toList()))
			.orElse(List.of());
	}

	/**
	 * Forgets the memoized details and repositories.
	 * @return this organization, for chaining
	 */
	public Organization clear() {
		details.clear();
		repos.clear();
		return this;
	}

	@Override
	public String toString() {
		return "Organization[" + login + "]";
	}

}

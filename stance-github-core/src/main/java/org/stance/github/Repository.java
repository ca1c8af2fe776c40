package org.stance.github;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single GitHub repository, as listed by {@link Organization#repos()}.
 *
 * <p>
 * The listing entry is split three ways:
 * <ul>
 * <li>{@code has_*} fields become boolean {@link #has() flags} keyed without the
 * prefix</li>
 * <li>{@code *_url} fields become {@link #urls() links} keyed without the suffix</li>
 * <li>everything else is kept as a plain {@link #fields() field}</li>
 * </ul>
 */
public class Repository {

	static final String ISSUES = "issues";

	static final String FLAG_PREFIX = "has_";

	private final GitHub github;

	private final Map<String, JsonNode> fields;

	private final Map<String, Boolean> has;

	private final HypermediaLinks urls;

	private final Memoized<JsonNode> details = new Memoized<>();

	private final Memoized<List<Issue>> issues = new Memoized<>();

	public Repository(GitHub github, JsonNode object) {
		this.github = github;

		Map<String, JsonNode> plain = new LinkedHashMap<>();
		Map<String, Boolean> flags = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> entries = object.fields();
		while (entries.hasNext()) {
			Map.Entry<String, JsonNode> entry = entries.next();
			String name = entry.getKey();
			if (name.startsWith(FLAG_PREFIX)) {
				flags.put(name.substring(FLAG_PREFIX.length()), JsonNodeUtils.isTruthy(entry.getValue()));
			}
			else if (!HypermediaLinks.isLinkField(name)) {
				plain.put(name, entry.getValue());
			}
		}
		this.fields = Collections.unmodifiableMap(plain);
		this.has = Collections.unmodifiableMap(flags);
		this.urls = HypermediaLinks.from(object);
	}

	public Map<String, JsonNode> fields() {
		return fields;
	}

	/**
	 * Returns a plain field of the listing entry.
	 * @param name the field name
	 * @return the value, or empty for unknown, {@code has_*} and {@code *_url} names
	 */
	public Optional<JsonNode> field(String name) {
		return Optional.ofNullable(fields.get(name));
	}

	public Map<String, Boolean> has() {
		return has;
	}

	/**
	 * Reads a feature flag such as {@code issues} or {@code wiki}.
	 * @param feature the flag name without the {@code has_} prefix
	 * @return the flag, false when the listing did not mention it
	 */
	public boolean has(String feature) {
		return has.getOrDefault(feature, false);
	}

	public HypermediaLinks urls() {
		return urls;
	}

	public Optional<String> name() {
		return field("name").filter(JsonNode::isTextual).map(JsonNode::textValue);
	}

	public Optional<String> fullName() {
		return field("full_name").filter(JsonNode::isTextual).map(JsonNode::textValue);
	}

	/**
	 * Fetches the full API representation of this repository. Memoized.
	 * @return the decoded object, or empty when the request failed
	 */
	public Optional<JsonNode> details() {
		return details.get(() -> github.follow(urls, HypermediaLinks.MAIN));
	}

	/**
	 * Lists the issues of this repository, pull requests included. Memoized.
	 * @return the issues in API order; empty when the request failed
	 */
	public List<Issue> issues() {
		return issues
			.get(() -> github.followList(urls, ISSUES)
				.map(items -> items.stream().map(Issue::new).toList()))
			.orElse(List.of());
	}

	/**
	 * Forgets the memoized details and issues.
	 * @return this repository, for chaining
	 */
	public Repository clear() {
		details.clear();
		issues.clear();
		return this;
	}

	@Override
	public String toString() {
		return "Repository[" + fullName().or(this::name).orElse("?") + "]";
	}

}

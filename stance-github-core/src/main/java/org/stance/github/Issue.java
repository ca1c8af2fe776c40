package org.stance.github;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;

/**
 * A single issue or pull request, as listed by {@link Repository#issues()}.
 *
 * <p>
 * The decoded object is kept verbatim. Pull requests arrive with a {@code pull_request}
 * field, which is passed through untouched. The accessors below only read the raw
 * object.
 *
 * @param raw the decoded API object
 */
public record Issue(JsonNode raw) {

	public Optional<Long> number() {
		return JsonNodeUtils.getLong(raw, "number");
	}

	public Optional<String> title() {
		return JsonNodeUtils.getString(raw, "title");
	}

	public Optional<String> state() {
		return JsonNodeUtils.getString(raw, "state");
	}

	public Optional<String> userLogin() {
		return JsonNodeUtils.getString(raw, "user", "login");
	}

	public Optional<Instant> updatedAt() {
		return JsonNodeUtils.getInstant(raw, "updated_at");
	}

	public boolean isPullRequest() {
		return raw.has("pull_request");
	}

}

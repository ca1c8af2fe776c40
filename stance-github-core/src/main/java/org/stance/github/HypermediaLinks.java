package org.stance.github;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Related-resource URLs found in an API object, keyed by relation name.
 *
 * <p>
 * The object's own {@code url} is stored under {@value #MAIN}. Every field named
 * {@code <relation>_url} is stored under {@code <relation>}. Values are kept exactly as
 * received, URI templates included; {@link GitHub#url(String)} removes the templates
 * when the link is followed.
 */
public final class HypermediaLinks {

	/**
	 * Relation name of the object's own canonical URL.
	 */
	public static final String MAIN = "main";

	static final String URL_SUFFIX = "_url";

	private final Map<String, String> links;

	private HypermediaLinks(Map<String, String> links) {
		this.links = Collections.unmodifiableMap(links);
	}

	/**
	 * Collects the links of a decoded API object.
	 * @param object the decoded object
	 * @return its links
	 */
	public static HypermediaLinks from(JsonNode object) {
		Map<String, String> links = new LinkedHashMap<>();
		JsonNode self = object.path("url");
		if (self.isTextual()) {
			links.put(MAIN, self.textValue());
		}
		Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			if (isLinkField(field.getKey()) && field.getValue().isTextual()) {
				links.put(relationOf(field.getKey()), field.getValue().textValue());
			}
		}
		return new HypermediaLinks(links);
	}

	static boolean isLinkField(String name) {
		return name.endsWith(URL_SUFFIX);
	}

	static String relationOf(String fieldName) {
		return fieldName.substring(0, fieldName.length() - URL_SUFFIX.length());
	}

	/**
	 * Looks up the URL of a relation.
	 * @param relation the relation name, e.g. {@code repos}
	 * @return the URL, or empty when the object did not carry that relation
	 */
	public Optional<String> get(String relation) {
		return Optional.ofNullable(links.get(relation));
	}

	/**
	 * Returns the object's own canonical URL.
	 * @return the {@value #MAIN} link, or empty
	 */
	public Optional<String> main() {
		return get(MAIN);
	}

	public boolean contains(String relation) {
		return links.containsKey(relation);
	}

	public Map<String, String> asMap() {
		return links;
	}

	@Override
	public boolean equals(@Nullable Object o) {
		return o instanceof HypermediaLinks other && links.equals(other.links);
	}

	@Override
	public int hashCode() {
		return links.hashCode();
	}

	@Override
	public String toString() {
		return links.toString();
	}

}

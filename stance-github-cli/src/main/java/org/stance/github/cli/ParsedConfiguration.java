package org.stance.github.cli;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration produced by {@link ArgumentParser}.
 */
public class ParsedConfiguration {

	@Nullable
	public String baseUrl;

	public List<String> organizations = new ArrayList<>();

	public boolean debug = false;

	public boolean help = false;

	/**
	 * Returns true when the organization should appear in the report.
	 * @param login organization login
	 * @return whether no filter was given or the login is in it
	 */
	public boolean includes(@Nullable String login) {
		return organizations.isEmpty() || (login != null && organizations.contains(login));
	}

}

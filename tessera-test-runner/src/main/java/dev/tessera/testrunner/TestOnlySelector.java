package dev.tessera.testrunner;

import java.util.regex.Pattern;

/**
 * A "run only this test" request, split into the pattern that selects fixtures by name and the
 * scope/name suffix handed to the framework.
 */
public record TestOnlySelector(Pattern namePattern, String scopeAndName) {

	public static TestOnlySelector parse(String text) {
		int hash = text.indexOf('#');
		if(hash < 0) {
			return new TestOnlySelector(Pattern.compile(text), "");
		}

		var scopeAndName = text.substring(text.lastIndexOf('#') + 1)
			.replace("$", "")
			.replace("\\Q", "")
			.replace("\\E", "");

		return new TestOnlySelector(Pattern.compile(text.substring(0, hash)), scopeAndName);
	}
}

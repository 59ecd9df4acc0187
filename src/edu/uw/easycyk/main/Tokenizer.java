package edu.uw.easycyk.main;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Splits raw input into tokens. Input containing whitespace is read as a sentence of words. Anything else is read as
 * a formal string, one token per character, so that grammars like "A -&gt; a" work on input like "aab".
 */
public class Tokenizer {
	private final static Splitter WORD_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

	private Tokenizer() {
	}

	public static ImmutableList<String> tokenize(final String input) {
		Preconditions.checkNotNull(input);
		final String trimmed = input.trim();
		if (trimmed.isEmpty()) {
			return ImmutableList.of();
		} else if (CharMatcher.whitespace().matchesAnyOf(trimmed)) {
			return tokenizeWords(trimmed);
		} else {
			return tokenizeCharacters(trimmed);
		}
	}

	public static ImmutableList<String> tokenizeWords(final String input) {
		return ImmutableList.copyOf(WORD_SPLITTER.split(input));
	}

	/**
	 * One token per Unicode code point.
	 */
	public static ImmutableList<String> tokenizeCharacters(final String input) {
		final ImmutableList.Builder<String> result = ImmutableList.builder();
		input.codePoints().forEach(c -> result.add(new String(Character.toChars(c))));
		return result.build();
	}
}

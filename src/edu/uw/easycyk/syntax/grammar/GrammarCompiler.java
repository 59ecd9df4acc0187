package edu.uw.easycyk.syntax.grammar;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

/**
 * Compiles grammar text into a {@link Grammar}. One rule per line, in the form:
 *
 * <pre>
 * S -&gt; NP VP | AB | a | "the"
 * </pre>
 *
 * The arrow may also be written as '→'. The left-hand side of the first rule is the start symbol.
 *
 * By default the compiler is lenient: lines without an arrow and alternatives it can't classify are dropped, which
 * means a typo can silently give a smaller language. {@link #STRICT} rejects them instead.
 */
public class GrammarCompiler {
	public final static GrammarCompiler LENIENT = new GrammarCompiler(false);
	public final static GrammarCompiler STRICT = new GrammarCompiler(true);

	private final static String ASCII_ARROW = "->";
	private final static String UNICODE_ARROW = "→";

	private final static Pattern QUOTED = Pattern.compile("^\"([^\"]+)\"$");
	private final static Pattern LOWERCASE_LETTER = Pattern.compile("^[a-z]$");
	private final static Pattern UPPERCASE_PAIR = Pattern.compile("^[A-Z]{2}$");

	private final static Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");
	private final static Splitter ALTERNATIVE_SPLITTER = Splitter.on('|').trimResults();
	private final static Splitter WHITESPACE_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
	private final static Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

	private final boolean strict;

	private GrammarCompiler(final boolean strict) {
		this.strict = strict;
	}

	public static GrammarCompiler lenient() {
		return LENIENT;
	}

	public static GrammarCompiler strict() {
		return STRICT;
	}

	public boolean isStrict() {
		return strict;
	}

	public Grammar compile(final String text) {
		Preconditions.checkNotNull(text);

		final ListMultimap<String, Production> rules = MultimapBuilder.linkedHashKeys().arrayListValues().build();
		final Set<String> variables = new LinkedHashSet<>();
		final Set<String> terminals = new LinkedHashSet<>();
		String startSymbol = null;

		int lineNumber = 0;
		for (final String rawLine : LINE_SPLITTER.split(text)) {
			lineNumber++;
			final String line = rawLine.trim();
			if (line.isEmpty()) {
				continue;
			}

			final int arrow = findArrow(line);
			if (arrow == -1) {
				reject("no arrow", lineNumber, line);
				continue;
			}

			final String lhs = CharMatcher.whitespace().removeFrom(line.substring(0, arrow));
			if (lhs.isEmpty()) {
				reject("empty left-hand side", lineNumber, line);
				continue;
			}
			final int arrowLength = line.startsWith(ASCII_ARROW, arrow) ? ASCII_ARROW.length() : UNICODE_ARROW.length();
			final String rhs = line.substring(arrow + arrowLength).trim();

			if (startSymbol == null) {
				startSymbol = lhs;
			}
			variables.add(lhs);

			for (final String alternative : ALTERNATIVE_SPLITTER.split(rhs)) {
				final Production production = classify(alternative, variables, terminals);
				if (production == null) {
					reject("unrecognized production", lineNumber, alternative);
				} else {
					rules.put(lhs, production);
				}
			}
		}

		return new Grammar(variables, terminals, startSymbol == null ? Grammar.DEFAULT_START_SYMBOL : startSymbol,
				rules);
	}

	/**
	 * Index of the earliest arrow in the line, or -1.
	 */
	private static int findArrow(final String line) {
		final int ascii = line.indexOf(ASCII_ARROW);
		final int unicode = line.indexOf(UNICODE_ARROW);
		if (ascii == -1) {
			return unicode;
		} else if (unicode == -1) {
			return ascii;
		}
		return Math.min(ascii, unicode);
	}

	/**
	 * Returns null if the alternative should be dropped.
	 */
	private static Production classify(final String alternative, final Set<String> variables,
			final Set<String> terminals) {
		final Matcher quoted = QUOTED.matcher(alternative);
		if (quoted.matches()) {
			final String token = quoted.group(1);
			terminals.add(token);
			return Production.terminal(token);
		}

		final List<String> parts = WHITESPACE_SPLITTER.splitToList(alternative);
		if (parts.size() == 1) {
			final String symbol = parts.get(0);
			if (LOWERCASE_LETTER.matcher(symbol).matches()) {
				terminals.add(symbol);
				return Production.terminal(symbol);
			} else if (UPPERCASE_PAIR.matcher(symbol).matches()) {
				// Shorthand: "AB" means "A B".
				final String left = symbol.substring(0, 1);
				final String right = symbol.substring(1, 2);
				variables.add(left);
				variables.add(right);
				return Production.binary(left, right);
			} else {
				variables.add(symbol);
				return Production.alias(symbol);
			}
		} else if (parts.size() == 2) {
			variables.add(parts.get(0));
			variables.add(parts.get(1));
			return Production.binary(parts.get(0), parts.get(1));
		}

		return null;
	}

	private void reject(final String message, final int lineNumber, final String fragment) {
		if (strict) {
			throw new GrammarFormatException(message, lineNumber, fragment);
		}
	}

	/**
	 * Builds a grammar from an explicit definition: comma-separated variables and terminals, a start symbol, and rule
	 * lines like "S-&gt;AB|BA". Each production is split into its individual non-blank characters, so every symbol is a
	 * single character. A one-character production is a terminal unless it was declared as a variable only, in which
	 * case it is an alias. Both match a token equal to the character. Productions of any other length are dropped, as
	 * are lines with no "-&gt;". If a left-hand side is defined twice, the later line replaces the earlier one.
	 */
	public static Grammar compileDefinition(final String variables, final String terminals, final String startSymbol,
			final String ruleText) {
		final Set<String> declaredVariables = new LinkedHashSet<>(LIST_SPLITTER.splitToList(variables));
		final Set<String> declaredTerminals = new LinkedHashSet<>(LIST_SPLITTER.splitToList(terminals));
		final ListMultimap<String, Production> rules = MultimapBuilder.linkedHashKeys().arrayListValues().build();

		for (final String rawLine : LINE_SPLITTER.split(ruleText)) {
			final String line = rawLine.trim();
			final int arrow = line.indexOf(ASCII_ARROW);
			if (line.isEmpty() || arrow == -1) {
				continue;
			}

			final String lhs = line.substring(0, arrow).trim();
			final List<Production> productions = new ArrayList<>();
			for (final String alternative : ALTERNATIVE_SPLITTER.split(line.substring(arrow + ASCII_ARROW.length()))) {
				final String symbols = CharMatcher.whitespace().removeFrom(alternative);
				if (symbols.length() == 1) {
					final boolean isVariable = declaredVariables.contains(symbols)
							&& !declaredTerminals.contains(symbols);
					productions.add(isVariable ? Production.alias(symbols) : Production.terminal(symbols));
				} else if (symbols.length() == 2) {
					productions.add(Production.binary(symbols.substring(0, 1), symbols.substring(1, 2)));
				}
			}
			rules.replaceValues(lhs, productions);
		}

		final String start = startSymbol == null || startSymbol.trim().isEmpty() ? Grammar.DEFAULT_START_SYMBOL
				: startSymbol.trim();
		return new Grammar(declaredVariables, declaredTerminals, start, rules);
	}
}

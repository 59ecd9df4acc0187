package edu.uw.easycyk.syntax.grammar;

/**
 * Built-in grammars, each with an input it accepts.
 */
public enum ExampleGrammars {
	AB_BA("S->AB|BA\nA->a\nB->b", "ab"),

	SIMULATOR("S -> AB | BC\nA -> BA | a\nB -> CC | b\nC -> AB | a", "ababa"),

	ENGLISH("S -> NP VP\nNP -> Det N\nVP -> V NP\nDet -> \"the\" | \"a\"\nN -> \"cat\" | \"dog\"\nV -> \"chased\"",
			"the cat chased a dog");

	private final String grammarText;
	private final String sampleInput;

	ExampleGrammars(final String grammarText, final String sampleInput) {
		this.grammarText = grammarText;
		this.sampleInput = sampleInput;
	}

	public String getGrammarText() {
		return grammarText;
	}

	public String getSampleInput() {
		return sampleInput;
	}

	public Grammar getGrammar() {
		return GrammarCompiler.LENIENT.compile(grammarText);
	}
}

package edu.uw.easycyk.syntax.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import edu.uw.easycyk.main.Tokenizer;
import edu.uw.easycyk.syntax.grammar.ExampleGrammars;
import edu.uw.easycyk.syntax.grammar.Grammar;
import edu.uw.easycyk.syntax.grammar.GrammarCompiler;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode;
import edu.uw.easycyk.syntax.grammar.Production;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode.ParseTreeNodeBinary;

public class CYKRecognizerTest {
	private final CYKRecognizer recognizer = new CYKRecognizer();

	@Test
	public void testAcceptsAB() {
		final RecognitionResult result = recognizer.recognize(ExampleGrammars.AB_BA.getGrammar(),
				Tokenizer.tokenize("ab"));
		assertTrue(result.isAccepted());
		assertEquals(ImmutableSet.of("A"), result.getChart().getVariables(0, 0));
		assertEquals(ImmutableSet.of("B"), result.getChart().getVariables(1, 1));
		assertTrue(result.getChart().contains(0, 1, "S"));

		final ParseTreeNode tree = result.getTree().get();
		assertEquals("S", tree.getLabel());
		assertEquals("A", tree.getChildren().get(0).getLabel());
		assertEquals("B", tree.getChildren().get(1).getLabel());
		assertEquals("(S (A a) (B b))", tree.toString());
	}

	@Test
	public void testRejectsAA() {
		final RecognitionResult result = recognizer.recognize(ExampleGrammars.AB_BA.getGrammar(),
				Tokenizer.tokenize("aa"));
		assertFalse(result.isAccepted());
		assertFalse(result.getTree().isPresent());
		assertTrue(result.getChart().getVariables(0, 1).isEmpty());
	}

	@Test
	public void testAcceptsABABA() {
		final RecognitionResult result = recognizer.recognize(ExampleGrammars.SIMULATOR.getGrammar(),
				Tokenizer.tokenize("ababa"));
		assertTrue(result.isAccepted());
		assertEquals(ImmutableList.of("S", "C", "A"), ImmutableList.copyOf(result.getChart().getVariables(0, 4)));
		assertEquals(ImmutableList.of("A", "C"), ImmutableList.copyOf(result.getChart().getVariables(0, 0)));
		assertEquals("(S (A a) (B (C (A (B b) (A a)) (B b)) (C a)))", result.getTree().get().toString());
	}

	@Test
	public void testEnglishSentence() {
		final RecognitionResult result = recognizer.recognize(ExampleGrammars.ENGLISH.getGrammar(),
				Tokenizer.tokenize("the cat chased a dog"));
		assertTrue(result.isAccepted());

		final ParseTreeNodeBinary root = (ParseTreeNodeBinary) result.getTree().get();
		assertEquals("S", root.getLabel());
		assertEquals("NP", root.getLeftChild().getLabel());
		assertEquals("VP", root.getRightChild().getLabel());

		final ParseTreeNodeBinary verbPhrase = (ParseTreeNodeBinary) root.getRightChild();
		assertEquals("V", verbPhrase.getLeftChild().getLabel());
		assertEquals("NP", verbPhrase.getRightChild().getLabel());
		assertEquals(ImmutableList.of("a", "dog"), verbPhrase.getRightChild().getYield());
		assertEquals(ImmutableList.of("the", "cat", "chased", "a", "dog"), root.getYield());
	}

	@Test
	public void testEmptyInput() {
		final RecognitionResult result = recognizer.recognize(ExampleGrammars.AB_BA.getGrammar(),
				Tokenizer.tokenize(""));
		assertFalse(result.isAccepted());
		assertTrue(result.getChart().isEmpty());
		assertEquals(0, result.getChart().size());
		assertFalse(result.getTree().isPresent());
	}

	@Test
	public void testEmptyGrammarRejectsEverything() {
		final Grammar grammar = GrammarCompiler.lenient().compile("no rules here");
		assertFalse(recognizer.recognize(grammar, Tokenizer.tokenize("ab")).isAccepted());
		assertFalse(recognizer.recognize(grammar, Tokenizer.tokenize("S")).isAccepted());
	}

	@Test
	public void testAliasProductionsMatchTheirSymbol() {
		// "X" is recorded as a variable, but still matches the token "X". It is not rewritten through X -> a.
		final Grammar grammar = GrammarCompiler.lenient().compile("S -> X\nX -> a");
		assertTrue(grammar.getVariables().contains("X"));
		final RecognitionResult result = recognizer.recognize(grammar, ImmutableList.of("X"));
		assertTrue(result.isAccepted());
		assertEquals("(S X)", result.getTree().get().toString());
		assertFalse(recognizer.recognize(grammar, ImmutableList.of("a")).isAccepted());
	}

	@Test
	public void testDigitTerminals() {
		final Grammar grammar = GrammarCompiler.lenient().compile("S -> AB\nA -> 0\nB -> 1");
		assertTrue(recognizer.recognize(grammar, Tokenizer.tokenize("01")).isAccepted());
		assertFalse(recognizer.recognize(grammar, Tokenizer.tokenize("10")).isAccepted());
	}

	@Test
	public void testUnquotedWordTerminals() {
		final Grammar grammar = GrammarCompiler.lenient().compile(
				"S -> NP VP\nNP -> Det N\nVP -> V NP\nDet -> the | a\nN -> cat | dog\nV -> chased");
		final RecognitionResult result = recognizer.recognize(grammar, Tokenizer.tokenize("the cat chased a dog"));
		assertTrue(result.isAccepted());
		assertEquals("(S (NP (Det the) (N cat)) (VP (V chased) (NP (Det a) (N dog))))", result.getTree().get()
				.toString());
	}

	@Test
	public void testDefinitionWithVariableOnlySymbol() {
		// C is declared only as a variable, so "B->C" is an alias. It still matches the token "C".
		final Grammar grammar = GrammarCompiler.compileDefinition("S, A, B, C", "a", "S", "S->AB\nA->a\nB->C");
		assertEquals(ImmutableList.of(Production.alias("C")), grammar.getProductions("B"));
		assertTrue(recognizer.recognize(grammar, Tokenizer.tokenize("aC")).isAccepted());
		assertFalse(recognizer.recognize(grammar, Tokenizer.tokenize("aa")).isAccepted());
	}

	@Test
	public void testTokensMustMatchExactly() {
		final Grammar grammar = GrammarCompiler.lenient().compile("S -> \"The\"");
		assertTrue(recognizer.recognize(grammar, ImmutableList.of("The")).isAccepted());
		assertFalse(recognizer.recognize(grammar, ImmutableList.of("the")).isAccepted());
	}

	@Test
	public void testDuplicateDerivationsAreAllRecorded() {
		final Grammar grammar = GrammarCompiler.lenient().compile("S -> AA | AB\nA -> a\nB -> a");
		final RecognitionResult result = recognizer.recognize(grammar, Tokenizer.tokenize("aa"));
		assertTrue(result.isAccepted());
		final List<Derivation> derivations = result.getChart().getDerivations(0, 1, "S");
		assertEquals(ImmutableList.of(Derivation.binary("A", "A", 0), Derivation.binary("A", "B", 0)), derivations);
		// The earliest rule wins.
		assertEquals("(S (A a) (A a))", result.getTree().get().toString());
	}

	@Test
	public void testEarliestSplitWinsForSameRule() {
		final Grammar grammar = GrammarCompiler.lenient().compile("S -> SS | a");
		final RecognitionResult result = recognizer.recognize(grammar, Tokenizer.tokenize("aaa"));
		assertTrue(result.isAccepted());
		assertEquals(ImmutableList.of(Derivation.binary("S", "S", 0), Derivation.binary("S", "S", 1)), result
				.getChart().getDerivations(0, 2, "S"));
		assertEquals("(S (S a) (S (S a) (S a)))", result.getTree().get().toString());
	}

	@Test
	public void testDeterministic() {
		final Grammar grammar = ExampleGrammars.SIMULATOR.getGrammar();
		final List<String> tokens = Tokenizer.tokenize("baababaab");
		final RecognitionResult first = recognizer.recognize(grammar, tokens);
		final RecognitionResult second = recognizer.recognize(GrammarCompiler.lenient().compile(
				ExampleGrammars.SIMULATOR.getGrammarText()), tokens);
		assertEquals(first.isAccepted(), second.isAccepted());
		assertTrue(first.getChart().sameVariables(second.getChart()));
		assertEquals(first.getTree(), second.getTree());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testCellsBelowTheDiagonalDontExist() {
		final RecognitionResult result = recognizer.recognize(ExampleGrammars.AB_BA.getGrammar(),
				Tokenizer.tokenize("ab"));
		result.getChart().getCell(1, 0);
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testCellsOutsideTheChartDontExist() {
		final RecognitionResult result = recognizer.recognize(ExampleGrammars.AB_BA.getGrammar(),
				Tokenizer.tokenize("ab"));
		result.getChart().getCell(0, 2);
	}

	@Test
	public void testListenersSeeEveryInsertion() {
		final List<String> events = new ArrayList<>();
		final CYKRecognizer listening = new CYKRecognizer.Builder().listener(new ParserListener() {

			@Override
			public void handleNewInput(final List<String> tokens) {
				events.add("start " + tokens);
			}

			@Override
			public void handleChartInsertion(final int start, final int end, final String variable,
					final Derivation derivation) {
				events.add(start + "," + end + " " + variable + " " + derivation);
			}

			@Override
			public void handleRecognitionCompletion(final boolean accepted, final Chart chart) {
				events.add("done " + accepted);
			}
		}).build();

		listening.recognize(ExampleGrammars.AB_BA.getGrammar(), Tokenizer.tokenize("ab"));
		assertEquals(ImmutableList.of("start [a, b]", "0,0 A 'a'", "1,1 B 'b'", "0,1 S A B @0", "done true"), events);
	}

	@Test
	public void testAgreesWithBruteForce() {
		final Random random = new Random(42);
		final String[] variables = { "S", "A", "B", "C" };
		final String[] terminals = { "a", "b" };

		for (int grammarNumber = 0; grammarNumber < 50; grammarNumber++) {
			final StringBuilder text = new StringBuilder();
			for (final String lhs : variables) {
				text.append(lhs + " -> " + terminals[random.nextInt(terminals.length)]);
				final int numBinary = random.nextInt(4);
				for (int i = 0; i < numBinary; i++) {
					text.append(" | " + variables[random.nextInt(variables.length)] + " "
							+ variables[random.nextInt(variables.length)]);
				}
				text.append("\n");
			}
			final Grammar grammar = GrammarCompiler.strict().compile(text.toString());

			for (int wordNumber = 0; wordNumber < 20; wordNumber++) {
				final List<String> tokens = new ArrayList<>();
				final int length = 1 + random.nextInt(7);
				for (int i = 0; i < length; i++) {
					tokens.add(terminals[random.nextInt(terminals.length)]);
				}

				final RecognitionResult result = recognizer.recognize(grammar, tokens);
				assertEquals(grammar + "\n" + tokens, BruteForceRecognizer.derives(grammar, tokens),
						result.isAccepted());
				if (result.isAccepted()) {
					assertEquals(tokens, result.getTree().get().getYield());
				}
			}
		}
	}
}

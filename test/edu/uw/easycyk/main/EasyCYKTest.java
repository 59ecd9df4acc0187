package edu.uw.easycyk.main;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.InputMismatchException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.io.Files;

import edu.uw.easycyk.main.EasyCYK.CommandLineArguments;
import edu.uw.easycyk.main.EasyCYK.OutputFormat;
import edu.uw.easycyk.syntax.grammar.ExampleGrammars;
import edu.uw.easycyk.syntax.grammar.Grammar;
import edu.uw.easycyk.syntax.grammar.GrammarCompiler;
import edu.uw.easycyk.syntax.grammar.GrammarFormatException;
import edu.uw.easycyk.util.Util;

public class EasyCYKTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static CommandLineArguments arguments(final String grammar, final String example, final String mode) {
		return new CommandLineArguments() {

			@Override
			public String getGrammar() {
				return grammar;
			}

			@Override
			public String getExample() {
				return example;
			}

			@Override
			public String getInputFile() {
				return "";
			}

			@Override
			public String getOutputFormat() {
				return "ascii";
			}

			@Override
			public String getMode() {
				return mode;
			}

			@Override
			public boolean getHelp() {
				return false;
			}
		};
	}

	@Test
	public void testProcess() {
		final EasyCYK easyCYK = new EasyCYK(ExampleGrammars.ENGLISH.getGrammar(), OutputFormat.BRACKETED);
		assertEquals("ID=1 ACCEPTED\n(S (NP (Det the) (N cat)) (VP (V chased) (NP (Det a) (N dog))))",
				easyCYK.process("the cat chased a dog", 1));
		assertEquals("ID=2 REJECTED\n(no parse)", easyCYK.process("the cat a dog", 2));
	}

	@Test
	public void testFormalStringInput() {
		final EasyCYK easyCYK = new EasyCYK(ExampleGrammars.SIMULATOR.getGrammar(), OutputFormat.ASCII);
		assertTrue(easyCYK.recognize(ExampleGrammars.SIMULATOR.getSampleInput()).isAccepted());
		assertFalse(easyCYK.recognize("bb").isAccepted());
	}

	@Test
	public void testSampleInputsAreAccepted() {
		for (final ExampleGrammars example : ExampleGrammars.values()) {
			final EasyCYK easyCYK = new EasyCYK(example.getGrammar(), OutputFormat.TABLE);
			assertTrue(example.name(), easyCYK.recognize(example.getSampleInput()).isAccepted());
		}
	}

	@Test
	public void testLoadExampleGrammar() throws IOException {
		assertEquals(ExampleGrammars.ENGLISH.getGrammar(), EasyCYK.loadGrammar(arguments("", "english", "lenient")));
	}

	@Test
	public void testLoadGrammarFile() throws IOException {
		final File file = folder.newFile("grammar.txt");
		Files.asCharSink(file, StandardCharsets.UTF_8).write("S → AB | BA\nA → a\nB → b\n");
		final Grammar grammar = EasyCYK.loadGrammar(arguments(file.getAbsolutePath(), "", "strict"));
		assertEquals(ExampleGrammars.AB_BA.getGrammar(), grammar);
	}

	@Test(expected = GrammarFormatException.class)
	public void testStrictGrammarFile() throws IOException {
		final File file = folder.newFile("grammar.txt");
		Files.asCharSink(file, StandardCharsets.UTF_8).write("S -> AB\nA is a\n");
		EasyCYK.loadGrammar(arguments(file.getAbsolutePath(), "", "strict"));
	}

	@Test(expected = InputMismatchException.class)
	public void testMissingGrammar() throws IOException {
		EasyCYK.loadGrammar(arguments("", "", "lenient"));
	}

	@Test(expected = InputMismatchException.class)
	public void testMissingGrammarFile() throws IOException {
		EasyCYK.loadGrammar(arguments(new File(folder.getRoot(), "missing").getAbsolutePath(), "", "lenient"));
	}

	@Test
	public void testCompilerModes() {
		assertEquals(GrammarCompiler.lenient(), EasyCYK.getCompiler("lenient"));
		assertEquals(GrammarCompiler.strict(), EasyCYK.getCompiler("STRICT"));
	}

	@Test(expected = InputMismatchException.class)
	public void testUnknownCompilerMode() {
		EasyCYK.getCompiler("relaxed");
	}

	@Test
	public void testReadInputLines() throws IOException {
		final File file = folder.newFile("input.txt");
		Files.asCharSink(file, StandardCharsets.UTF_8).write("# comment\nab\n\n  ba  \n");
		assertEquals(Arrays.asList("ab", "ba"), Util.readInputLines(file));
	}
}

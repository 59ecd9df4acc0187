package edu.uw.easycyk.main;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.InputMismatchException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Scanner;
import java.util.concurrent.TimeUnit;

import uk.co.flamingpenguin.jewel.cli.ArgumentValidationException;
import uk.co.flamingpenguin.jewel.cli.CliFactory;
import uk.co.flamingpenguin.jewel.cli.Option;

import com.google.common.base.Stopwatch;

import edu.uw.easycyk.syntax.grammar.ExampleGrammars;
import edu.uw.easycyk.syntax.grammar.Grammar;
import edu.uw.easycyk.syntax.grammar.GrammarCompiler;
import edu.uw.easycyk.syntax.grammar.GrammarFormatException;
import edu.uw.easycyk.syntax.parser.CYKRecognizer;
import edu.uw.easycyk.syntax.parser.RecognitionResult;
import edu.uw.easycyk.util.Util;

public class EasyCYK {

	/**
	 * Command Line Interface
	 */
	public interface CommandLineArguments {
		@Option(shortName = "g", defaultValue = "", description = "Path to the grammar file, one rule per line, e.g. \"S -> NP VP | a\"")
		String getGrammar();

		@Option(shortName = "e", defaultValue = "", description = "(Optional) Use a built-in grammar instead of a file: one of \"ab_ba\", \"simulator\" or \"english\"")
		String getExample();

		@Option(shortName = "f", defaultValue = "", description = "(Optional) Path to the input text file, one input per line. Otherwise, inputs are read from stdin.")
		String getInputFile();

		@Option(shortName = "o", defaultValue = "ascii", description = "(Optional) Output Format: one of \"ascii\", \"bracketed\", \"table\", \"trace\" or \"all\"")
		String getOutputFormat();

		@Option(shortName = "m", defaultValue = "lenient", description = "(Optional) Grammar parsing mode: \"lenient\" skips lines and alternatives it can't read, \"strict\" rejects them")
		String getMode();

		@Option(helpRequest = true, description = "Display this message", shortName = "h")
		boolean getHelp();
	}

	// Set of supported OutputFormats
	public enum OutputFormat {
		ASCII(ParsePrinter.ASCII_PRINTER), BRACKETED(ParsePrinter.BRACKETED_PRINTER), TABLE(ParsePrinter.TABLE_PRINTER), TRACE(
				ParsePrinter.TRACE_PRINTER), ALL(ParsePrinter.ALL_PRINTER);

		public final ParsePrinter printer;

		OutputFormat(final ParsePrinter printer) {
			this.printer = printer;
		}
	}

	private final Grammar grammar;
	private final CYKRecognizer recognizer;
	private final ParsePrinter printer;

	public EasyCYK(final Grammar grammar, final OutputFormat outputFormat) {
		this.grammar = grammar;
		this.recognizer = new CYKRecognizer();
		this.printer = outputFormat.printer;
	}

	public RecognitionResult recognize(final String input) {
		return recognizer.recognize(grammar, Tokenizer.tokenize(input));
	}

	/**
	 * Recognizes one line of input and formats the result.
	 */
	public String process(final String input, final int id) {
		return print(recognize(input), id);
	}

	public String print(final RecognitionResult result, final int id) {
		return printer.print(result, id);
	}

	public Grammar getGrammar() {
		return grammar;
	}

	/**
	 * Loads the grammar named by the command line: a built-in example if one is given, else the grammar file.
	 */
	static Grammar loadGrammar(final CommandLineArguments commandLineOptions) throws IOException {
		final GrammarCompiler compiler = getCompiler(commandLineOptions.getMode());
		if (!commandLineOptions.getExample().isEmpty()) {
			final ExampleGrammars example = ExampleGrammars.valueOf(commandLineOptions.getExample().toUpperCase(
					Locale.ROOT));
			return compiler.compile(example.getGrammarText());
		}

		if (commandLineOptions.getGrammar().isEmpty()) {
			throw new InputMismatchException("Must supply a grammar with -g or -e");
		}
		final File grammarFile = Util.getFile(commandLineOptions.getGrammar());
		if (!grammarFile.exists()) {
			throw new InputMismatchException("Couldn't load grammar from: " + grammarFile);
		}
		return compiler.compile(Util.readFileToString(grammarFile));
	}

	static GrammarCompiler getCompiler(final String mode) {
		switch (mode.toLowerCase(Locale.ROOT)) {
		case "lenient":
			return GrammarCompiler.lenient();
		case "strict":
			return GrammarCompiler.strict();
		default:
			throw new InputMismatchException("Unknown grammar mode: " + mode);
		}
	}

	public static void main(final String[] args) throws IOException {

		try {
			final CommandLineArguments commandLineOptions = CliFactory.parseArguments(CommandLineArguments.class, args);
			final OutputFormat outputFormat = OutputFormat.valueOf(commandLineOptions.getOutputFormat().toUpperCase(
					Locale.ROOT));

			System.err.println("====Loading grammar====");
			final Grammar grammar = loadGrammar(commandLineOptions);
			System.err.println("===Grammar loaded: " + grammar.size() + " productions, start symbol "
					+ grammar.getStartSymbol() + "===");
			final EasyCYK easyCYK = new EasyCYK(grammar, outputFormat);

			final Iterable<String> inputLines;
			if (commandLineOptions.getInputFile().isEmpty()) {
				// Read from STDIN
				final Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8.name());
				inputLines = () -> new LineIterator(scanner);
			} else {
				inputLines = Util.readInputLines(Util.getFile(commandLineOptions.getInputFile()));
			}

			final Stopwatch timer = Stopwatch.createStarted();
			final BufferedWriter sysout = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
			int id = 0;
			int accepted = 0;
			for (final String line : inputLines) {
				if (!Util.isInputLine(line.trim())) {
					continue;
				}
				id++;
				final RecognitionResult result = easyCYK.recognize(line);
				if (result.isAccepted()) {
					accepted++;
				}
				sysout.write(easyCYK.print(result, id));
				sysout.newLine();
				sysout.flush();
			}

			System.err.println("Recognized " + id + " inputs (" + Util.percentage(accepted, id) + " accepted) in "
					+ timer.elapsed(TimeUnit.MILLISECONDS) + "ms");
		} catch (final ArgumentValidationException e) {
			System.err.println(e.getMessage());
		} catch (final GrammarFormatException e) {
			System.err.println("Invalid grammar: " + e.getMessage());
			System.exit(1);
		}
	}

	private static class LineIterator implements Iterator<String> {
		private final Scanner scanner;

		private LineIterator(final Scanner scanner) {
			this.scanner = scanner;
		}

		@Override
		public boolean hasNext() {
			return scanner.hasNextLine();
		}

		@Override
		public String next() {
			return scanner.nextLine();
		}
	}
}

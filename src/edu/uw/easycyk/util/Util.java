package edu.uw.easycyk.util;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.io.Files;

public class Util {

	private Util() {
	}

	public static File getFile(final String path) {
		return new File(path.replace("~", System.getProperty("user.home")));
	}

	public static String readFileToString(final File file) throws IOException {
		return Files.asCharSource(file, StandardCharsets.UTF_8).read();
	}

	/**
	 * Lines of the file, trimmed, skipping empty lines and lines starting with '#'.
	 */
	public static List<String> readInputLines(final File file) throws IOException {
		return Files.asCharSource(file, StandardCharsets.UTF_8).readLines().stream().map(String::trim)
				.filter(Util::isInputLine).collect(Collectors.toList());
	}

	public static boolean isInputLine(final String line) {
		return !line.isEmpty() && !line.startsWith("#");
	}

	public static String percentage(final int count, final int size) {
		return size == 0 ? "0%" : (100 * count / size) + "%";
	}
}

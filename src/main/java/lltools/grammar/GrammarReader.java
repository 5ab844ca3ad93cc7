package lltools.grammar;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lltools.Config;
import lltools.Location;

/**
 * Reads grammars in the format produced by the GrammarPrinter:
 *
 * <pre>
 * # comment (only at the beginning of a line)
 * %start S
 * %terminals id + ( )
 * %nonterminals X
 * S -> E
 * E -> E + T | T
 *    | ( E )
 * A -> a | ε
 * </pre>
 *
 * Every left hand side and every name declared with %nonterminals is a non terminal (without
 * alternatives if it has no rule), all other names are terminals. "ε", "eps" and the configured epsilon
 * denote the empty word. Without a %start directive the first left hand side is the start non terminal.
 */
public class GrammarReader {

	private static final List<String> ARROWS = Arrays.asList("->", "→");
	private static final List<String> EPSILON_NAMES = Arrays.asList("ε", "eps");

	public Grammar read(Path file) throws IOException {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)){
			return read(reader);
		}
	}

	public Grammar read(String text){
		try {
			return read(new StringReader(text));
		} catch (IOException e) {
			throw new IllegalStateException("Reading from a string failed", e);
		}
	}

	public Grammar read(Reader input) throws IOException {
		GrammarBuilder builder = new GrammarBuilder();
		BufferedReader reader = new BufferedReader(input);
		String start = null;
		String firstLeft = null;
		String currentLeft = null;
		String line;
		int lineNumber = 0;
		while ((line = reader.readLine()) != null){
			lineNumber++;
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith("#")){
				continue;
			}
			Location location = new Location(lineNumber, line.indexOf(trimmed.charAt(0)) + 1);
			if (trimmed.startsWith("%")){
				String[] parts = trimmed.split("\\s+");
				switch (parts[0]){
					case "%start":
						if (parts.length != 2){
							throw new GrammarSyntaxException(location, "%start expects exactly one non terminal");
						}
						start = parts[1];
						break;
					case "%terminals":
						builder.terminals(Arrays.copyOfRange(parts, 1, parts.length));
						break;
					case "%nonterminals":
						builder.nonTerminals(Arrays.copyOfRange(parts, 1, parts.length));
						break;
					default:
						throw new GrammarSyntaxException(location, "Unknown directive " + parts[0]);
				}
				continue;
			}
			if (trimmed.startsWith("|")){
				if (currentLeft == null){
					throw new GrammarSyntaxException(location, "Alternative without a preceding rule");
				}
				addAlternatives(builder, currentLeft, trimmed.substring(1));
				continue;
			}
			int arrowIndex = -1;
			String arrow = null;
			for (String possibleArrow : ARROWS){
				int index = trimmed.indexOf(possibleArrow);
				if (index != -1 && (arrowIndex == -1 || index < arrowIndex)){
					arrowIndex = index;
					arrow = possibleArrow;
				}
			}
			if (arrowIndex == -1){
				throw new GrammarSyntaxException(location, "Expected a rule like 'A -> x y | z' but got '" + trimmed + "'");
			}
			String left = trimmed.substring(0, arrowIndex).trim();
			if (left.isEmpty() || left.split("\\s+").length != 1){
				throw new GrammarSyntaxException(location, "Expected exactly one non terminal on the left hand side");
			}
			if (isEpsilon(left)){
				throw new GrammarSyntaxException(location, "Epsilon can't be the left hand side of a rule");
			}
			if (firstLeft == null){
				firstLeft = left;
			}
			currentLeft = left;
			addAlternatives(builder, left, trimmed.substring(arrowIndex + arrow.length()));
		}
		if (start == null){
			start = firstLeft;
		}
		Grammar grammar = builder.toGrammar(start);
		Grammar.LOG.fine(() -> "Read grammar\n" + grammar.longDescription());
		return grammar;
	}

	private void addAlternatives(GrammarBuilder builder, String left, String alternatives){
		for (String alternative : alternatives.split("\\|", -1)){
			List<String> right = new ArrayList<>();
			for (String name : alternative.trim().split("\\s+")){
				if (!name.isEmpty() && !isEpsilon(name)){
					right.add(name);
				}
			}
			builder.add(left, right);
		}
	}

	private boolean isEpsilon(String name){
		return EPSILON_NAMES.contains(name) || name.equals(Config.epsilon());
	}
}

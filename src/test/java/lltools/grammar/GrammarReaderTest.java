package lltools.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.TreeSet;

import lltools.ExampleGrammars;
import lltools.analysis.FirstSets;
import lltools.transform.LeftRecursionEliminator;

import static lltools.GrammarMatcher.match;
import static lltools.GrammarMatcher.names;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarReaderTest {

	private final GrammarReader reader = new GrammarReader();

	@Test
	public void testReadFile() throws IOException, URISyntaxException {
		Path file = Paths.get(getClass().getResource("/expressions.grammar").toURI());
		assertEquals(ExampleGrammars.expressions(), reader.read(file));
	}

	@Test
	public void testPrintedGrammarCanBeRead(){
		Grammar grammar = ExampleGrammars.rightRecursiveExpressions();
		assertEquals(grammar, reader.read(grammar.toString()));
		Grammar demo = ExampleGrammars.statements();
		assertEquals(new GrammarPrinter().print(demo), new GrammarPrinter().print(reader.read(demo.toString())));
	}

	@Test
	public void testNonTerminalWithoutAlternativesCanBeRead(){
		Grammar grammar = new LeftRecursionEliminator().eliminate(new GrammarBuilder().rule("A", "A a").toGrammar("A"));
		String text = grammar.toString();
		assertEquals("%start A\n%nonterminals A\nA' -> a A' | ε\n", text);
		Grammar read = reader.read(text);
		assertEquals(grammar, read);
		assertTrue(FirstSets.calculate(read).get("A").isEmpty());
	}

	@Test
	public void testDeclaredNonTerminalCanBeRead(){
		Grammar grammar = new GrammarBuilder().nonTerminals("B").rule("A", "B").toGrammar("A");
		String text = grammar.toString();
		assertEquals("%nonterminals B\nA -> B\n", text);
		Grammar read = reader.read(text);
		assertEquals(grammar, read);
		assertTrue(read.isNonTerminal("B"));
		assertTrue(FirstSets.calculate(read).get("A").isEmpty());
	}

	@Test
	public void testUnusedTerminalsAndStartCanBeRead(){
		Grammar grammar = new GrammarBuilder().terminals("a", "b").rule("B", "a").rule("A", "B a").toGrammar("A");
		String text = grammar.toString();
		assertEquals("%start A\n%terminals b\nB -> a\nA -> B a\n", text);
		assertEquals(grammar, reader.read(text));
	}

	@Test
	public void testStartIsFirstLeftHandSide(){
		Grammar grammar = reader.read("B -> b\nA -> B a\n");
		assertEquals(new NonTerminal("B"), grammar.getStart());
	}

	@Test
	public void testStartDirective(){
		Grammar grammar = reader.read("B -> b\n%start A\nA -> B a\n");
		assertEquals(new NonTerminal("A"), grammar.getStart());
	}

	@ParameterizedTest
	@ValueSource(strings = {"A -> a | ε", "A -> a | eps", "A → a | ε", "A -> a |", "A -> a\n  | ε"})
	public void testEpsilonAlternatives(String text){
		match(reader.read(text)).alternatives("A", "a", "ε").run();
	}

	@Test
	public void testCommentsAndEmptyLines(){
		Grammar grammar = reader.read("# a comment\n\n   # indented comment\nS -> # x\n");
		match(grammar).alternatives("S", "# x").run();
		assertEquals(new TreeSet<>(Arrays.asList("#", "x")), names(grammar.getTerminals()));
	}

	@Test
	public void testTerminalsDirective(){
		Grammar grammar = reader.read("%terminals a b c\nS -> a S | ε\n");
		assertEquals(new TreeSet<>(Arrays.asList("a", "b", "c")), names(grammar.getTerminals()));
	}

	@ParameterizedTest
	@CsvSource(value = {
			"S -> a\\n%foo bar; 2; 1",
			"S -> a\\n%start; 2; 1",
			"%start A B; 1; 1",
			"'  | a'; 1; 3",
			"S a b; 1; 1",
			"S -> a\\n  X Y -> b; 2; 3",
			"' -> b'; 1; 2",
			"ε -> a; 1; 1"}, delimiter = ';')
	public void testSyntaxErrors(String text, int line, int column){
		GrammarSyntaxException exception = assertThrows(GrammarSyntaxException.class,
				() -> reader.read(text.replace("\\n", "\n")));
		assertEquals(line, exception.errorLocation.line);
		assertEquals(column, exception.errorLocation.column);
		assertTrue(exception.getMessage().startsWith(String.format("Error at [%d:%d]", line, column)));
	}

	@Test
	public void testTerminalAsLeftHandSide(){
		assertThrows(InvalidGrammarException.class, () -> reader.read("%terminals a\na -> b\n"));
	}
}

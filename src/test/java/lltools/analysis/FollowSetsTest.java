package lltools.analysis;

import org.junit.jupiter.api.Test;

import lltools.ExampleGrammars;
import lltools.grammar.Grammar;
import lltools.grammar.GrammarBuilder;

import static lltools.GrammarMatcher.match;
import static org.junit.jupiter.api.Assertions.*;

public class FollowSetsTest {

	@Test
	public void testStartContainsEndMarker(){
		match(ExampleGrammars.statements()).followContains("S", "$").run();
		match(ExampleGrammars.expressions()).followContains("E", "$").run();
	}

	@Test
	public void testLeftRecursiveExpressions(){
		match(ExampleGrammars.expressions())
				.follow("E", "$", "+", "-", ")")
				.follow("T", "$", "+", "-", ")", "*", "/")
				.followContains("F", "*", "/", "+", "-", ")", "$").run();
	}

	@Test
	public void testTextbookExpressions(){
		match(ExampleGrammars.rightRecursiveExpressions())
				.follow("E", "$", ")")
				.follow("E'", "$", ")")
				.follow("T", "+", "$", ")")
				.follow("T'", "+", "$", ")")
				.follow("F", "*", "+", "$", ")").run();
	}

	@Test
	public void testNullableSuffix(){
		Grammar grammar = new GrammarBuilder()
				.rule("A", "B C")
				.rule("B", "b")
				.rule("C", "c | ε")
				.toGrammar("A");
		match(grammar)
				.follow("A", "$")
				.follow("B", "c", "$")
				.follow("C", "$").run();
	}

	@Test
	public void testStatements(){
		match(ExampleGrammars.statements())
				.follow("ST", "$", "int", "id", "print")
				.follow("E", ";", ")", "+", "-").run();
	}

	@Test
	public void testWithoutStartSymbol(){
		Grammar grammar = new GrammarBuilder().rule("A", "a B").rule("B", "b").toGrammar();
		match(grammar).follow("A").follow("B").run();
	}

	@Test
	public void testFirstSetsOfAnotherGrammar(){
		FirstSets first = FirstSets.calculate(ExampleGrammars.expressions());
		assertThrows(IllegalArgumentException.class,
				() -> FollowSets.calculate(ExampleGrammars.rightRecursiveExpressions(), first));
	}

	@Test
	public void testFirstSetsOfAnEqualGrammar(){
		FirstSets first = FirstSets.calculate(ExampleGrammars.expressions());
		assertEquals(FollowSets.calculate(ExampleGrammars.expressions()).asMap(),
				FollowSets.calculate(ExampleGrammars.expressions(), first).asMap());
	}
}

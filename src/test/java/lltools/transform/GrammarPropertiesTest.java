package lltools.transform;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.generator.GeneratorConfiguration;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;

import org.junit.runner.RunWith;

import java.lang.annotation.*;
import java.util.*;

import lltools.analysis.FirstSets;
import lltools.analysis.FollowSets;
import lltools.grammar.*;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static lltools.GrammarMatcher.match;
import static lltools.GrammarMatcher.names;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the transformations on random grammars
 */
@RunWith(JUnitQuickcheck.class)
public class GrammarPropertiesTest {

	@Target({PARAMETER, FIELD, ANNOTATION_TYPE, TYPE_USE})
	@Retention(RUNTIME)
	@GeneratorConfiguration
	public @interface GrammarConfig {

		int maxNonTerminals() default 4;

		int maxTerminals() default 3;

		int maxAlternatives() default 4;

		int maxLength() default 3;
	}

	public static class Grammars extends Generator<Grammar> {

		private int maxNonTerminals = 4;
		private int maxTerminals = 3;
		private int maxAlternatives = 4;
		private int maxLength = 3;

		public Grammars() {
			super(Grammar.class);
		}

		public void configure(GrammarConfig config) {
			maxNonTerminals = config.maxNonTerminals();
			maxTerminals = config.maxTerminals();
			maxAlternatives = config.maxAlternatives();
			maxLength = config.maxLength();
		}

		@Override
		public Grammar generate(SourceOfRandomness random, GenerationStatus status) {
			int nonTerminalCount = random.nextInt(1, maxNonTerminals);
			int terminalCount = random.nextInt(1, maxTerminals);
			List<String> nonTerminals = new ArrayList<>();
			for (int i = 0; i < nonTerminalCount; i++){
				nonTerminals.add(String.valueOf((char)('A' + i)));
			}
			List<String> terminals = new ArrayList<>();
			for (int i = 0; i < terminalCount; i++){
				terminals.add(String.valueOf((char)('a' + i)));
			}
			List<String> symbols = new ArrayList<>(nonTerminals);
			symbols.addAll(terminals);
			GrammarBuilder builder = new GrammarBuilder().nonTerminals(nonTerminals).terminals(terminals);
			for (String nonTerminal : nonTerminals){
				int alternatives = random.nextInt(1, maxAlternatives);
				for (int i = 0; i < alternatives; i++){
					List<String> right = new ArrayList<>();
					int length = random.nextInt(0, maxLength);
					for (int j = 0; j < length; j++){
						right.add(random.choose(symbols));
					}
					builder.add(nonTerminal, right);
				}
			}
			return builder.toGrammar("A");
		}
	}

	@Property(trials = 100)
	public void checkNoImmediateLeftRecursion(@GrammarConfig @From(Grammars.class) Grammar grammar){
		match(new LeftRecursionEliminator().eliminate(grammar)).noImmediateLeftRecursion().run();
	}

	@Property(trials = 100)
	public void checkNewNonTerminalsAreFresh(@From(Grammars.class) Grammar grammar){
		Grammar result = new LeftRecursionEliminator().andThen(new LeftFactorer()).apply(grammar);
		Set<String> newNames = new HashSet<>(names(result.getNonTerminals()));
		newNames.removeAll(names(grammar.getNonTerminals()));
		for (String name : newNames){
			assertFalse(grammar.names().contains(name), name + " was already used in\n" + grammar);
		}
		assertEquals(grammar.getTerminals(), result.getTerminals());
		assertEquals(grammar.getStart(), result.getStart());
	}

	@Property(trials = 100)
	public void checkFactoredAlternativesStartDifferently(@GrammarConfig(maxAlternatives = 6) @From(Grammars.class) Grammar grammar){
		match(new LeftFactorer().factor(grammar)).noCommonFirstSymbols().run();
	}

	@Property(trials = 50)
	public void checkFactoringIsIdempotent(@From(Grammars.class) Grammar grammar){
		LeftFactorer factorer = new LeftFactorer();
		Grammar factored = factorer.factor(grammar);
		assertEquals(factored, factorer.factor(factored));
	}

	@Property(trials = 50)
	public void checkPrintedGrammarCanBeRead(@From(Grammars.class) Grammar grammar){
		GrammarReader reader = new GrammarReader();
		assertEquals(grammar, reader.read(grammar.toString()));
		Grammar transformed = new LeftRecursionEliminator().andThen(new LeftFactorer()).apply(grammar);
		assertEquals(transformed, reader.read(transformed.toString()), transformed.toString());
	}

	@Property(trials = 50)
	public void checkNullableNonTerminalsHaveEpsilonInFirst(@From(Grammars.class) Grammar grammar){
		FirstSets first = FirstSets.calculate(grammar);
		for (Production production : grammar.getProductions()){
			if (production.isEpsilonProduction()){
				assertTrue(first.get(production.left).contains(grammar.epsilon));
			}
		}
		for (Terminal terminal : grammar.getTerminals()){
			assertEquals(Collections.singleton(terminal), first.get(terminal));
		}
	}

	@Property(trials = 50)
	public void checkFollowSetsContainNoEpsilon(@From(Grammars.class) Grammar grammar){
		FollowSets follow = FollowSets.calculate(grammar);
		assertTrue(follow.get(grammar.getStart()).contains(grammar.eof));
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			for (Terminal terminal : follow.get(nonTerminal)){
				assertTrue(grammar.getTerminals().contains(terminal) || terminal.equals(grammar.eof),
						terminal + " isn't a terminal");
			}
		}
	}
}

package lltools.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders grammars and first/follow sets as text.
 *
 * Non terminals are printed in the order of the production table, set elements are sorted by name followed
 * by ε and the end marker.
 */
public class GrammarPrinter {

	private final String arrow;
	private final String separator;

	public GrammarPrinter() {
		this(" -> ", " | ");
	}

	public GrammarPrinter(String arrow, String separator) {
		this.arrow = arrow;
		this.separator = separator;
	}

	/**
	 * One <pre>A -> x y | z</pre> line per non terminal with productions.
	 *
	 * The lines are preceded by the directives that {@link GrammarReader} needs to read the grammar back:
	 * <pre>%start</pre> if the start isn't the first non terminal of the table, <pre>%nonterminals</pre> for
	 * non terminals without alternatives and <pre>%terminals</pre> for terminals that no production uses.
	 */
	public String print(Grammar grammar){
		StringBuilder builder = new StringBuilder();
		Map<NonTerminal, List<Production>> table = grammar.getProductionTable();
		NonTerminal start = grammar.getStart();
		if (start != null && (table.isEmpty() || !table.keySet().iterator().next().equals(start))){
			builder.append("%start ").append(start).append("\n");
		}
		List<Symbol> withoutProductions = new ArrayList<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			if (!table.containsKey(nonTerminal)){
				withoutProductions.add(nonTerminal);
			}
		}
		appendDirective(builder, "%nonterminals", withoutProductions);
		List<Symbol> unusedTerminals = new ArrayList<>(grammar.getTerminals());
		for (Production production : grammar.getProductions()){
			unusedTerminals.removeAll(production.terminals);
		}
		appendDirective(builder, "%terminals", unusedTerminals);
		for (Map.Entry<NonTerminal, List<Production>> entry : table.entrySet()){
			builder.append(entry.getKey()).append(arrow);
			List<Production> alternatives = entry.getValue();
			for (int i = 0; i < alternatives.size(); i++){
				if (i != 0){
					builder.append(separator);
				}
				builder.append(alternatives.get(i).formatRightSide());
			}
			builder.append("\n");
		}
		return builder.toString();
	}

	private void appendDirective(StringBuilder builder, String directive, List<Symbol> symbols){
		if (!symbols.isEmpty()){
			builder.append(directive);
			for (Symbol symbol : symbols){
				builder.append(" ").append(symbol);
			}
			builder.append("\n");
		}
	}

	/**
	 * Grammar preceded by a <pre>== title ==</pre> line
	 */
	public String print(Grammar grammar, String title){
		return "== " + title + " ==\n" + print(grammar);
	}

	/**
	 * One <pre>NAME(X) = { a, b }</pre> line per non terminal of the grammar that has an entry in the passed sets.
	 *
	 * @param name name of the set family, like "FIRST"
	 * @param grammar grammar whose non terminals are printed
	 * @param sets set per symbol
	 */
	public String printSets(String name, Grammar grammar, Map<? extends Symbol, ? extends Set<? extends Symbol>> sets){
		StringBuilder builder = new StringBuilder();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			if (!sets.containsKey(nonTerminal)){
				continue;
			}
			builder.append(name).append("(").append(nonTerminal).append(") = ")
					.append(formatSet(sets.get(nonTerminal), grammar)).append("\n");
		}
		return builder.toString();
	}

	/**
	 * Formats a set of symbols as <pre>{ a, b }</pre>, an empty set as <pre>{ }</pre>
	 */
	public String formatSet(Collection<? extends Symbol> set, Grammar grammar){
		List<Symbol> symbols = new ArrayList<>(set);
		symbols.sort(Comparator.comparingInt((Symbol s) -> s instanceof Epsilon ? 1 : (s.equals(grammar.eof) ? 2 : 0))
				.thenComparing(Comparator.naturalOrder()));
		StringBuilder builder = new StringBuilder("{ ");
		for (int i = 0; i < symbols.size(); i++){
			if (i != 0){
				builder.append(", ");
			}
			builder.append(symbols.get(i));
		}
		if (!symbols.isEmpty()){
			builder.append(" ");
		}
		return builder.append("}").toString();
	}
}

package lltools.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import lltools.grammar.Epsilon;
import lltools.grammar.Grammar;
import lltools.grammar.NonTerminal;
import lltools.grammar.Production;
import lltools.grammar.Symbol;
import lltools.grammar.Terminal;
import lltools.grammar.TerminalOrEpsilon;

/**
 * First(k=1) sets of all terminals and non terminals of a grammar.
 *
 * Instances are immutable and belong to exactly one grammar.
 */
public class FirstSets {

	public static final Logger LOG = Logger.getLogger("Analysis");

	public final Grammar grammar;

	private final Map<Symbol, Set<TerminalOrEpsilon>> first;

	private FirstSets(Grammar grammar, Map<Symbol, Set<TerminalOrEpsilon>> first) {
		this.grammar = grammar;
		this.first = first;
	}

	/**
	 * Calculates the first set of every symbol of the grammar.
	 *
	 * The first set of a terminal t is {t}. For each production A → X1 … Xk the symbols X1, X2, … are
	 * visited until a symbol is not nullable: a terminal is added to First(A), for a non terminal
	 * First(Xi) without ε is added. If all symbols are nullable (or the production is an epsilon
	 * production), ε is added to First(A).
	 *
	 * The calculation is repeated until no set changed during a whole pass.
	 *
	 * @param grammar analysed grammar
	 * @return first sets
	 */
	public static FirstSets calculate(Grammar grammar){
		Map<Symbol, Set<TerminalOrEpsilon>> first = new LinkedHashMap<>();
		for (Terminal terminal : grammar.getTerminals()){
			Set<TerminalOrEpsilon> set = new LinkedHashSet<>();
			set.add(terminal);
			first.put(terminal, set);
		}
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			first.put(nonTerminal, new LinkedHashSet<>());
		}
		boolean somethingChanged;
		int passes = 0;
		do {
			somethingChanged = false;
			passes++;
			for (Production production : grammar.getProductions()){
				Set<TerminalOrEpsilon> leftSet = first.get(production.left);
				somethingChanged = leftSet.addAll(firstOf(production.symbols(), first, grammar.epsilon))
						|| somethingChanged;
			}
		} while (somethingChanged);
		int passCount = passes;
		LOG.fine(() -> String.format("First sets converged after %d passes", passCount));
		Map<Symbol, Set<TerminalOrEpsilon>> result = new LinkedHashMap<>();
		for (Map.Entry<Symbol, Set<TerminalOrEpsilon>> entry : first.entrySet()){
			result.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return new FirstSets(grammar, Collections.unmodifiableMap(result));
	}

	private static Set<TerminalOrEpsilon> firstOf(List<Symbol> term, Map<Symbol, Set<TerminalOrEpsilon>> first,
	                                              Epsilon epsilon){
		Set<TerminalOrEpsilon> set = new LinkedHashSet<>();
		for (Symbol symbol : term){
			if (symbol instanceof Epsilon){
				continue;
			}
			if (symbol instanceof Terminal){
				set.add((Terminal)symbol);
				return set;
			}
			Set<TerminalOrEpsilon> symbolSet = first.getOrDefault(symbol, Collections.emptySet());
			boolean nullable = false;
			for (TerminalOrEpsilon toe : symbolSet){
				if (toe instanceof Epsilon){
					nullable = true;
				} else {
					set.add(toe);
				}
			}
			if (!nullable){
				return set;
			}
		}
		set.add(epsilon);
		return set;
	}

	/**
	 * First set of the passed symbol. Terminals that aren't part of the grammar have themselves as first set,
	 * epsilon has {ε}.
	 */
	public Set<TerminalOrEpsilon> get(Symbol symbol){
		if (first.containsKey(symbol)){
			return first.get(symbol);
		}
		if (symbol instanceof NonTerminal){
			return Collections.emptySet();
		}
		return Collections.singleton((TerminalOrEpsilon)symbol);
	}

	/**
	 * First set of the symbol with the passed name
	 */
	public Set<TerminalOrEpsilon> get(String name){
		return get(grammar.symbol(name));
	}

	/**
	 * First set of a sequence of symbols, contains ε if the sequence is empty or all its symbols are nullable.
	 */
	public Set<TerminalOrEpsilon> firstOf(List<? extends Symbol> term){
		return Collections.unmodifiableSet(firstOf(Collections.unmodifiableList(term), first, grammar.epsilon));
	}

	/**
	 * Can the symbol derive the empty word?
	 */
	public boolean isNullable(Symbol symbol){
		return symbol instanceof Epsilon || get(symbol).contains(grammar.epsilon);
	}

	/**
	 * Symbols that have a first set, terminals first
	 */
	public Set<Symbol> symbols(){
		return first.keySet();
	}

	public Map<Symbol, Set<TerminalOrEpsilon>> asMap(){
		return first;
	}

	@Override
	public String toString() {
		return first.toString();
	}
}

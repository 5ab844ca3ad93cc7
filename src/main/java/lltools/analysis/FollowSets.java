package lltools.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lltools.grammar.Grammar;
import lltools.grammar.NonTerminal;
import lltools.grammar.Production;
import lltools.grammar.Symbol;
import lltools.grammar.Terminal;
import lltools.grammar.TerminalOrEpsilon;

import static lltools.analysis.FirstSets.LOG;

/**
 * Follow(k=1) sets of all non terminals of a grammar, may contain the end of input terminal.
 */
public class FollowSets {

	public final Grammar grammar;

	private final Map<NonTerminal, Set<Terminal>> follow;

	private FollowSets(Grammar grammar, Map<NonTerminal, Set<Terminal>> follow) {
		this.grammar = grammar;
		this.follow = follow;
	}

	/**
	 * Calculate the follow 1 set for all non terminals
	 *
	 * First put $ (the end of input marker) in Follow(S) (S is the start symbol)
	 * If there is a production A → aBb, (where a can be a whole string) then everything in First(b) except for ε
	 * is placed in Follow(B).
	 * If there is a production A → aB, then everything in Follow(A) is in Follow(B)
	 * If there is a production A → aBb, where First(b) contains ε, then everything in Follow(A) is in Follow(B)
	 *
	 * Each production is walked from right to left, keeping the set of terminals that can follow the current
	 * position. Repeated until no set changed during a whole pass.
	 *
	 * @param grammar analysed grammar
	 * @param first converged first sets of the same grammar
	 * @return follow sets
	 */
	public static FollowSets calculate(Grammar grammar, FirstSets first){
		if (first.grammar != grammar && !first.grammar.equals(grammar)){
			throw new IllegalArgumentException("The first sets belong to another grammar");
		}
		Map<NonTerminal, Set<Terminal>> follow = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			follow.put(nonTerminal, new LinkedHashSet<>());
		}
		if (grammar.getStart() != null){
			follow.get(grammar.getStart()).add(grammar.eof);
		}
		boolean followChanged;
		int passes = 0;
		do {
			followChanged = false;
			passes++;
			for (Production production : grammar.getProductions()){
				if (production.isEpsilonProduction()){
					continue;
				}
				Set<Terminal> lastFollow = new LinkedHashSet<>(follow.get(production.left));
				List<Symbol> right = production.right;
				for (int i = right.size() - 1; i >= 0; i--){
					Symbol symbol = right.get(i);
					if (symbol instanceof NonTerminal){
						NonTerminal rightPart = (NonTerminal)symbol;
						if (follow.get(rightPart).addAll(lastFollow)){
							followChanged = true;
						}
						if (!first.isNullable(rightPart)){
							lastFollow.clear();
						}
						for (TerminalOrEpsilon toe : first.get(rightPart)){
							if (toe instanceof Terminal){
								lastFollow.add((Terminal)toe);
							}
						}
					} else {  // terminal
						lastFollow.clear();
						lastFollow.add((Terminal)symbol);
					}
				}
			}
		} while (followChanged);
		int passCount = passes;
		LOG.fine(() -> String.format("Follow sets converged after %d passes", passCount));
		Map<NonTerminal, Set<Terminal>> result = new LinkedHashMap<>();
		for (Map.Entry<NonTerminal, Set<Terminal>> entry : follow.entrySet()){
			result.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return new FollowSets(grammar, Collections.unmodifiableMap(result));
	}

	/**
	 * Calculates the first sets too.
	 */
	public static FollowSets calculate(Grammar grammar){
		return calculate(grammar, FirstSets.calculate(grammar));
	}

	/**
	 * Follow set of the passed non terminal, empty for unknown non terminals
	 */
	public Set<Terminal> get(NonTerminal nonTerminal){
		return follow.getOrDefault(nonTerminal, Collections.emptySet());
	}

	public Set<Terminal> get(String name){
		return get(new NonTerminal(name));
	}

	public Map<NonTerminal, Set<Terminal>> asMap(){
		return follow;
	}

	@Override
	public String toString() {
		return follow.toString();
	}
}

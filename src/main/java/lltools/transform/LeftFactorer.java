package lltools.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lltools.Config;
import lltools.grammar.Grammar;
import lltools.grammar.NonTerminal;
import lltools.grammar.Production;
import lltools.grammar.Symbol;

import static lltools.transform.LeftRecursionEliminator.LOG;
import static lltools.util.Utils.concat;
import static lltools.util.Utils.makeArrayList;

/**
 * Left factoring: alternatives of a non terminal that start with the same symbol are replaced by
 * <pre>
 * A  → γ A'
 * A' → δ1 | … | δn
 * </pre>
 * with γ being the longest common prefix of these alternatives (an empty δi becomes ε).
 *
 * Only one group of alternatives is rewritten per pass, the grammar is scanned again from the beginning
 * until a pass doesn't find anything to factor.
 */
public class LeftFactorer implements GrammarTransformation {

	private final int maxPasses;

	public LeftFactorer() {
		this(Config.maxFactoringPasses());
	}

	/**
	 * @param maxPasses maximum number of passes before a NonConvergenceException is thrown
	 */
	public LeftFactorer(int maxPasses) {
		if (maxPasses < 1){
			throw new IllegalArgumentException("At least one pass is needed");
		}
		this.maxPasses = maxPasses;
	}

	@Override
	public Grammar apply(Grammar grammar) {
		return factor(grammar);
	}

	/**
	 * @throws NonConvergenceException if the rewriting didn't stop within the maximum number of passes
	 */
	public Grammar factor(Grammar grammar){
		NonTerminalNameGenerator names = new NonTerminalNameGenerator(grammar);
		Map<NonTerminal, List<Production>> table = grammar.copyProductionTable();
		int passes = 1;
		while (factorOnce(grammar, table, names)){
			passes++;
			if (passes > maxPasses){
				throw new NonConvergenceException("Left factoring", maxPasses);
			}
		}
		int passCount = passes;
		LOG.fine(() -> String.format("Left factoring finished after %d passes", passCount));
		return grammar.withProductions(table);
	}

	/**
	 * Rewrites the first group of alternatives with a common prefix.
	 *
	 * @return true if something was rewritten
	 */
	private boolean factorOnce(Grammar grammar, Map<NonTerminal, List<Production>> table,
	                           NonTerminalNameGenerator names){
		for (Map.Entry<NonTerminal, List<Production>> entry : new ArrayList<>(table.entrySet())){
			NonTerminal nonTerminal = entry.getKey();
			List<Production> alternatives = entry.getValue();
			// epsilon productions are grouped under ε
			Map<Symbol, List<Production>> groups = new LinkedHashMap<>();
			for (Production production : alternatives){
				groups.computeIfAbsent(production.right.get(0), s -> new ArrayList<>()).add(production);
			}
			for (List<Production> group : groups.values()){
				if (group.size() <= 1){
					continue;
				}
				List<Symbol> prefix = longestCommonPrefix(group);
				if (prefix.isEmpty()){
					continue;
				}
				NonTerminal newNonTerminal = names.createNewNonTerminal(nonTerminal);
				List<Production> newAlternatives = new ArrayList<>();
				for (Production production : alternatives){
					if (production == group.get(0)){
						newAlternatives.add(grammar.production(nonTerminal, concat(prefix, makeArrayList(newNonTerminal))));
					} else if (!group.contains(production)){
						newAlternatives.add(production);
					}
				}
				List<Production> newNonTerminalAlternatives = new ArrayList<>();
				for (Production production : group){
					newNonTerminalAlternatives.add(grammar.production(newNonTerminal,
							production.right.subList(prefix.size(), production.right.size())));
				}
				replace(table, nonTerminal, newAlternatives, newNonTerminal, newNonTerminalAlternatives);
				LOG.fine(() -> String.format("Factored out %s of %s into %s", prefix, nonTerminal, newNonTerminal));
				return true;
			}
		}
		return false;
	}

	private List<Symbol> longestCommonPrefix(List<Production> group){
		List<Symbol> prefix = new ArrayList<>(group.get(0).symbols());
		for (Production production : group){
			List<Symbol> symbols = production.symbols();
			int k = 0;
			while (k < prefix.size() && k < symbols.size() && prefix.get(k).equals(symbols.get(k))){
				k++;
			}
			prefix = new ArrayList<>(prefix.subList(0, k));
		}
		return prefix;
	}

	/**
	 * Replaces the alternatives of the non terminal and inserts the new non terminal directly after it
	 */
	private void replace(Map<NonTerminal, List<Production>> table, NonTerminal nonTerminal,
	                     List<Production> alternatives, NonTerminal newNonTerminal,
	                     List<Production> newNonTerminalAlternatives){
		Map<NonTerminal, List<Production>> copy = new LinkedHashMap<>(table);
		table.clear();
		for (Map.Entry<NonTerminal, List<Production>> entry : copy.entrySet()){
			if (entry.getKey().equals(nonTerminal)){
				table.put(nonTerminal, alternatives);
				table.put(newNonTerminal, newNonTerminalAlternatives);
			} else {
				table.put(entry.getKey(), entry.getValue());
			}
		}
	}
}

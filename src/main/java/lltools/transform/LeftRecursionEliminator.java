package lltools.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Stack;
import java.util.logging.Logger;

import lltools.analysis.FirstSets;
import lltools.grammar.Grammar;
import lltools.grammar.NonTerminal;
import lltools.grammar.Production;
import lltools.grammar.Symbol;

import static lltools.util.Utils.concat;
import static lltools.util.Utils.makeArrayList;

/**
 * Removes immediate left recursion.
 *
 * A non terminal with the alternatives <pre>A → A α1 | … | A αn | β1 | … | βm</pre> is replaced by
 * <pre>
 * A  → β1 A' | … | βm A'
 * A' → α1 A' | … | αn A' | ε
 * </pre>
 * Indirect left recursion (A → B …, B → A …) is not removed, the grammar must not contain it.
 * Non terminals that are part of such a cycle are only reported via a warning.
 */
public class LeftRecursionEliminator implements GrammarTransformation {

	public static final Logger LOG = Logger.getLogger("Transform");

	@Override
	public Grammar apply(Grammar grammar) {
		return eliminate(grammar);
	}

	public Grammar eliminate(Grammar grammar){
		Set<NonTerminal> indirect = findIndirectLeftRecursion(grammar);
		if (!indirect.isEmpty()){
			LOG.warning("Indirect left recursion isn't removed, it involves " + indirect);
		}
		NonTerminalNameGenerator names = new NonTerminalNameGenerator(grammar);
		Map<NonTerminal, List<Production>> table = new LinkedHashMap<>();
		for (Map.Entry<NonTerminal, List<Production>> entry : grammar.getProductionTable().entrySet()){
			NonTerminal nonTerminal = entry.getKey();
			List<List<Symbol>> alpha = new ArrayList<>();
			List<List<Symbol>> beta = new ArrayList<>();
			boolean removedCycle = false;
			for (Production production : entry.getValue()){
				if (production.startsWith(nonTerminal)){
					List<Symbol> rest = production.right.subList(1, production.right.size());
					if (rest.isEmpty()){
						// A → A doesn't add any word
						LOG.fine(() -> "Removed cyclic production " + production);
						removedCycle = true;
					} else {
						alpha.add(rest);
					}
				} else {
					beta.add(production.symbols());
				}
			}
			if (alpha.isEmpty()){
				if (removedCycle){
					List<Production> alternatives = new ArrayList<>();
					for (List<Symbol> b : beta){
						alternatives.add(grammar.production(nonTerminal, b));
					}
					table.put(nonTerminal, alternatives);
				} else {
					table.put(nonTerminal, entry.getValue());
				}
				continue;
			}
			NonTerminal newNonTerminal = names.createNewNonTerminal(nonTerminal);
			List<Production> newAlternatives = new ArrayList<>();
			for (List<Symbol> b : beta){
				newAlternatives.add(grammar.production(nonTerminal, concat(b, makeArrayList(newNonTerminal))));
			}
			List<Production> newNonTerminalAlternatives = new ArrayList<>();
			for (List<Symbol> a : alpha){
				newNonTerminalAlternatives.add(grammar.production(newNonTerminal,
						concat(a, makeArrayList(newNonTerminal))));
			}
			newNonTerminalAlternatives.add(grammar.production(newNonTerminal, makeArrayList(grammar.epsilon)));
			table.put(nonTerminal, newAlternatives);
			table.put(newNonTerminal, newNonTerminalAlternatives);
			LOG.fine(() -> String.format("Removed left recursion of %s with %s", nonTerminal, newNonTerminal));
		}
		return grammar.withProductions(table);
	}

	/**
	 * Non terminals that can derive a word starting with themselves, not counting productions that directly
	 * start with the non terminal itself. Nullable prefixes are taken into account.
	 */
	public Set<NonTerminal> findIndirectLeftRecursion(Grammar grammar){
		FirstSets first = FirstSets.calculate(grammar);
		Map<NonTerminal, Set<NonTerminal>> leftCorners = new HashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			Set<NonTerminal> corners = new LinkedHashSet<>();
			for (Production production : grammar.getProductions(nonTerminal)){
				List<Symbol> symbols = production.symbols();
				for (int i = 0; i < symbols.size(); i++){
					Symbol symbol = symbols.get(i);
					if (!(symbol instanceof NonTerminal)){
						break;
					}
					if (i != 0 || !symbol.equals(nonTerminal)){
						corners.add((NonTerminal)symbol);
					}
					if (!first.isNullable(symbol)){
						break;
					}
				}
			}
			leftCorners.put(nonTerminal, corners);
		}
		Set<NonTerminal> ret = new LinkedHashSet<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			Set<NonTerminal> visited = new HashSet<>();
			Stack<NonTerminal> depthFirstStack = new Stack<>();
			depthFirstStack.addAll(leftCorners.getOrDefault(nonTerminal, Collections.emptySet()));
			while (!depthFirstStack.isEmpty()){
				NonTerminal current = depthFirstStack.pop();
				if (current.equals(nonTerminal)){
					ret.add(nonTerminal);
					break;
				}
				if (visited.add(current)){
					depthFirstStack.addAll(leftCorners.getOrDefault(current, Collections.emptySet()));
				}
			}
		}
		return ret;
	}
}

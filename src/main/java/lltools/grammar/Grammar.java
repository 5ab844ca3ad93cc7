package lltools.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import static lltools.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions.
 *
 * A grammar is never modified after its creation, transformations create new grammars.
 * Use the GrammarBuilder to build a grammar instance from symbol names.
 *
 * @see GrammarBuilder GrammarBuilder
 */
public class Grammar implements Serializable {

	public static final Logger LOG = Logger.getLogger("Grammar");

	/**
	 * Start non terminal, might be null
	 */
	private final NonTerminal start;

	/**
	 * Non terminals in the grammar, includes all non terminals without productions
	 */
	private final Set<NonTerminal> nonTerminals;

	/**
	 * Declared terminals and all terminals used in the productions
	 */
	private final Set<Terminal> terminals;

	/**
	 * Productions per non terminal, in insertion order. Non terminals without alternatives have no entry.
	 */
	private final Map<NonTerminal, List<Production>> productions;

	/**
	 * The empty word, never a terminal or non terminal
	 */
	public final Epsilon epsilon;

	/**
	 * End of input terminal, used in follow sets. Not part of the terminals of the grammar.
	 */
	public final Terminal eof;

	/**
	 * Create a new Grammar object
	 *
	 * Removes duplicate alternatives of each non terminal and adds all left hand sides and used symbols
	 * to the sets of non terminals and terminals.
	 *
	 * @param start start non terminal or null
	 * @param nonTerminals declared non terminals
	 * @param terminals declared terminals
	 * @param epsilon epsilon symbol
	 * @param eof end of input terminal
	 * @param productions productions per non terminal
	 * @throws InvalidGrammarException if a name is used for symbols of different kinds
	 */
	public Grammar(NonTerminal start, Collection<NonTerminal> nonTerminals, Collection<Terminal> terminals,
	               Epsilon epsilon, Terminal eof, Map<NonTerminal, List<Production>> productions) {
		this.start = start;
		this.epsilon = epsilon;
		this.eof = eof;
		Set<NonTerminal> nonTerms = new LinkedHashSet<>();
		if (start != null){
			nonTerms.add(start);
		}
		nonTerms.addAll(nonTerminals);
		Map<NonTerminal, List<Production>> prods = new LinkedHashMap<>();
		for (Map.Entry<NonTerminal, List<Production>> entry : productions.entrySet()){
			NonTerminal left = entry.getKey();
			nonTerms.add(left);
			List<Production> alternatives = removeDuplicateProductions(left, entry.getValue());
			if (!alternatives.isEmpty()){
				prods.put(left, Collections.unmodifiableList(alternatives));
			}
		}
		Set<Terminal> terms = new LinkedHashSet<>(terminals);
		for (List<Production> alternatives : prods.values()){
			for (Production production : alternatives){
				terms.addAll(production.terminals);
				nonTerms.addAll(production.nonTerminals);
			}
		}
		this.nonTerminals = Collections.unmodifiableSet(nonTerms);
		this.terminals = Collections.unmodifiableSet(terms);
		this.productions = Collections.unmodifiableMap(prods);
		checkNames();
	}

	private static List<Production> removeDuplicateProductions(NonTerminal left, List<Production> alternatives){
		List<Production> ret = new ArrayList<>();
		for (Production production : alternatives){
			if (!production.left.equals(left)){
				throw new InvalidGrammarException(String.format("Production %s is stored as alternative of %s",
						production, left));
			}
			if (ret.contains(production)){
				LOG.fine(() -> "Removed duplicate production " + production);
			} else {
				ret.add(production);
			}
		}
		return ret;
	}

	private void checkNames(){
		Set<String> nonTerminalNames = new HashSet<>();
		for (NonTerminal nonTerminal : nonTerminals){
			nonTerminalNames.add(nonTerminal.name);
		}
		for (Terminal terminal : terminals){
			if (nonTerminalNames.contains(terminal.name)){
				throw new InvalidGrammarException(String.format("'%s' is used as a terminal and as a non terminal",
						terminal.name));
			}
			if (terminal.name.equals(epsilon.name)){
				throw new InvalidGrammarException(String.format("The epsilon '%s' can't be used as a terminal",
						epsilon.name));
			}
		}
		if (nonTerminalNames.contains(epsilon.name)){
			throw new InvalidGrammarException(String.format("The epsilon '%s' can't be used as a non terminal",
					epsilon.name));
		}
	}

	public NonTerminal getStart(){
		return start;
	}

	public Set<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	public Set<Terminal> getTerminals(){
		return terminals;
	}

	/**
	 * Alternatives of the passed non terminal, empty if it has no productions.
	 */
	public List<Production> getProductions(NonTerminal nonTerminal){
		return productions.getOrDefault(nonTerminal, Collections.emptyList());
	}

	/**
	 * Non terminals with their alternatives, in the order in which they were added.
	 * Non terminals without alternatives aren't part of the table.
	 */
	public Map<NonTerminal, List<Production>> getProductionTable(){
		return productions;
	}

	/**
	 * All productions of all non terminals
	 */
	public List<Production> getProductions(){
		List<Production> ret = new ArrayList<>();
		for (List<Production> alternatives : productions.values()){
			ret.addAll(alternatives);
		}
		return Collections.unmodifiableList(ret);
	}

	public boolean isNonTerminal(String name){
		return nonTerminals.contains(new NonTerminal(name));
	}

	/**
	 * Every name that is neither a non terminal nor epsilon is a terminal, even if it isn't used in
	 * the grammar.
	 */
	public boolean isTerminal(String name){
		return terminals.contains(new Terminal(name)) || (!isEpsilon(name) && !isNonTerminal(name));
	}

	public boolean isEpsilon(String name){
		return epsilon.name.equals(name);
	}

	public Symbol.Kind classify(String name){
		if (isNonTerminal(name)){
			return Symbol.Kind.NONTERMINAL;
		}
		if (isEpsilon(name)){
			return Symbol.Kind.EPSILON;
		}
		return Symbol.Kind.TERMINAL;
	}

	/**
	 * Creates the symbol object for the passed name, based on {@link #classify(String)}
	 */
	public Symbol symbol(String name){
		switch (classify(name)){
			case NONTERMINAL:
				return new NonTerminal(name);
			case EPSILON:
				return epsilon;
			default:
				return new Terminal(name);
		}
	}

	public NonTerminal getNonTerminal(String name){
		if (!isNonTerminal(name)){
			throw new IllegalArgumentException("No such non terminal " + name);
		}
		return new NonTerminal(name);
	}

	/**
	 * Names of all terminals and non terminals and the name of epsilon
	 */
	public Set<String> names(){
		Set<String> names = new HashSet<>();
		for (NonTerminal nonTerminal : nonTerminals){
			names.add(nonTerminal.name);
		}
		for (Terminal terminal : terminals){
			names.add(terminal.name);
		}
		names.add(epsilon.name);
		return names;
	}

	/**
	 * Creates a new grammar with the same start, terminals and special symbols but with a new production table.
	 *
	 * @param productions new productions per non terminal
	 * @return new grammar
	 */
	public Grammar withProductions(Map<NonTerminal, List<Production>> productions){
		Set<NonTerminal> nonTerms = new LinkedHashSet<>(nonTerminals);
		nonTerms.addAll(productions.keySet());
		return new Grammar(start, nonTerms, terminals, epsilon, eof, productions);
	}

	/**
	 * Creates a copy of the production table that can be modified
	 */
	public Map<NonTerminal, List<Production>> copyProductionTable(){
		Map<NonTerminal, List<Production>> copy = new LinkedHashMap<>();
		for (Map.Entry<NonTerminal, List<Production>> entry : productions.entrySet()){
			copy.put(entry.getKey(), new ArrayList<>(entry.getValue()));
		}
		return copy;
	}

	public Production production(NonTerminal left, List<? extends Symbol> right){
		return new Production(left, right, epsilon);
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(getProductions(), "\n");
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Grammar)){
			return false;
		}
		Grammar other = (Grammar)obj;
		return Objects.equals(start, other.start) && epsilon.equals(other.epsilon) && eof.equals(other.eof)
				&& nonTerminals.equals(other.nonTerminals) && terminals.equals(other.terminals)
				&& productions.equals(other.productions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, nonTerminals, terminals, productions);
	}

	@Override
	public String toString() {
		return new GrammarPrinter().print(this);
	}
}

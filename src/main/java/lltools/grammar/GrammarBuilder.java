package lltools.grammar;

import java.util.*;

import lltools.Config;

/**
 * Allows the simple creation of grammars from symbol names.
 *
 * Left hand sides are non terminals, names that are neither declared as non terminals nor used as left hand
 * side are terminals. The empty string and the epsilon name are treated as ε.
 */
public class GrammarBuilder {

	private String start;
	private final Set<String> declaredNonTerminals = new LinkedHashSet<>();
	private final Set<String> declaredTerminals = new LinkedHashSet<>();
	private final Map<String, List<List<String>>> productions = new LinkedHashMap<>();
	private final Set<String> implicitTerminals = new LinkedHashSet<>();
	private String epsilon = Config.epsilon();
	private String endMarker = Config.endMarker();

	/**
	 * Creates a grammar from a production table
	 *
	 * @param start name of the start non terminal, might be null
	 * @param nonTerminals names of the non terminals
	 * @param terminals names of the terminals
	 * @param productions alternatives per non terminal
	 * @return new grammar
	 */
	public static Grammar fromTable(String start, Collection<String> nonTerminals, Collection<String> terminals,
	                                Map<String, List<List<String>>> productions){
		GrammarBuilder builder = new GrammarBuilder().nonTerminals(nonTerminals).terminals(terminals);
		for (Map.Entry<String, List<List<String>>> entry : productions.entrySet()){
			for (List<String> alternative : entry.getValue()){
				builder.add(entry.getKey(), alternative);
			}
		}
		return builder.toGrammar(start);
	}

	public GrammarBuilder start(String start){
		this.start = start;
		return this;
	}

	public GrammarBuilder nonTerminals(String... nonTerminals){
		return nonTerminals(Arrays.asList(nonTerminals));
	}

	public GrammarBuilder nonTerminals(Collection<String> nonTerminals){
		for (String nonTerminal : nonTerminals){
			checkNonTerminalName(nonTerminal);
			declaredNonTerminals.add(nonTerminal);
		}
		return this;
	}

	public GrammarBuilder terminals(String... terminals){
		return terminals(Arrays.asList(terminals));
	}

	public GrammarBuilder terminals(Collection<String> terminals){
		for (String terminal : terminals){
			if (terminal.isEmpty() || terminal.equals(epsilon)){
				throw new InvalidGrammarException(String.format("'%s' can't be used as a terminal name", terminal));
			}
			declaredTerminals.add(terminal);
		}
		return this;
	}

	/**
	 * Sets the name used for ε (default: the configured epsilon)
	 */
	public GrammarBuilder epsilon(String epsilon){
		this.epsilon = epsilon;
		return this;
	}

	/**
	 * Sets the name of the end of input terminal (default: the configured end marker)
	 */
	public GrammarBuilder endMarker(String endMarker){
		this.endMarker = endMarker;
		return this;
	}

	/**
	 * Adds a new production.
	 *
	 * The entries of the right hand side are names of terminals or non terminals, "" and the epsilon name
	 * are equivalent to ε. An empty right hand side is an epsilon production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 */
	public GrammarBuilder add(String left, String... right){
		return add(left, Arrays.asList(right));
	}

	public GrammarBuilder add(String left, List<String> right){
		checkNonTerminalName(left);
		if (declaredTerminals.contains(left)){
			throw new InvalidGrammarException(String.format("Ambiguity while building the grammar: '%s' is the name " +
					"of a terminal and therefore can't be used as a non terminal name", left));
		}
		productions.computeIfAbsent(left, l -> new ArrayList<>()).add(new ArrayList<>(right));
		return this;
	}

	/**
	 * Adds the alternatives of a rule like <pre>E + T | T</pre>, symbols are separated by whitespace.
	 *
	 * @param left name of the defining non terminal
	 * @param alternatives alternatives separated by "|"
	 */
	public GrammarBuilder rule(String left, String alternatives){
		for (String alternative : alternatives.split("\\|", -1)){
			String trimmed = alternative.trim();
			if (trimmed.isEmpty()){
				add(left);
			} else {
				add(left, trimmed.split("\\s+"));
			}
		}
		return this;
	}

	private void checkNonTerminalName(String name){
		if (name == null || name.isEmpty() || name.equals(epsilon)){
			throw new InvalidGrammarException(String.format("'%s' can't be used as a non terminal name", name));
		}
	}

	/**
	 * Names that were treated as terminals without being declared during the last {@link #toGrammar()} call.
	 */
	public Set<String> getImplicitTerminals(){
		return Collections.unmodifiableSet(implicitTerminals);
	}

	public Grammar toGrammar(String start){
		return start(start).toGrammar();
	}

	/**
	 * Creates the grammar, every symbol is tagged as terminal, non terminal or epsilon here.
	 *
	 * @throws InvalidGrammarException if a name is declared as terminal and non terminal
	 */
	public Grammar toGrammar(){
		Set<String> nonTerminalNames = new LinkedHashSet<>();
		if (start != null){
			checkNonTerminalName(start);
			nonTerminalNames.add(start);
		}
		nonTerminalNames.addAll(declaredNonTerminals);
		nonTerminalNames.addAll(productions.keySet());
		for (String name : nonTerminalNames){
			if (declaredTerminals.contains(name)){
				throw new InvalidGrammarException(String.format("'%s' is declared as terminal but used as a non terminal",
						name));
			}
		}
		implicitTerminals.clear();
		Epsilon eps = new Epsilon(epsilon);
		Map<String, NonTerminal> nonTerminals = new LinkedHashMap<>();
		for (String name : nonTerminalNames){
			nonTerminals.put(name, new NonTerminal(name));
		}
		List<Terminal> terminals = new ArrayList<>();
		for (String name : declaredTerminals){
			terminals.add(new Terminal(name));
		}
		Map<NonTerminal, List<Production>> table = new LinkedHashMap<>();
		for (Map.Entry<String, List<List<String>>> entry : productions.entrySet()){
			NonTerminal left = nonTerminals.get(entry.getKey());
			List<Production> alternatives = new ArrayList<>();
			for (List<String> alternative : entry.getValue()){
				List<Symbol> right = new ArrayList<>();
				for (String name : alternative){
					right.add(toSymbol(name, nonTerminals, eps));
				}
				alternatives.add(new Production(left, right, eps));
			}
			table.put(left, alternatives);
		}
		return new Grammar(start == null ? null : nonTerminals.get(start), nonTerminals.values(), terminals,
				eps, new Terminal(endMarker), table);
	}

	private Symbol toSymbol(String name, Map<String, NonTerminal> nonTerminals, Epsilon eps){
		if (name.isEmpty() || name.equals(epsilon)){
			return eps;
		}
		if (nonTerminals.containsKey(name)){
			return nonTerminals.get(name);
		}
		if (!declaredTerminals.contains(name) && implicitTerminals.add(name)){
			if (!declaredTerminals.isEmpty() && Config.warnImplicitTerminals()){
				Grammar.LOG.warning(String.format("'%s' is neither declared as terminal nor as non terminal, " +
						"it's treated as a terminal", name));
			} else {
				Grammar.LOG.fine(() -> String.format("Treat '%s' as a terminal", name));
			}
		}
		return new Terminal(name);
	}
}

package lltools.transform;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import lltools.Config;
import lltools.grammar.Grammar;
import lltools.grammar.NonTerminal;

/**
 * Creates new non terminals for a single transformation of a grammar.
 *
 * The names are the base name followed by one or more prime marks (A', A'', …). For each base name the
 * number of the last used prime marks is stored, names of the grammar and already created names are
 * skipped.
 */
public class NonTerminalNameGenerator {

	private final Set<String> usedNames;
	private final Set<String> createdNames = new LinkedHashSet<>();
	private final String primeMark;
	/**
	 * For each base name the number of prime marks of the last created non terminal
	 */
	private final Map<String, Integer> currentNumForNonTerminal = new HashMap<>();

	public NonTerminalNameGenerator(Grammar grammar) {
		this(grammar, Config.primeMark());
	}

	public NonTerminalNameGenerator(Grammar grammar, String primeMark) {
		if (primeMark.isEmpty()){
			throw new IllegalArgumentException("The prime mark can't be empty");
		}
		this.usedNames = new HashSet<>(grammar.names());
		this.usedNames.add(grammar.eof.name);
		this.primeMark = primeMark;
	}

	/**
	 * Creates a new non terminal. It's name starts with the passed non terminals name.
	 *
	 * @param base non terminal the new one is derived from
	 * @return new non terminal whose name isn't used in the grammar
	 */
	public NonTerminal createNewNonTerminal(NonTerminal base){
		return new NonTerminal(createNewName(base.name));
	}

	public String createNewName(String base){
		int newNumber = currentNumForNonTerminal.getOrDefault(base, 0) + 1;
		String name = base + primeMark.repeat(newNumber);
		while (usedNames.contains(name)){
			newNumber++;
			name = base + primeMark.repeat(newNumber);
		}
		currentNumForNonTerminal.put(base, newNumber);
		usedNames.add(name);
		createdNames.add(name);
		return name;
	}

	/**
	 * Names created by this generator, in creation order
	 */
	public Set<String> getCreatedNames(){
		return Collections.unmodifiableSet(createdNames);
	}
}

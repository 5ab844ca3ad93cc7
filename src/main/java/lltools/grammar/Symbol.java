package lltools.grammar;

import java.io.Serializable;

/**
 * Base class for terminal symbols, non terminal symbols and epsilon.
 *
 * The kind of a symbol is fixed when it is created, two symbols are equal if they are of the same kind
 * and have the same name.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	public enum Kind {
		TERMINAL, NONTERMINAL, EPSILON
	}

	/**
	 * Name of the symbol, as it appears in the grammar
	 */
	public final String name;

	protected Symbol(String name) {
		this.name = name;
	}

	public abstract Kind kind();

	@Override
	public int hashCode() {
		return kind().hashCode() * 31 + name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == this.getClass() && ((Symbol)obj).name.equals(name);
	}

	@Override
	public int compareTo(Symbol o) {
		int cmp = name.compareTo(o.name);
		if (cmp != 0){
			return cmp;
		}
		return kind().compareTo(o.kind());
	}

	@Override
	public String toString() {
		return name;
	}
}

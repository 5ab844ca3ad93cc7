package lltools.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A grammar production (one alternative of a non terminal) with a left and a right hand side.
 */
public class Production implements Serializable {

	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production. Doesn't include any epsilon if the right hand side consists of more than
	 * epsilons and consists of exactly one epsilon otherwise.
	 */
	public final List<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final List<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final List<Terminal> terminals;

	/**
	 * @param left left hand side
	 * @param right right hand side, might be empty
	 * @param epsilon epsilon used if the right hand side contains no other symbols
	 */
	public Production(NonTerminal left, List<? extends Symbol> right, Epsilon epsilon) {
		this.left = left;
		List<Symbol> r = new ArrayList<>();
		Epsilon eps = epsilon;
		for (Symbol sym : right){
			if (!(sym instanceof Epsilon)){
				r.add(sym);
			} else {
				eps = (Epsilon)sym;
			}
		}
		if (r.isEmpty()){
			r.add(eps);
		}
		this.right = Collections.unmodifiableList(r);
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : r) {
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			} else if (symbol instanceof Terminal){
				terminals.add((Terminal) symbol);
			}
		}
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.terminals = Collections.unmodifiableList(terminals);
	}

	public String formatRightSide(){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left.toString() + " -> " + formatRightSide();
	}

	/**
	 * Is this the epsilon alternative?
	 */
	public boolean isEpsilonProduction(){
		return right.get(0) instanceof Epsilon;
	}

	/**
	 * Symbols of the right hand side without the epsilon of an epsilon production.
	 */
	public List<Symbol> symbols(){
		return isEpsilonProduction() ? Collections.emptyList() : right;
	}

	/**
	 * Does the right hand side begin with the passed symbol?
	 */
	public boolean startsWith(Symbol symbol){
		return !isEpsilonProduction() && right.get(0).equals(symbol);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return left.hashCode() * 31 + right.hashCode();
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return isEpsilonProduction() ? 0 : this.right.size();
	}
}

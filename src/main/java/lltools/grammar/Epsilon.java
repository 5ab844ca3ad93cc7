package lltools.grammar;

/**
 * The empty word. All epsilon symbols are equal, regardless of the name used to print them.
 */
public class Epsilon extends TerminalOrEpsilon {

	public Epsilon(String name) {
		super(name);
	}

	@Override
	public Kind kind() {
		return Kind.EPSILON;
	}

	@Override
	public int hashCode() {
		return 0;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Epsilon;
	}

	@Override
	public int compareTo(Symbol o) {
		if (o instanceof Epsilon){
			return 0;
		}
		return super.compareTo(o);
	}
}

package lltools.transform;

import lltools.grammar.Grammar;

/**
 * A rewrite of a grammar into an equivalent grammar. The passed grammar is never modified.
 */
public interface GrammarTransformation {

	Grammar apply(Grammar grammar);

	/**
	 * Applies this transformation and then the passed one
	 */
	default GrammarTransformation andThen(GrammarTransformation next){
		return grammar -> next.apply(apply(grammar));
	}
}

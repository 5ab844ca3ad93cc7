package lltools;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import lltools.analysis.FirstSets;
import lltools.analysis.FollowSets;
import lltools.grammar.Grammar;
import lltools.grammar.GrammarBuilder;
import lltools.grammar.GrammarPrinter;
import lltools.grammar.GrammarReader;
import lltools.transform.LeftFactorer;
import lltools.transform.LeftRecursionEliminator;

/**
 * Prints the first and follow sets of a grammar and the grammar after removing left recursion and
 * left factoring.
 *
 * Usage: <pre>lltools [--demo-grammar | GRAMMAR_FILE]</pre>
 */
public class Main {

	public static void main(String[] args) {
		// ε has to be printed independently of the platform charset
		PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
		PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
		try {
			Grammar grammar;
			if (args.length == 0 || args[0].equals("--demo-grammar")){
				grammar = demoGrammar();
			} else if (args[0].equals("--help") || args[0].equals("-h")){
				out.println("Usage: lltools [--demo-grammar | GRAMMAR_FILE]");
				return;
			} else {
				grammar = new GrammarReader().read(Paths.get(args[0]));
			}
			process(grammar, out);
			out.flush();
		} catch (LLToolsException | IOException e) {
			err.println("Error: " + e.getMessage());
			System.exit(1);
		}
	}

	/**
	 * The statement and expression grammar of the small example language
	 */
	public static Grammar demoGrammar(){
		return new GrammarBuilder()
				.nonTerminals("S", "ST", "E", "T", "F")
				.terminals("+", "-", "*", "/", "(", ")", "id", ";", "int", "=", "print")
				.rule("S", "ST")
				.rule("ST", "int id ; | id = E ; | print ( E ) ; | ST ST")
				.rule("E", "E + T | E - T | T")
				.rule("T", "T * F | T / F | F")
				.rule("F", "( E ) | id")
				.toGrammar("S");
	}

	/**
	 * Runs the whole pipeline on the grammar and prints every step
	 */
	public static void process(Grammar grammar, PrintStream out){
		GrammarPrinter printer = new GrammarPrinter();
		out.print(printer.print(grammar, "Original Grammar"));
		FirstSets first = FirstSets.calculate(grammar);
		out.println();
		out.println("FIRST sets:");
		out.print(printer.printSets("FIRST", grammar, first.asMap()));
		FollowSets follow = FollowSets.calculate(grammar, first);
		out.println();
		out.println("FOLLOW sets:");
		out.print(printer.printSets("FOLLOW", grammar, follow.asMap()));
		Grammar withoutLeftRecursion = new LeftRecursionEliminator().eliminate(grammar);
		out.println();
		out.print(printer.print(withoutLeftRecursion, "After Left Recursion Elimination"));
		Grammar factored = new LeftFactorer().factor(withoutLeftRecursion);
		out.println();
		out.print(printer.print(factored, "After Left Factoring"));
	}
}

package de.synchrolib.datastructure.encoding;

import net.automatalib.automata.fsa.MutableDFA;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.util.automata.builders.AutomatonBuilders;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;

/**
 * A three-state automaton with sink {@code s0}, encoded as {@code 0 0 0 1 2 0}.
 */
public final class SinkAutomatonExample {

    public static final String ENCODING = "0 0 0 1 2 0";

    private SinkAutomatonExample() {
        // prevent instantiation
    }

    public static CompactDFA<Integer> constructMachine() {
        return constructMachine(new CompactDFA<>(createInputAlphabet()));
    }

    public static <A extends MutableDFA<S, ? super Integer>, S> A constructMachine(A machine) {

        // @formatter:off
        return AutomatonBuilders.forDFA(machine)
            .withInitial("s0")
            .from("s0")
                .on(0).to("s0")
                .on(1).to("s0")
            .from("s1")
                .on(0).to("s0")
                .on(1).to("s1")
            .from("s2")
                .on(0).to("s2")
                .on(1).to("s0")
            .withAccepting("s0")
            .create();
        // @formatter:on
    }

    public static Alphabet<Integer> createInputAlphabet() {
        return Alphabets.integers(0, 1);
    }
}

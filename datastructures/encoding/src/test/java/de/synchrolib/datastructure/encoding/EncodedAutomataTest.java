package de.synchrolib.datastructure.encoding;

import de.synchrolib.api.EncodedAutomaton;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.util.automata.Automata;
import net.automatalib.words.Alphabet;
import org.testng.Assert;
import org.testng.annotations.Test;

public class EncodedAutomataTest {

    @Test
    public void toDFAKeepsTransitionStructure() {
        EncodedAutomaton automaton = EncodedAutomaton.parse(3, 2, SinkAutomatonExample.ENCODING);
        CompactDFA<Integer> dfa = EncodedAutomata.toDFA(automaton);

        Assert.assertEquals(dfa.size(), 3);
        Assert.assertEquals(dfa.getInputAlphabet().size(), 2);
        Assert.assertEquals(dfa.getInitialState(), Integer.valueOf(0));
        Assert.assertTrue(dfa.isAccepting(0));
        Assert.assertFalse(dfa.isAccepting(1));
        Assert.assertFalse(dfa.isAccepting(2));

        for (int s = 0; s < 3; s++) {
            for (int a = 0; a < 2; a++) {
                Integer succ = dfa.getSuccessor(s, a);
                Assert.assertNotNull(succ);
                Assert.assertEquals(succ.intValue(), automaton.getSuccessor(s, a));
            }
        }
    }

    @Test
    public void toDFAMatchesBuiltMachine() {
        EncodedAutomaton automaton = EncodedAutomaton.parse(3, 2, SinkAutomatonExample.ENCODING);
        CompactDFA<Integer> expected = SinkAutomatonExample.constructMachine();
        Alphabet<Integer> alphabet = SinkAutomatonExample.createInputAlphabet();

        Assert.assertTrue(Automata.testEquivalence(expected, EncodedAutomata.toDFA(automaton), alphabet));
    }

    @Test
    public void fromDFAUsesStateIds() {
        CompactDFA<Integer> dfa = SinkAutomatonExample.constructMachine();
        EncodedAutomaton encoded = EncodedAutomata.fromDFA(dfa, SinkAutomatonExample.createInputAlphabet());

        Assert.assertEquals(encoded.serialize(), SinkAutomatonExample.ENCODING);
    }

    @Test
    public void roundTrip() {
        EncodedAutomaton automaton = EncodedAutomaton.parse(4, 2, "0 0 0 2 1 3 2 0");
        CompactDFA<Integer> dfa = EncodedAutomata.toDFA(automaton);

        Assert.assertEquals(EncodedAutomata.fromDFA(dfa, dfa.getInputAlphabet()), automaton);
    }

    @Test
    public void customNumbering() {
        CompactDFA<Integer> dfa = SinkAutomatonExample.constructMachine();
        // swap s1 and s2
        EncodedAutomaton encoded = EncodedAutomata.fromDFA(dfa, dfa.getInputAlphabet(), s -> s == 0 ? 0 : 3 - s);

        Assert.assertEquals(encoded.serialize(), "0 0 1 0 0 2");
    }

    @Test
    public void incompleteDFAIsRejected() {
        CompactDFA<Integer> dfa = new CompactDFA<>(SinkAutomatonExample.createInputAlphabet());
        dfa.addInitialState(true);
        dfa.setTransition(0, 0, 0);

        Assert.assertThrows(IllegalArgumentException.class,
                            () -> EncodedAutomata.fromDFA(dfa, dfa.getInputAlphabet()));
    }
}

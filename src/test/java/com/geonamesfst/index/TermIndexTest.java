package com.geonamesfst.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.geonamesfst.automaton.PrefixAutomaton;
import com.geonamesfst.automaton.TermAutomaton;
import com.geonamesfst.ingest.TermPair;
import com.geonamesfst.query.MatchType;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TermIndexTest {

    private TermIndex index;

    @BeforeEach
    void setUp() throws IOException {
        index = TermIndexBuilder.build(List.of(
                new TermPair("Frankfurt", new MatchType.Name(1)),
                new TermPair("Frankfurt am Main", new MatchType.PreferredName(1, "de")),
                new TermPair("Frankfurt (Oder)", new MatchType.Name(2)),
                new TermPair("Frank", new MatchType.Alternate(1, "")),
                new TermPair("Köln", new MatchType.Name(3)),
                new TermPair("Koln", new MatchType.AsciiName(3))));
    }

    @Test
    void testLookupHitAndMiss() {
        int ordinal = index.lookup("Frankfurt");

        assertTrue(ordinal >= 0);
        assertEquals(List.of(new MatchType.Name(1)), index.group(ordinal));
        assertEquals(-1, index.lookup("Frankfur"));
        assertEquals(-1, index.lookup("Frankfurt am"));
        assertEquals(-1, index.lookup(""));
    }

    @Test
    void testPrefixSearchVisitsKeysInByteOrder() {
        List<String> keys = collect(new PrefixAutomaton("Frank"));

        assertEquals(List.of("Frank", "Frankfurt", "Frankfurt (Oder)", "Frankfurt am Main"), keys);
    }

    @Test
    void testSearchReportsMatchingOrdinals() {
        List<Integer> ordinals = new ArrayList<>();
        index.search(new PrefixAutomaton("K"), (key, ordinal) -> ordinals.add(ordinal));

        assertEquals(List.of(index.lookup("Koln"), index.lookup("Köln")), ordinals);
    }

    @Test
    void testAcceptAllVisitsEveryKey() {
        List<String> keys = collect(new AcceptAll());

        assertEquals(index.termCount(), keys.size());
        assertEquals("Frank", keys.get(0));
        assertEquals("Köln", keys.get(keys.size() - 1));
    }

    @Test
    void testPrunedBranchesAreNotVisited() {
        CountingPrefix automaton = new CountingPrefix("Z");

        assertTrue(collect(automaton).isEmpty());
        // 只对根节点的出边调用 step
        assertTrue(automaton.steps <= 2);
    }

    @Test
    void testStatsAccessors() {
        assertEquals(6, index.termCount());
        assertTrue(index.fstBytes() > 0);
    }

    private List<String> collect(TermAutomaton<?> automaton) {
        List<String> keys = new ArrayList<>();
        searchInto(automaton, keys);
        return keys;
    }

    private <S> void searchInto(TermAutomaton<S> automaton, List<String> keys) {
        index.search(automaton, (key, ordinal) -> keys.add(key));
    }

    private static final class AcceptAll implements TermAutomaton<Integer> {
        @Override
        public Integer start() {
            return 0;
        }

        @Override
        public Integer step(Integer state, int label) {
            return state + 1;
        }

        @Override
        public boolean isMatch(Integer state) {
            return true;
        }
    }

    private static final class CountingPrefix implements TermAutomaton<Integer> {
        private final PrefixAutomaton delegate;
        private int steps;

        private CountingPrefix(String prefix) {
            this.delegate = new PrefixAutomaton(prefix);
        }

        @Override
        public Integer start() {
            return delegate.start();
        }

        @Override
        public Integer step(Integer state, int label) {
            steps++;
            return delegate.step(state, label);
        }

        @Override
        public boolean isMatch(Integer state) {
            return delegate.isMatch(state);
        }

        @Override
        public boolean canMatch(Integer state) {
            return delegate.canMatch(state);
        }
    }
}

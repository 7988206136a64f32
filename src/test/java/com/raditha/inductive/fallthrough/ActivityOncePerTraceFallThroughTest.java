package com.raditha.inductive.fallthrough;

import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ActivityOncePerTraceFallThroughTest {

    private final ActivityOncePerTraceFallThrough fallThrough = new ActivityOncePerTraceFallThrough();

    @Test
    void testActivityOnceInEveryTrace() {
        VariantLog log = VariantLog.builder().add("a", "b").add("b", "a", "b").build();

        CutResult<VariantLog> result = fallThrough.apply(log).orElseThrow();

        assertEquals(Operator.CONCURRENT, result.operator());
        assertEquals(2, result.children().get(0).multiplicity(List.of("a")));
        VariantLog rest = result.children().get(1);
        assertEquals(Set.of("b"), rest.alphabet());
        assertEquals(1, rest.multiplicity(List.of("b")));
        assertEquals(1, rest.multiplicity(List.of("b", "b")));
    }

    @Test
    void testFirstCandidateInLabelOrder() {
        VariantLog log = VariantLog.builder().add("c", "b", "c", "a").add("a", "b").build();

        CutResult<VariantLog> result = fallThrough.apply(log).orElseThrow();

        assertEquals(Set.of("a"), result.children().get(0).alphabet());
    }

    @Test
    void testNoActivityOncePerTrace() {
        VariantLog log = VariantLog.builder().add("a", "a", "b").add("b", "b", "a").build();
        assertTrue(fallThrough.apply(log).isEmpty());
        assertTrue(fallThrough.apply(VariantLog.builder().add("a").build()).isEmpty());
    }
}

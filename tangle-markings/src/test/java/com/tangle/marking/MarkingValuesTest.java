package com.tangle.marking;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MarkingValuesTest {

    @Test
    void combineAll_visibleIsLogicalOr() {
        assertEquals(false, MarkingValues.combineAll(MarkingKind.VISIBLE, List.of()));
        assertEquals(false, MarkingValues.combineAll(MarkingKind.VISIBLE, List.of(false, false)));
        assertEquals(true, MarkingValues.combineAll(MarkingKind.VISIBLE, List.of(false, true, false)));
    }

    @Test
    void combineAll_breaksIsUnion() {
        Object result = MarkingValues.combineAll(MarkingKind.BREAKS, List.of(
                EnumSet.of(BreakType.EXCEPT),
                EnumSet.noneOf(BreakType.class),
                EnumSet.of(BreakType.RETURN, BreakType.EXCEPT)));
        assertEquals(EnumSet.of(BreakType.EXCEPT, BreakType.RETURN), result);
    }

    @Test
    void combine_readsLaterScopeWins() {
        Object result = MarkingValues.combine(MarkingKind.READS,
                Map.of("x", ScopeClass.LOCAL, "y", ScopeClass.LOCAL),
                Map.of("x", ScopeClass.GLOBAL));
        assertEquals(Map.of("x", ScopeClass.GLOBAL, "y", ScopeClass.LOCAL), result);
    }

    @Test
    void combine_indirectIsCommutativeAndIdempotent() {
        IndirectKey k = new IndirectKey("v", ScopeClass.FREE);
        List<IndirectAccess> flags = List.of(
                new IndirectAccess(true, false), new IndirectAccess(false, false),
                new IndirectAccess(null, true), new IndirectAccess(null, null), new IndirectAccess(false, null));
        for (IndirectAccess a : flags) {
            Map<IndirectKey, IndirectAccess> ma = Map.of(k, a);
            assertEquals(ma, MarkingValues.combine(MarkingKind.INDIRECT_RW, ma, ma));
            for (IndirectAccess b : flags) {
                Map<IndirectKey, IndirectAccess> mb = Map.of(k, b);
                assertEquals(MarkingValues.combine(MarkingKind.INDIRECT_RW, ma, mb),
                        MarkingValues.combine(MarkingKind.INDIRECT_RW, mb, ma));
            }
        }
    }

    @Test
    void combine_indirectKleeneOr() {
        IndirectKey k = new IndirectKey("v", ScopeClass.NONLOCAL);
        Object r = MarkingValues.combine(MarkingKind.INDIRECT_RW,
                Map.of(k, new IndirectAccess(null, false)), Map.of(k, new IndirectAccess(false, true)));
        assertEquals(Map.of(k, new IndirectAccess(null, true)), r);
    }

    @Test
    void anyOfMerge_disagreeingScopesBecomeUnknown() {
        Object r = MarkingValues.anyOfMerge(MarkingKind.WRITES,
                Map.of("x", ScopeClass.LOCAL, "y", ScopeClass.GLOBAL),
                Map.of("x", ScopeClass.GLOBAL, "y", ScopeClass.GLOBAL, "z", ScopeClass.LOCAL));
        assertEquals(Map.of("x", ScopeClass.UNKNOWN, "y", ScopeClass.GLOBAL, "z", ScopeClass.LOCAL), r);
        assertEquals(true, MarkingValues.anyOfMerge(MarkingKind.VISIBLE, false, true));
    }

    @Test
    void combine_doesNotModifyInputs() {
        Set<BreakType> first = EnumSet.of(BreakType.EXCEPT);
        MarkingValues.combine(MarkingKind.BREAKS, first, EnumSet.of(BreakType.YIELD));
        assertEquals(EnumSet.of(BreakType.EXCEPT), first);
    }

    @Test
    void defaults_visibleTrueOthersEmpty() {
        assertEquals(true, MarkingValues.defaultValue(MarkingKind.VISIBLE));
        assertEquals(Set.of(), MarkingValues.defaultValue(MarkingKind.BREAKS));
        assertEquals(Map.of(), MarkingValues.defaultValue(MarkingKind.SCOPE));
    }

    @Test
    void kindFromValue_acceptsTagsRejectsUnknown() {
        assertEquals(MarkingKind.INDIRECT_RW, MarkingKind.fromValue("indirectrw"));
        assertEquals(MarkingKind.INDIRECT_RW, MarkingKind.fromValue("INDIRECT_RW"));
        assertThrows(IllegalArgumentException.class, () -> MarkingKind.fromValue("colour"));
    }
}

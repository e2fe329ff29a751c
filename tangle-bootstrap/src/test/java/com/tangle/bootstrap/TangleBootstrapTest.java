package com.tangle.bootstrap;

import com.tangle.branch.Brancher;
import com.tangle.config.TangleConfig;
import com.tangle.marking.BreakType;
import com.tangle.marking.MarkingKind;
import com.tangle.marking.MarkingStore;
import com.tangle.reorder.Reorderer;
import com.tangle.resolution.ResolutionEngine;
import com.tangle.resolution.ResolutionOutcome;
import com.tangle.resolution.StrategyType;
import com.tangle.tree.node.NodeArena;
import com.tangle.tree.node.NodeKind;
import com.tangle.tree.node.TreeNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TangleBootstrapTest {

    private final NodeArena arena = new NodeArena();
    private final MarkingStore store = new MarkingStore(arena);

    @Test
    void defaultsWireDefaultRulesAndAllValuers() {
        BootstrapContext ctx = TangleBootstrap.initialize(TangleConfig.builder().build());

        assertEquals(List.of(StrategyType.EXISTING, StrategyType.COMPUTED), ctx.getResolutionOrder());
        assertEquals(List.of("wrange", "rwrange", "rwlogrange", "knots", "random", "first"),
                List.copyOf(ctx.getValuers().names()));
        assertEquals(0, ctx.getBranchers().size());

        TreeNode pass = arena.node(NodeKind.PASS);
        ResolutionOutcome outcome = ctx.resolutionEngine(store).resolve(pass, "breaks");
        assertTrue(outcome.isCommitted());
        assertTrue(outcome.getMarkings().breaks().isEmpty());
        assertTrue(store.isMarked(pass, MarkingKind.BREAKS));
    }

    @Test
    void engineFollowsConfiguredOrderAndWriteBack() {
        BootstrapContext ctx = TangleBootstrap.initialize(TangleConfig.builder()
                .resolutionOrder(List.of("calc"))
                .writeBack(false)
                .build());

        ResolutionEngine engine = ctx.resolutionEngine(store);
        TreeNode pass = arena.node(NodeKind.PASS);
        engine.resolve(pass, "breaks");

        assertEquals(List.of(StrategyType.COMPUTED), engine.getOrder().subList(0, 1));
        assertFalse(engine.isWriteBack());
        assertFalse(store.isMarked(pass, MarkingKind.BREAKS));
    }

    @Test
    void invalidOrderRejected() {
        TangleConfig twice = TangleConfig.builder().resolutionOrder(List.of("existing", "mark")).build();
        TangleConfig unknown = TangleConfig.builder().resolutionOrder(List.of("guess")).build();

        assertThrows(IllegalArgumentException.class, () -> TangleBootstrap.initialize(twice));
        assertThrows(IllegalArgumentException.class, () -> TangleBootstrap.initialize(unknown));
    }

    @Test
    void rulesFileOverridesDefaultTable(@TempDir Path dir) throws IOException {
        Path rules = dir.resolve("rules.json");
        Files.writeString(rules, "{\"Pass\": {\"addBreaks\": [\"yield\"]}}");
        BootstrapContext ctx = TangleBootstrap.initialize(TangleConfig.builder().rulesFile(rules.toString()).build());

        ResolutionOutcome outcome = ctx.resolutionEngine(store).resolve(arena.node(NodeKind.PASS), "breaks");

        assertEquals(EnumSet.of(BreakType.YIELD), outcome.getMarkings().breaks());
        assertTrue(ctx.getRules().contains(NodeKind.RETURN));
    }

    @Test
    void missingRulesFileFailsBootstrap(@TempDir Path dir) {
        TangleConfig config = TangleConfig.builder().rulesFile(dir.resolve("absent.json").toString()).build();

        assertThrows(UncheckedIOException.class, () -> TangleBootstrap.initialize(config));
    }

    @Test
    void reordererUsesConfiguredLimitsAndSafety() {
        BootstrapContext ctx = TangleBootstrap.initialize(TangleConfig.builder()
                .permutationLimit(7)
                .safetyChecks(true)
                .build());
        List<TreeNode> statements = List.of(arena.node(NodeKind.PASS), arena.node(NodeKind.PASS));

        Reorderer reorderer = ctx.reorderer(store, statements);

        assertEquals(7L, reorderer.getLimits().maxPermutations());
        assertTrue(reorderer.isSafetyChecks());
        assertTrue(ctx.randomReorderer(store, statements).isSafetyChecks());
    }

    @Test
    void seededRandomIsReproducible() {
        TangleConfig config = TangleConfig.builder().randomSeed(99L).build();

        int a = TangleBootstrap.initialize(config).getRandom().nextInt();
        int b = TangleBootstrap.initialize(config).getRandom().nextInt();

        assertEquals(a, b);
    }

    @Test
    void newBrancherIsRegisteredOnce() {
        BootstrapContext ctx = TangleBootstrap.initialize(TangleConfig.builder().build());

        Brancher brancher = ctx.newBrancher("files", store);

        assertSame(brancher, ctx.getBranchers().get("files").orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> ctx.newBrancher("files", store));
    }
}

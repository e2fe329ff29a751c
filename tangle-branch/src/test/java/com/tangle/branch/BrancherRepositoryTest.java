package com.tangle.branch;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrancherRepositoryTest {

    private final BranchFixtures fx = new BranchFixtures();

    @Test
    void addRejectsDuplicateNames() {
        BrancherRepository repo = new BrancherRepository();
        Brancher first = new Brancher("files", fx.store, new Random(1));
        repo.add(first);

        assertThrows(IllegalArgumentException.class, () -> repo.add(new Brancher("files", fx.store, new Random(2))));
        assertSame(first, repo.get("files").orElseThrow());
    }

    @Test
    void putReplacesAndRemoveForgets() {
        BrancherRepository repo = new BrancherRepository();
        repo.add(new Brancher("a", fx.store, new Random(1)));
        repo.add(new Brancher("b", fx.store, new Random(1)));
        Brancher replacement = new Brancher("a", fx.store, new Random(3));

        repo.put(replacement);

        assertSame(replacement, repo.get("a").orElseThrow());
        assertEquals(List.of("a", "b"), List.copyOf(repo.names()));
        assertTrue(repo.remove("b"));
        assertFalse(repo.remove("b"));
        assertTrue(repo.get("b").isEmpty());
        assertEquals(1, repo.size());
    }

    @Test
    void blankBrancherNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Brancher(" ", fx.store, new Random()));
    }
}

package org.tictactoe.mcts.model;

import org.junit.jupiter.api.Test;
import org.tictactoe.game.GameState;
import org.tictactoe.game.IllegalMoveException;
import org.tictactoe.game.Move;
import org.tictactoe.game.TicTacToeModel;
import org.tictactoe.game.Turn;
import org.tictactoe.mcts.model.strategy.PoolOfStrategies;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchTreeTest {

    private final TicTacToeModel model = new TicTacToeModel();

    private SearchTree newTree(GameState state) {
        return new SearchTree(model, state, new PoolOfStrategies(new Random(42)));
    }

    @Test
    void shouldCountOneSimulationPerIterationAtRoot() {
        SearchTree tree = newTree(GameState.empty(Turn.X));

        for (int i = 0; i < 500; i++) {
            tree.grow();
        }

        assertEquals(500, tree.getRoot().getStatistics().getNumVisits());
        assertEquals(9, tree.getRoot().getChildren().size());
    }

    @Test
    void shouldKeepVisitCountsConsistentWithChildren() {
        SearchTree tree = newTree(GameState.empty(Turn.X));
        for (int i = 0; i < 3000; i++) {
            tree.grow();
        }

        SearchTreeNode root = tree.getRoot();
        assertEquals(root.getStatistics().getNumVisits(), sumOfChildVisits(root));
        for (SearchTreeNode child : root.getChildren()) {
            assertSubtreeConsistent(child);
        }
    }

    // Below the root, a node is played out once on its own before it gets expanded.
    private static void assertSubtreeConsistent(SearchTreeNode node) {
        NodeStatistics statistics = node.getStatistics();
        assertTrue(statistics.getWins() >= 0 && statistics.getWins() <= statistics.getNumVisits(), node.toString());
        if (node.hasChildren()) {
            assertEquals(statistics.getNumVisits(), sumOfChildVisits(node) + 1, node.toString());
            for (SearchTreeNode child : node.getChildren()) {
                assertSame(node, child.getParent());
                assertSubtreeConsistent(child);
            }
        }
    }

    private static int sumOfChildVisits(SearchTreeNode node) {
        return node.getChildren().stream().mapToInt(c -> c.getStatistics().getNumVisits()).sum();
    }

    @Test
    void shouldPlayOutTerminalRootWithoutChildren() {
        SearchTree tree = newTree(GameState.parse(Turn.O,
            "XOX",
            "XOO",
            "OXX"));

        tree.grow();
        tree.grow();

        SearchTreeNode root = tree.getRoot();
        assertTrue(root.isExpanded());
        assertFalse(root.hasChildren());
        assertEquals(2, root.getStatistics().getNumVisits());
        assertEquals(1.0, root.getStatistics().getWins());
        assertTrue(tree.isComplete());
    }

    @Test
    void shouldExpandRootLazilyWhenChoosingMove() {
        SearchTree tree = newTree(GameState.empty(Turn.X));

        Move move = tree.getBestMove();

        assertEquals(new Move(0, 0), move);
        assertEquals(9, tree.getRoot().getChildren().size());
        assertEquals(0, tree.getRoot().getStatistics().getNumVisits());
    }

    @Test
    void shouldKeepStatisticsOfPlayedSubtree() {
        SearchTree tree = newTree(GameState.empty(Turn.X));
        for (int i = 0; i < 2000; i++) {
            tree.grow();
        }
        SearchTreeNode center = tree.getRoot().getChild(
            model.getNextState(tree.getRoot().getState(), new Move(1, 1)));
        int visits = center.getStatistics().getNumVisits();
        double wins = center.getStatistics().getWins();

        tree.advance(new Move(1, 1));

        assertSame(center, tree.getRoot());
        assertTrue(center.isRoot());
        assertEquals(visits, tree.getRoot().getStatistics().getNumVisits());
        assertEquals(wins, tree.getRoot().getStatistics().getWins());
    }

    @Test
    void shouldStartFreshRootForUnexploredMove() {
        SearchTree tree = newTree(GameState.empty(Turn.X));

        tree.advance(new Move(2, 0));

        SearchTreeNode root = tree.getRoot();
        assertTrue(root.isRoot());
        assertFalse(root.isExpanded());
        assertNull(root.getChildren());
        assertEquals(0, root.getStatistics().getNumVisits());
        assertEquals(GameState.parse(Turn.O, "...", "...", "X.."), root.getState());
        assertEquals(new Move(2, 0), root.getPrecedingMove());
    }

    @Test
    void shouldRejectIllegalAdvanceWithoutChangingRoot() {
        SearchTree tree = newTree(GameState.parse(Turn.O, "X..", "...", "..."));
        SearchTreeNode root = tree.getRoot();

        assertThrows(IllegalMoveException.class, () -> tree.advance(new Move(0, 0)));
        assertThrows(IllegalMoveException.class, () -> tree.advance(new Move(5, 5)));
        assertSame(root, tree.getRoot());
    }

    @Test
    void shouldContinueSearchAfterAdvance() {
        SearchTree tree = newTree(GameState.empty(Turn.X));
        for (int i = 0; i < 200; i++) {
            tree.grow();
        }
        tree.advance(new Move(0, 0));
        int before = tree.getRoot().getStatistics().getNumVisits();

        for (int i = 0; i < 100; i++) {
            tree.grow();
        }

        assertEquals(before + 100, tree.getRoot().getStatistics().getNumVisits());
        assertNotNull(tree.getBestMove());
    }
}

package org.tictactoe.mcts.model.strategy;

import org.junit.jupiter.api.Test;
import org.tictactoe.game.GameState;
import org.tictactoe.game.Move;
import org.tictactoe.game.TicTacToeModel;
import org.tictactoe.game.Turn;
import org.tictactoe.mcts.model.SearchTree;
import org.tictactoe.mcts.model.SearchTreeNode;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BackPropagationStrategyTest {

    @Test
    void shouldAddSameScoreAlongWholePath() {
        SearchTree tree = new SearchTree(new TicTacToeModel(), GameState.empty(Turn.X),
            new PoolOfStrategies(new Random(1)));
        SearchTreeNode root = tree.getRoot();
        root.markExpanded();
        SearchTreeNode child = root.createChild(new Move(1, 1));
        child.markExpanded();
        SearchTreeNode grandChild = child.createChild(new Move(0, 0));
        SearchTreeNode sibling = root.createChild(new Move(2, 2));

        BackPropagationStrategy backPropagation = new BackPropagationStrategy();
        backPropagation.execute(grandChild, 1.0);
        backPropagation.execute(child, 0.5);

        assertEquals(1, grandChild.getStatistics().getNumVisits());
        assertEquals(1.0, grandChild.getStatistics().getWins());
        assertEquals(2, child.getStatistics().getNumVisits());
        assertEquals(1.5, child.getStatistics().getWins());
        assertEquals(2, root.getStatistics().getNumVisits());
        assertEquals(1.5, root.getStatistics().getWins());
        assertEquals(0, sibling.getStatistics().getNumVisits());
    }
}

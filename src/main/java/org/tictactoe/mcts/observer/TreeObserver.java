package org.tictactoe.mcts.observer;

import com.google.gson.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tictactoe.game.GameState;
import org.tictactoe.mcts.event.TreeEvent;
import org.tictactoe.mcts.event.TreeStartEvent;
import org.tictactoe.mcts.model.SearchTree;
import org.tictactoe.mcts.model.SearchTreeNode;
import org.tictactoe.util.observer.Event;
import org.tictactoe.util.observer.Observer;

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps a JSON snapshot of the search tree for every turn of the current game.
 */
public class TreeObserver implements Observer {

    private static final Logger LOGGER = LogManager.getLogger();

    public static final int DEFAULT_MAX_DEPTH = 2;

    private final Gson gson;
    private final Map<Integer, String> snapshots = new LinkedHashMap<>();

    public TreeObserver() {
        this(DEFAULT_MAX_DEPTH);
    }

    public TreeObserver(int maxDepth) {
        gson = new GsonBuilder()
                .setPrettyPrinting()
                .registerTypeAdapter(GameState.class, new GameStateSerializer())
                .registerTypeAdapter(SearchTree.class, new SearchTreeSerializer(maxDepth))
                .create();
    }

    @Override
    public void observe(Event event) {
        if (event instanceof TreeStartEvent) {

            // Новая партия
            snapshots.clear();

        } else if (event instanceof TreeEvent) {

            TreeEvent treeEvent = ((TreeEvent) event);
            String json = toJson(treeEvent.getTree());
            snapshots.put(treeEvent.getTurnNumber(), json);
            LOGGER.debug("Tree at turn " + treeEvent.getTurnNumber() + ":\n" + json);

        }
    }

    public String toJson(SearchTree tree) {
        return gson.toJson(tree);
    }

    public Map<Integer, String> getSnapshots() {
        return Collections.unmodifiableMap(snapshots);
    }

    static class GameStateSerializer implements JsonSerializer<GameState> {
        @Override
        public JsonElement serialize(GameState src, Type typeOfSrc, JsonSerializationContext context) {
            JsonObject result = new JsonObject();
            JsonArray board = new JsonArray();
            for (String row : src.toRows()) {
                board.add(row);
            }
            result.add("board", board);
            result.addProperty("turn", src.getTurn().name());
            return result;
        }
    }

    static class SearchTreeSerializer implements JsonSerializer<SearchTree> {

        private final int maxDepth;

        SearchTreeSerializer(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        @Override
        public JsonElement serialize(SearchTree src, Type typeOfSrc, JsonSerializationContext context) {
            JsonObject result = new JsonObject();
            result.add("root", serializeNode(src.getRoot(), 0, context));
            return result;
        }

        private JsonObject serializeNode(SearchTreeNode node, int depth, JsonSerializationContext context) {
            JsonObject result = new JsonObject();
            if (node.getPrecedingMove() != null) {
                result.addProperty("move", node.getPrecedingMove().toString());
            }
            result.add("state", context.serialize(node.getState(), GameState.class));
            result.addProperty("simulations", node.getStatistics().getNumVisits());
            result.addProperty("wins", node.getStatistics().getWins());
            if (node.isExpanded()) {
                if (depth < maxDepth) {
                    JsonArray children = new JsonArray();
                    for (SearchTreeNode child : node.getChildren()) {
                        children.add(serializeNode(child, depth + 1, context));
                    }
                    result.add("children", children);
                } else {
                    result.addProperty("childCount", node.getChildren().size());
                }
            }
            return result;
        }
    }
}

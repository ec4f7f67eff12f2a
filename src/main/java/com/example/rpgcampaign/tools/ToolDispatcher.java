package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.CombatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Dispatches tool requests to their category handlers and turns failures into error results.
 */
public class ToolDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);

    private final Map<ToolDefinition.Category, ToolHandler> handlers = new EnumMap<>(ToolDefinition.Category.class);

    public void registerHandler(ToolDefinition.Category category, ToolHandler handler) {
        handlers.put(category, handler);
    }

    /**
     * Run one tool. Never throws: caller-facing failures come back as error results
     * of their kind, anything else as an untyped error result.
     */
    public ToolResult dispatch(ToolRequest request) {
        try {
            ToolDefinition def = ToolRegistry.getTool(request.getName());
            if (def == null) {
                throw CombatException.invalidArgument("Unknown tool '" + request.getName() + "'. Try 'help'.");
            }
            for (String arg : def.getRequiredArgs()) {
                request.require(arg);
            }

            ToolHandler handler = handlers.get(def.getCategory());
            if (handler == null || !handler.supports(def.getName())) {
                throw CombatException.invalidArgument("Tool '" + def.getName() + "' is not available.");
            }
            return handler.handle(request);
        } catch (CombatException e) {
            logger.debug("Tool {} rejected: {} {}", request.getName(), e.getKind(), e.getMessage());
            return ToolResult.error(e);
        } catch (RuntimeException e) {
            logger.error("Tool {} failed unexpectedly", request.getName(), e);
            return ToolResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }
}

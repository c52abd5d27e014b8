package org.gridlayout.engine.compaction;

import java.util.Map;
import org.gridlayout.engine.config.EngineLimits;

/**
 * A functional interface for creating compaction strategies.
 */
@FunctionalInterface
public interface ICompactionStrategyCreator {
    /**
     * Creates a new compaction strategy.
     * @param params The parameters for the strategy.
     * @param limits The safety caps the strategy must honor.
     * @return The created compaction strategy.
     */
    ICompactionStrategy create(Map<String, Object> params, EngineLimits limits);
}

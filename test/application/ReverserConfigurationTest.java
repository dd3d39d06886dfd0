package application;

import domain.engine.LevelExpander;
import domain.engine.SequentialLevelExpander;
import infrastructure.parallel.ParallelLevelExpander;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ForkJoinPool;

import static org.junit.jupiter.api.Assertions.*;

class ReverserConfigurationTest {

    @Test
    void defaultsMatchEngineConfiguration() {
        ReverserConfiguration config = ReverserConfiguration.defaults();
        assertEquals(ReverserConfiguration.ExpansionStrategy.PARALLEL, config.getExpansionStrategy());
        assertEquals(EngineConfiguration.DEFAULT_PARALLELISM, config.getParallelism());
        assertEquals(EngineConfiguration.LEAF_TASK_SIZE, config.getLeafTaskSize());
        assertFalse(config.isDebugMode());
    }

    @Test
    void builderAppliesEverySetting() {
        ReverserConfiguration config = new ReverserConfiguration.Builder()
            .setExpansionStrategy(ReverserConfiguration.ExpansionStrategy.SEQUENTIAL)
            .setParallelism(2)
            .setLeafTaskSize(8)
            .setDebugMode(true)
            .build();

        assertEquals(ReverserConfiguration.ExpansionStrategy.SEQUENTIAL, config.getExpansionStrategy());
        assertEquals(2, config.getParallelism());
        assertEquals(8, config.getLeafTaskSize());
        assertTrue(config.isDebugMode());
    }

    @Test
    void builderRejectsInvalidValues() {
        ReverserConfiguration.Builder builder = new ReverserConfiguration.Builder();
        assertThrows(IllegalArgumentException.class, () -> builder.setExpansionStrategy(null));
        assertThrows(IllegalArgumentException.class, () -> builder.setParallelism(0));
        assertThrows(IllegalArgumentException.class, () -> builder.setLeafTaskSize(-1));
    }

    @Test
    void factoryCreatesExpanderForStrategy() {
        ForkJoinPool pool = new ForkJoinPool(1);
        try {
            LevelExpander<Long> parallel = LevelExpanderFactory.createExpander(ReverserConfiguration.defaults(), pool);
            LevelExpander<Long> sequential = LevelExpanderFactory.createExpander(
                new ReverserConfiguration.Builder()
                    .setExpansionStrategy(ReverserConfiguration.ExpansionStrategy.SEQUENTIAL)
                    .build(),
                pool);

            assertInstanceOf(ParallelLevelExpander.class, parallel);
            assertInstanceOf(SequentialLevelExpander.class, sequential);
        } finally {
            pool.shutdown();
        }
    }
}

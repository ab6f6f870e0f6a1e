package com.scorebook.core.runtime;

import com.scorebook.config.ScorebookConfig;
import com.scorebook.core.assemble.IncompleteGameDataException;
import com.scorebook.core.model.GameFeed;
import com.scorebook.core.model.Half;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.scorebook.core.GameFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class BatchGameProcessorTest {

    private BatchGameProcessor processor;

    @BeforeEach
    void setUp() {
        // un solo lugar en la cola: el envío tiene que esperar a los workers
        processor = new BatchGameProcessor(new GamePipeline(ScorebookConfig.defaults()), 2, 1);
    }

    @AfterEach
    void tearDown() {
        processor.close();
    }

    @Test
    void failedGameDoesNotStopTheBatch() throws Exception {
        List<GameFeed> feeds = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            feeds.add(new GameFeed(metadata("ok-" + i), script().scoreless(1, 9).plays()));
        }
        feeds.add(3, new GameFeed(metadata("broken"), script().strikeouts(1, Half.TOP, HOME_STARTER, 2).plays()));

        List<BatchGameProcessor.GameResult> results = processor.processAll(feeds);

        assertEquals(7, results.size());
        for (int i = 0; i < feeds.size(); i++) {
            assertEquals(feeds.get(i).gameId(), results.get(i).gameId(), "los resultados respetan el orden de envío");
        }
        BatchGameProcessor.GameResult broken = results.get(3);
        assertFalse(broken.ok());
        assertNull(broken.game());
        assertInstanceOf(IncompleteGameDataException.class, broken.failure());
        assertTrue(results.stream().filter(r -> !r.gameId().equals("broken")).allMatch(BatchGameProcessor.GameResult::ok));

        assertEquals(6, processor.getProcessed());
        assertEquals(1, processor.getFailed());
    }

    @Test
    void sizedFromConfiguration() {
        ScorebookConfig.BatchConfig batch = new ScorebookConfig.BatchConfig();
        batch.workerThreads = 3;
        batch.queueCapacity = 5;
        try (BatchGameProcessor p = new BatchGameProcessor(new GamePipeline(ScorebookConfig.defaults()), batch)) {
            assertEquals(3, p.getWorkerThreads());
            assertEquals(5, p.getQueueCapacity());
        }
    }

    @Test
    void rejectsNonsenseSizes() {
        GamePipeline pipeline = new GamePipeline(ScorebookConfig.defaults());
        assertThrows(IllegalArgumentException.class, () -> new BatchGameProcessor(pipeline, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new BatchGameProcessor(pipeline, 1, 0));
    }
}

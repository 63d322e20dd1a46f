package com.counter.cluster;

import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckerTest
{
    private Vertx vertx;
    private WorkerExecutor worker;

    @BeforeEach
    void setUp()
    {
        vertx = Vertx.vertx();
        worker = vertx.createSharedWorkerExecutor("health-test");
    }

    @AfterEach
    void tearDown()
    {
        worker.close();
        vertx.close().toCompletionStage().toCompletableFuture().join();
    }

    // Bu test periyodik yoklamanın düşen düğümü işaretleyip geri geldiğinde kurtardığını doğrular.
    @Test
    void periodic_probe_tracks_node_health() throws InterruptedException
    {
        InMemoryStorageNode node = new InMemoryStorageNode("node-a");
        ShardRegistry registry = new ShardRegistry(List.of(node), HashFn.MD5, 10, new Retrier(1, 0), "visits:", null);
        HealthChecker checker = new HealthChecker(registry, 1, vertx, worker);
        checker.start();
        try {
            assertTrue(checker.isRunning());

            node.setOnline(false);
            assertTrue(awaitHealth(registry, false));

            node.setOnline(true);
            assertTrue(awaitHealth(registry, true));
        } finally {
            checker.close();
        }
        assertFalse(checker.isRunning());
    }

    private static boolean awaitHealth(ShardRegistry registry, boolean expected) throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            if (registry.healthSnapshot().get("node-a") == expected) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }
}

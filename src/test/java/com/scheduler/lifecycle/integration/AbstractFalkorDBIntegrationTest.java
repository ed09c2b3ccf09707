package com.scheduler.lifecycle.integration;

import com.scheduler.lifecycle.graph.FalkorDBConnection;
import org.junit.jupiter.api.Tag;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

/**
 * Base class for FalkorDB integration tests using Testcontainers.
 * Every connection gets its own graph so tests never see each other's nodes.
 */
@Tag("integration")
@Testcontainers
abstract class AbstractFalkorDBIntegrationTest {

    private static final int FALKORDB_PORT = 6379;

    @SuppressWarnings("resource")
    @Container
    static final GenericContainer<?> falkorDB = new GenericContainer<>("falkordb/falkordb:latest")
            .withExposedPorts(FALKORDB_PORT);

    protected FalkorDBConnection createConnection(String graphNamePrefix) {
        String graphName = graphNamePrefix + "-" + UUID.randomUUID().toString().substring(0, 8);
        return new FalkorDBConnection(falkorDB.getHost(), falkorDB.getMappedPort(FALKORDB_PORT), graphName);
    }
}

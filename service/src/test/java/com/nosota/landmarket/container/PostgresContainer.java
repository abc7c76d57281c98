package com.nosota.landmarket.container;

import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Single PostgreSQL container shared by the tests that need the production database.
 */
public class PostgresContainer extends PostgreSQLContainer<PostgresContainer> {

    private static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");

    private static PostgresContainer instance;

    private PostgresContainer() {
        super(DOCKER_IMAGE);
        withDatabaseName("landmarket");
        withCommand("postgres", "-c", "log_statement=all", "-c", "log_destination=stderr");
    }

    public static synchronized PostgresContainer getInstance() {
        if (instance == null) {
            instance = new PostgresContainer();
            instance.start();
        }
        return instance;
    }
}

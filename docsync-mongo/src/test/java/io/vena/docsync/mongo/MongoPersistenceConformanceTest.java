package io.vena.docsync.mongo;

import io.vena.docsync.local.AbstractPersistenceTest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.junit.jupiter.Testcontainers;

@UsesMongoService
@Testcontainers(disabledWithoutDocker = true)
class MongoPersistenceConformanceTest extends AbstractPersistenceTest {
	private static MongoService mongoService;
	private final MongoPersistenceSettings mongoSettings = MongoPersistenceSettings.builder()
		.database(MongoPersistenceConformanceTest.class.getSimpleName())
		.build();

	@BeforeAll
	static void setupMongoConnection() {
		mongoService = new MongoService();
	}

	@AfterAll
	static void dropDatabase() {
		mongoService.client()
			.getDatabase(MongoPersistenceConformanceTest.class.getSimpleName())
			.drop();
	}

	@BeforeEach
	void setupPersistenceFactory() {
		mongoService.client()
			.getDatabase(mongoSettings.database())
			.drop();
		persistenceFactory = settings -> new MongoPersistence(settings, mongoSettings, mongoService.client());
	}
}

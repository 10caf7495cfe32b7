package io.vena.docsync.local.memory;

import io.vena.docsync.local.AbstractPersistenceTest;
import org.junit.jupiter.api.BeforeEach;

class MemoryPersistenceConformanceTest extends AbstractPersistenceTest {
	@BeforeEach
	void setupPersistenceFactory() {
		persistenceFactory = MemoryPersistence::new;
	}
}

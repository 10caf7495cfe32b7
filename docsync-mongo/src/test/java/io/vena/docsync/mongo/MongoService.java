package io.vena.docsync.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import java.io.Closeable;
import org.jetbrains.annotations.NotNull;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.utility.DockerImageName;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * An interface to the dockerized MongoDB replica set,
 * suitable for use by a test class.
 *
 * <p>
 * All instances use the same MongoDB container, so
 * different test classes should use different database names.
 */
public class MongoService implements Closeable {
	// Expensive stuff shared among instances as much as possible
	private static final MongoDBContainer MONGO_CONTAINER = mongoContainer();
	private static final MongoClientSettings clientSettings = mongoClientSettings(new ConnectionString(MONGO_CONTAINER.getReplicaSetUrl()));
	private static final MongoClient mongoClient = MongoClients.create(clientSettings);

	public MongoClientSettings clientSettings() {
		return clientSettings;
	}

	public MongoClient client() {
		return mongoClient;
	}

	@Override
	public void close() {
		mongoClient.close();
	}

	private static MongoDBContainer mongoContainer() {
		// MongoDBContainer runs a single-node replica set, which transactions require
		MongoDBContainer result = new MongoDBContainer(DockerImageName.parse("mongo:4.4"));
		result.start();
		return result;
	}

	@NotNull
	static MongoClientSettings mongoClientSettings(ConnectionString connectionString) {
		int initialTimeoutMS = 60_000;
		int queryTimeoutMS = 5_000;
		return MongoClientSettings.builder()
			.applyConnectionString(connectionString)
			.applyToClusterSettings(builder -> builder.serverSelectionTimeout(initialTimeoutMS, MILLISECONDS))
			.applyToSocketSettings(builder -> {
				builder.connectTimeout(initialTimeoutMS, MILLISECONDS);
				builder.readTimeout(queryTimeoutMS, MILLISECONDS);
			})
			.build();
	}
}

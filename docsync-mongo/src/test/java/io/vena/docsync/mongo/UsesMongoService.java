package io.vena.docsync.mongo;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.junit.jupiter.api.parallel.ResourceLock;

import static org.junit.jupiter.api.parallel.ResourceAccessMode.READ;

/**
 * Indicates that a test is going to use {@link MongoService}.
 *
 * <p>
 * Each test class should use a distinct database name so that
 * classes can run in parallel on the same MongoDB container.
 */
@Target({ ElementType.ANNOTATION_TYPE, ElementType.METHOD, ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
@ResourceLock(value="mongoContainer", mode=READ)
public @interface UsesMongoService {
}

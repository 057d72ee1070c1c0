package net.luminalib.test.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Postgres-backed integration test. Runs only when {@code RUN_DB_TESTS=true} and
 * {@code SPRING_DATASOURCE_URL} points at a disposable database.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@SpringBootTest(properties = "app.intelligence.generation-provider=mock")
@ActiveProfiles("test")
@EnabledIfEnvironmentVariable(named = "RUN_DB_TESTS", matches = "true")
public @interface DbIntegrationTest {
}

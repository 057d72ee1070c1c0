package net.luminalib.config;

import net.luminalib.adapters.persistence.BookCatalogRepository;
import net.luminalib.adapters.persistence.BorrowRepository;
import net.luminalib.adapters.persistence.InteractionLogRepository;
import net.luminalib.adapters.persistence.PreferenceRepository;
import net.luminalib.adapters.persistence.ReviewRepository;
import net.luminalib.domain.catalog.CatalogStore;
import net.luminalib.domain.circulation.BorrowStore;
import net.luminalib.domain.interaction.InteractionLog;
import net.luminalib.domain.preference.PreferenceStore;
import net.luminalib.domain.review.ReviewStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres-backed storage adapters when a datasource URL is present.
 *
 * <p>Complements {@link NoDatabaseConfig}, which handles the case when no database is
 * configured. {@link JdbcTemplate} comes from Spring Boot's JDBC auto-configuration.</p>
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class DatabaseConfig {

    @Bean
    public CatalogStore catalogStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new BookCatalogRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public ReviewStore reviewStore(JdbcTemplate jdbcTemplate) {
        return new ReviewRepository(jdbcTemplate);
    }

    @Bean
    public BorrowStore borrowStore(JdbcTemplate jdbcTemplate) {
        return new BorrowRepository(jdbcTemplate);
    }

    @Bean
    public InteractionLog interactionLog(JdbcTemplate jdbcTemplate) {
        return new InteractionLogRepository(jdbcTemplate);
    }

    @Bean
    public PreferenceStore preferenceStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new PreferenceRepository(jdbcTemplate, objectMapper);
    }
}

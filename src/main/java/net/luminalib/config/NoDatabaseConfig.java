/**
 * Configuration for operating without a database
 *
 * Activates when no datasource URL is configured and:
 * - Disables DataSource and transaction manager auto-configuration
 * - Registers the in-memory storage adapters for every port
 */
package net.luminalib.config;

import net.luminalib.adapters.memory.InMemoryBorrowStore;
import net.luminalib.adapters.memory.InMemoryCatalogStore;
import net.luminalib.adapters.memory.InMemoryInteractionLog;
import net.luminalib.adapters.memory.InMemoryPreferenceStore;
import net.luminalib.adapters.memory.InMemoryReviewStore;
import net.luminalib.domain.catalog.CatalogStore;
import net.luminalib.domain.circulation.BorrowStore;
import net.luminalib.domain.interaction.InteractionLog;
import net.luminalib.domain.preference.PreferenceStore;
import net.luminalib.domain.review.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.jdbc.autoconfigure.DataSourceAutoConfiguration;
import org.springframework.boot.jdbc.autoconfigure.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-memory storage when {@code spring.datasource.url} is empty.
 *
 * @implNote Data is lost on restart. Pairs with {@link DatabaseConfig}.
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
@EnableAutoConfiguration(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class
})
public class NoDatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(NoDatabaseConfig.class);

    @Bean
    public CatalogStore catalogStore() {
        log.warn("No datasource configured; using in-memory storage (data is lost on restart)");
        return new InMemoryCatalogStore();
    }

    @Bean
    public ReviewStore reviewStore() {
        return new InMemoryReviewStore();
    }

    @Bean
    public BorrowStore borrowStore() {
        return new InMemoryBorrowStore();
    }

    @Bean
    public InteractionLog interactionLog() {
        return new InMemoryInteractionLog();
    }

    @Bean
    public PreferenceStore preferenceStore() {
        return new InMemoryPreferenceStore();
    }
}

package io.b2mash.b2b.automation.config;

import io.b2mash.b2b.automation.store.InMemoryTabularStore;
import io.b2mash.b2b.automation.store.TabularStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the {@link TabularStore} port. The host application normally contributes its own adapter
 * bean; without one the engine runs against an in-memory store.
 */
@Configuration
public class StoreConfig {

  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  @Bean
  @ConditionalOnMissingBean(TabularStore.class)
  public TabularStore tabularStore() {
    log.warn("No TabularStore bean supplied -- automation data is held in memory only");
    return new InMemoryTabularStore();
  }
}

package com.mythos.core.catalog;

import com.mythos.core.manager.ObjectiveRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

    @Bean
    public ObjectiveRegistry objectiveRegistry() {
        return ObjectiveCatalog.defaultRegistry();
    }
}

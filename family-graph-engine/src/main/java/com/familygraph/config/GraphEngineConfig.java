package com.familygraph.config;

import com.familygraph.service.ResearchScoreProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GraphEngineConfig {

    // Replaced when a research-tracking integration registers its own provider
    @Bean
    @ConditionalOnMissingBean
    public ResearchScoreProvider researchScoreProvider() {
        return ResearchScoreProvider.none();
    }
}

package com.docgen.infrastructure.ai.config;

import com.docgen.infrastructure.ai.postprocessing.SanitizationRuleSet;
import com.docgen.infrastructure.ai.protection.LabelCatalogue;
import com.docgen.infrastructure.ai.validation.LeakPatternCatalogue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(OutputReliabilityProperties.class)
public class OutputReliabilityConfig {

    @Bean
    public LabelCatalogue labelCatalogue(OutputReliabilityProperties properties) {
        LabelCatalogue catalogue = LabelCatalogue.of(properties.getTemplateLabels());
        log.info("Loaded {} template labels", catalogue.labels().size());
        return catalogue;
    }

    @Bean
    public LeakPatternCatalogue leakPatternCatalogue(OutputReliabilityProperties properties) {
        return LeakPatternCatalogue.of(properties.getLeakedTokenPatterns());
    }

    @Bean
    public SanitizationRuleSet sanitizationRuleSet() {
        return SanitizationRuleSet.defaults();
    }
}

package com.minicrm.backend.config;

import com.minicrm.backend.rules.FallbackRuleTable;
import com.minicrm.backend.rules.FieldCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Rule engine beans. The catalog and fallback table are immutable and shared.
 */
@Configuration
public class SegmentationConfig {

    private static final Logger log = LoggerFactory.getLogger(SegmentationConfig.class);

    @Bean
    public FieldCatalog fieldCatalog() {
        FieldCatalog catalog = FieldCatalog.standard();
        log.info("Loaded field catalog with {} fields", catalog.fields().size());
        return catalog;
    }

    @Bean
    public FallbackRuleTable fallbackRuleTable() {
        FallbackRuleTable table = FallbackRuleTable.standard();
        log.info("Loaded fallback rule table version {}", table.getVersion());
        return table;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

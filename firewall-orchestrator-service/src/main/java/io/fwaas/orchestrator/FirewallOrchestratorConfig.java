package io.fwaas.orchestrator;

import io.fwaas.orchestrator.config.OrchestratorProperties;
import io.fwaas.orchestrator.domain.DeletionLedger;
import io.fwaas.orchestrator.infra.InMemoryDeletionLedger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FirewallOrchestratorConfig {

    @Bean
    DeletionLedger deletionLedger(OrchestratorProperties properties) {
        OrchestratorProperties.DeletionLedger ledger = properties.getDeletionLedger();
        return new InMemoryDeletionLedger(ledger.getTtl(), ledger.getCapacity());
    }
}

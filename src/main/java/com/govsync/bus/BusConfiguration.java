package com.govsync.bus;

import com.govsync.config.GovSyncProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BusConfiguration {

    @Bean(destroyMethod = "close")
    public GovernanceLogBus governanceLogBus(GovSyncProperties properties, Clock clock) {
        return new GovernanceLogBus(properties.getDistribution().getJournalCapacity(), clock);
    }
}

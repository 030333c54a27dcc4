package org.nowstart.scalper.config;

import java.time.Clock;
import org.nowstart.scalper.data.property.ValrProperties;
import org.nowstart.scalper.service.Sleeper;
import org.nowstart.scalper.service.auth.ValrRequestSigner;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ValrGatewayConfig {

    @Bean
    @RefreshScope
    public ValrRequestSigner valrRequestSigner(ValrProperties valrProperties) {
        return new ValrRequestSigner(valrProperties.apiKey(), valrProperties.apiSecret());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }
}

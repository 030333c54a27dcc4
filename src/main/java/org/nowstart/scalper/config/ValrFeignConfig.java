package org.nowstart.scalper.config;

import feign.Request;
import feign.RequestInterceptor;
import feign.Retryer;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import org.nowstart.scalper.data.property.ValrProperties;
import org.nowstart.scalper.service.auth.ValrAuthRequestInterceptor;
import org.nowstart.scalper.service.auth.ValrRequestSigner;
import org.springframework.context.annotation.Bean;

/**
 * Applied only to {@link org.nowstart.scalper.repository.ValrFeignClient}. Must stay out of
 * component scanning, otherwise the signing interceptor is shared with the public client.
 */
public class ValrFeignConfig {

    @Bean
    public RequestInterceptor valrAuthRequestInterceptor(ValrRequestSigner valrRequestSigner, Clock clock) {
        return new ValrAuthRequestInterceptor(valrRequestSigner, clock);
    }

    @Bean
    public Request.Options valrRequestOptions(ValrProperties valrProperties) {
        return new Request.Options(
                valrProperties.connectTimeout().toMillis(), TimeUnit.MILLISECONDS,
                valrProperties.readTimeout().toMillis(), TimeUnit.MILLISECONDS,
                true
        );
    }

    /**
     * Retries belong to {@link org.nowstart.scalper.repository.ValrFeignGateway}, which backs off and
     * re-signs each attempt.
     */
    @Bean
    public Retryer valrRetryer() {
        return Retryer.NEVER_RETRY;
    }
}

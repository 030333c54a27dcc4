package org.nowstart.scalper.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ValrAuthRequestInterceptor implements RequestInterceptor {

    static final String API_KEY_HEADER = "X-VALR-API-KEY";
    static final String SIGNATURE_HEADER = "X-VALR-API-SIGNATURE";
    static final String TIMESTAMP_HEADER = "X-VALR-API-TIMESTAMP";

    private final ValrRequestSigner valrRequestSigner;
    private final Clock clock;

    @Override
    public void apply(RequestTemplate template) {
        String timestamp = String.valueOf(clock.millis());
        byte[] body = template.body();
        String payload = body == null ? "" : new String(body, StandardCharsets.UTF_8);

        // 타깃 URL 이 붙기 전이므로 url() 은 /v1/... 경로와 쿼리만 담고 있다
        String signature = valrRequestSigner.sign(timestamp, template.method(), template.url(), payload);

        template.header(API_KEY_HEADER, valrRequestSigner.getApiKey());
        template.header(SIGNATURE_HEADER, signature);
        template.header(TIMESTAMP_HEADER, timestamp);
        template.header("Accept", "application/json");
        template.header("User-Agent", "valr-scalper/1.0");
    }
}

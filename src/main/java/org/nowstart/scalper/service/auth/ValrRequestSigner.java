package org.nowstart.scalper.service.auth;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ValrRequestSigner {

    private static final String ALGORITHM = "HmacSHA512";

    @Getter
    private final String apiKey;
    private final String apiSecret;

    /**
     * Signs {@code timestamp + METHOD + path + body} where path carries the version prefix and query
     * string, e.g. {@code /v1/orders/limit}. Returns lower-case hex.
     */
    public String sign(String timestamp, String method, String path, String body) {
        if (apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalStateException("VALR API secret is not configured");
        }

        String payload = timestamp + method.toUpperCase() + path + (body == null ? "" : body);
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] signature = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(signature);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign VALR request", e);
        }
    }
}

package com.kabadi.pickupservice.dispatch;

import com.kabadi.pickupservice.config.DispatchProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * Signs outbound offer bodies with HMAC-SHA256 so vendors can verify the sender.
 * The signature is the lower-case hex digest of the exact bytes sent.
 */
@Component
public class OfferSigner {

    public static final String SIGNATURE_HEADER = "X-Kabadi-Signature";

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public OfferSigner(DispatchProperties properties) {
        this(properties.getSigningSecret());
    }

    OfferSigner(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("dispatch.signing-secret must be configured");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    public String sign(String body) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute offer signature", e);
        }
    }
}

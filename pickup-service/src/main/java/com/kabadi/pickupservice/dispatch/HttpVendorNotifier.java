package com.kabadi.pickupservice.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kabadi.pickupservice.config.DispatchProperties;
import com.kabadi.pickupservice.dto.VendorOfferPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

@Component
@Slf4j
public class HttpVendorNotifier implements VendorNotifier {

    private final WebClient vendorWebClient;
    private final OfferSigner offerSigner;
    private final ObjectMapper objectMapper;
    private final DispatchProperties properties;

    public HttpVendorNotifier(@Qualifier("vendorWebClient") WebClient vendorWebClient,
                              OfferSigner offerSigner,
                              ObjectMapper objectMapper,
                              DispatchProperties properties) {
        this.vendorWebClient = vendorWebClient;
        this.offerSigner = offerSigner;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public OfferDeliveryResult sendOffer(VendorCandidate candidate, VendorOfferPayload payload) {
        String body;
        try {
            // Serialized once so the signature covers the exact bytes on the wire
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize offer: pickupId={}, vendorRef={}",
                    payload.getPickupId(), candidate.getVendorRef(), e);
            return OfferDeliveryResult.FAILED;
        }

        try {
            vendorWebClient.post()
                    .uri(candidate.getCallbackUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(OfferSigner.SIGNATURE_HEADER, offerSigner.sign(body))
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(properties.getSendTimeout())
                    .block();

            log.info("Offer delivered: pickupId={}, vendorRef={}", payload.getPickupId(), candidate.getVendorRef());
            return OfferDeliveryResult.DELIVERED;

        } catch (WebClientResponseException e) {
            log.warn("Vendor rejected offer call: pickupId={}, vendorRef={}, status={}",
                    payload.getPickupId(), candidate.getVendorRef(), e.getStatusCode().value());
            return OfferDeliveryResult.FAILED;
        } catch (RuntimeException e) {
            if (isTimeout(e)) {
                log.warn("Offer call timed out: pickupId={}, vendorRef={}, timeout={}",
                        payload.getPickupId(), candidate.getVendorRef(), properties.getSendTimeout());
                return OfferDeliveryResult.TIMED_OUT;
            }
            log.warn("Offer call failed: pickupId={}, vendorRef={}, error={}",
                    payload.getPickupId(), candidate.getVendorRef(), e.toString());
            return OfferDeliveryResult.FAILED;
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof TimeoutException || cause instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
        }
        return false;
    }
}

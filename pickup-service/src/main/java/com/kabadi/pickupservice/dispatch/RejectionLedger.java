package com.kabadi.pickupservice.dispatch;

import com.kabadi.pickupservice.model.RejectionReason;
import com.kabadi.pickupservice.model.RejectionRecord;
import com.kabadi.pickupservice.repository.RejectionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only record of vendors that declined, timed out on, or could not be reached
 * for a pickup. Exclusion is scoped to the pickup's dispatch round.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RejectionLedger {

    private final RejectionRecordRepository rejectionRecordRepository;
    private final Clock clock;

    @Transactional
    public RejectionRecord record(UUID pickupId, String vendorRef, RejectionReason reason, int dispatchRound) {
        RejectionRecord record = RejectionRecord.builder()
                .pickupId(pickupId)
                .vendorRef(vendorRef)
                .reason(reason)
                .dispatchRound(dispatchRound)
                .createdAt(Instant.now(clock))
                .build();
        RejectionRecord saved = rejectionRecordRepository.save(record);
        log.info("Vendor excluded: pickupId={}, vendorRef={}, reason={}, round={}",
                pickupId, vendorRef, reason, dispatchRound);
        return saved;
    }

    @Transactional(readOnly = true)
    public Set<String> excludedVendors(UUID pickupId, int dispatchRound) {
        return rejectionRecordRepository.findByPickupIdAndDispatchRound(pickupId, dispatchRound).stream()
                .map(RejectionRecord::getVendorRef)
                .collect(Collectors.toSet());
    }

    @Transactional(readOnly = true)
    public List<RejectionRecord> history(UUID pickupId) {
        return rejectionRecordRepository.findByPickupIdOrderByCreatedAtAsc(pickupId);
    }
}

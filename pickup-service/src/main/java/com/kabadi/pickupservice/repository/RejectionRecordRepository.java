package com.kabadi.pickupservice.repository;

import com.kabadi.pickupservice.model.RejectionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RejectionRecordRepository extends JpaRepository<RejectionRecord, UUID> {

    List<RejectionRecord> findByPickupIdAndDispatchRound(UUID pickupId, int dispatchRound);

    List<RejectionRecord> findByPickupIdOrderByCreatedAtAsc(UUID pickupId);
}

package com.kabadi.pickupservice.repository;

import com.kabadi.pickupservice.model.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxRepository extends JpaRepository<OutboxEvent, UUID> {
  // Fetch only the oldest 50 unprocessed events to avoid memory issues
  List<OutboxEvent> findTop50ByProcessedFalseOrderByCreatedAtAsc();

  @Modifying
  @Query("DELETE FROM OutboxEvent e WHERE e.processed = true AND e.createdAt < :cutoff")
  int deleteProcessedBefore(@Param("cutoff") LocalDateTime cutoff);

  List<OutboxEvent> findByAggregateIdOrderByCreatedAtAsc(String aggregateId);
}

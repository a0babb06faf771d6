package com.kabadi.pickupservice;

import com.kabadi.pickupservice.dispatch.AcceptanceArbiter;
import com.kabadi.pickupservice.dto.RejectionOutcomeResponse;
import com.kabadi.pickupservice.exception.AssignmentConflictException;
import com.kabadi.pickupservice.model.PickupRequest;
import com.kabadi.pickupservice.model.PickupStatus;
import com.kabadi.pickupservice.model.RejectionReason;
import com.kabadi.pickupservice.model.RejectionRecord;
import org.junit.jupiter.api.RepeatedTest;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests single-winner acceptance under concurrent load.
 *
 * CRITICAL SCENARIOS:
 * 1. The same vendor accepting many times at once gets exactly one success
 * 2. Vendors that were never offered the pickup cannot win a race against the holder
 * 3. An accept racing a reject from the same vendor leaves one consistent outcome
 */
public class ConcurrencyIntegrationTest extends AbstractDispatchIntegrationTest {

  @Autowired
  private AcceptanceArbiter acceptanceArbiter;

  @RepeatedTest(5) // Run 5 times to catch intermittent race conditions
  void should_let_exactly_one_duplicate_accept_succeed() throws InterruptedException {
    // ARRANGE: V1 holds the offer
    UUID pickupId = createPickup();
    PickupRequest offered = awaitOffer(pickupId, "V1", 1);

    // ACT: six copies of the same accept land at once
    int attempts = 6;
    AtomicInteger successes = new AtomicInteger();
    AtomicInteger conflicts = new AtomicInteger();
    runConcurrently(attempts, i -> {
      try {
        acceptanceArbiter.confirmVendorAcceptance(pickupId, "V1");
        successes.incrementAndGet();
      } catch (AssignmentConflictException e) {
        conflicts.incrementAndGet();
      }
    });

    // ASSERT
    assertEquals(1, successes.get(), "Only one accept may win");
    assertEquals(attempts - 1, conflicts.get());

    PickupRequest assigned = reload(pickupId);
    assertEquals(PickupStatus.ASSIGNED, assigned.getStatus());
    assertEquals("V1", assigned.getAssignedVendorRef());
    // A single conditional write bumps the version exactly once
    assertEquals(offered.getVersion() + 1, assigned.getVersion());
  }

  @RepeatedTest(5)
  void should_only_let_offer_holder_win_among_competing_vendors() throws InterruptedException {
    // ARRANGE
    UUID pickupId = createPickup();
    awaitOffer(pickupId, "V1", 1);
    List<String> vendors = List.of("V1", "V2", "V3");
    ConcurrentMap<String, Boolean> results = new ConcurrentHashMap<>();

    // ACT
    runConcurrently(vendors.size(), i -> {
      String vendorRef = vendors.get(i);
      try {
        acceptanceArbiter.confirmVendorAcceptance(pickupId, vendorRef);
        results.put(vendorRef, true);
      } catch (AssignmentConflictException e) {
        results.put(vendorRef, false);
      }
    });

    // ASSERT
    assertEquals(Boolean.TRUE, results.get("V1"));
    assertEquals(Boolean.FALSE, results.get("V2"));
    assertEquals(Boolean.FALSE, results.get("V3"));
    assertEquals("V1", reload(pickupId).getAssignedVendorRef());
  }

  @RepeatedTest(5)
  void should_resolve_accept_and_reject_race_to_one_outcome() throws InterruptedException {
    // ARRANGE
    UUID pickupId = createPickup();
    awaitOffer(pickupId, "V1", 1);
    AtomicInteger acceptSucceeded = new AtomicInteger();
    List<RejectionOutcomeResponse> rejections = new CopyOnWriteArrayList<>();

    // ACT: V1 both accepts and declines at the same moment
    runConcurrently(2, i -> {
      if (i == 0) {
        try {
          acceptanceArbiter.confirmVendorAcceptance(pickupId, "V1");
          acceptSucceeded.incrementAndGet();
        } catch (AssignmentConflictException e) {
          // lost to the rejection
        }
      } else {
        rejections.add(acceptanceArbiter.handleVendorRejection(pickupId, "V1"));
      }
    });

    // ASSERT: exactly one of the two took effect
    assertEquals(1, rejections.size());
    boolean rejectionApplied = !rejections.get(0).isIgnored();
    assertNotEquals(acceptSucceeded.get() == 1, rejectionApplied);

    PickupRequest result = reload(pickupId);
    List<RejectionRecord> history = rejectionRecordRepository.findByPickupIdOrderByCreatedAtAsc(pickupId);
    if (rejectionApplied) {
      assertEquals(PickupStatus.FINDING_VENDOR, result.getStatus());
      assertEquals("V2", result.getAssignedVendorRef());
      assertEquals(1, history.size());
      assertEquals(RejectionReason.EXPLICIT_REJECT, history.get(0).getReason());
    } else {
      assertEquals(PickupStatus.ASSIGNED, result.getStatus());
      assertEquals("V1", result.getAssignedVendorRef());
      assertTrue(history.isEmpty());
    }
  }

  private void runConcurrently(int threads, IndexedTask task) throws InterruptedException {
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch latch = new CountDownLatch(threads);
    List<Future<Void>> futures = new ArrayList<>();

    for (int i = 0; i < threads; i++) {
      int index = i;
      futures.add(executor.submit(() -> {
        latch.countDown();
        latch.await(); // All threads start at the same time
        task.run(index);
        return null;
      }));
    }

    for (Future<Void> future : futures) {
      try {
        future.get(10, TimeUnit.SECONDS);
      } catch (ExecutionException | TimeoutException e) {
        fail("Concurrent call failed unexpectedly", e);
      }
    }

    executor.shutdown();
    executor.awaitTermination(5, TimeUnit.SECONDS);
  }

  @FunctionalInterface
  private interface IndexedTask {
    void run(int index);
  }
}

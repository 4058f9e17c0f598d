package ca.gc.cra.prism.domain.payload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class StageSlotsTest {

  @Test
  void resultsAreReturnedInIndexOrder() {
    StageSlots<PerspectiveResult> slots = new StageSlots<>("branchA", 3);
    slots.complete(2, result(2));
    slots.complete(0, result(0));
    slots.fail(1, "middle", new IllegalStateException("down"));

    assertEquals(List.of(0, 2), slots.results().stream().map(PerspectiveResult::index).toList());
    assertEquals(2, slots.resultCount());
    assertFalse(slots.isComplete());
    StageSlots.SlotFailure failure = slots.failure(1).orElseThrow();
    assertEquals("middle", failure.descriptorName());
    assertEquals("down", failure.message());
    assertTrue(slots.result(1).isEmpty());
  }

  @Test
  void slotsAreWriteOnce() {
    StageSlots<PerspectiveResult> slots = new StageSlots<>("branchA", 2);
    slots.complete(0, result(0));

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> slots.complete(0, result(0)));
    assertEquals("branchA slot 0 already written", ex.getMessage());
    assertThrows(IllegalStateException.class, () -> slots.fail(0, "x", new RuntimeException()));
  }

  @Test
  void resultIndexMustMatchSlot() {
    StageSlots<PerspectiveResult> slots = new StageSlots<>("branchA", 2);

    assertThrows(IllegalArgumentException.class, () -> slots.complete(1, result(0)));
  }

  @Test
  void failureWithoutMessageFallsBackToExceptionName() {
    StageSlots<PerspectiveResult> slots = new StageSlots<>("branchA", 1);
    slots.fail(0, "only", new IllegalStateException());

    assertEquals("IllegalStateException", slots.failures().get(0).message());
  }

  @Test
  void concurrentWritersFillEverySlotOnce() throws Exception {
    int width = 9;
    StageSlots<PerspectiveResult> slots = new StageSlots<>("branchB", width);
    ExecutorService pool = Executors.newFixedThreadPool(width);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger rejected = new AtomicInteger();
    try {
      for (int round = 0; round < 2; round++) {
        for (int i = 0; i < width; i++) {
          int index = i;
          pool.execute(() -> {
            try {
              start.await();
              slots.complete(index, result(index));
            } catch (IllegalStateException ex) {
              rejected.incrementAndGet();
            } catch (InterruptedException ex) {
              Thread.currentThread().interrupt();
            }
          });
        }
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    assertTrue(slots.isComplete());
    assertEquals(width, rejected.get());
  }

  private static PerspectiveResult result(int index) {
    return new PerspectiveResult(index, "d" + index, "000", "text " + index, PerspectiveResult.DEFAULT_CONFIDENCE);
  }
}

package io.gridmesh.matching;

import io.gridmesh.TestClock;
import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.jobs.JobQueue;
import io.gridmesh.jobs.JobRequirements;
import io.gridmesh.jobs.SiteAccessPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

final class FairShareTrackerTest {

    @Test
    void usageHalvesEveryHalfLifeAndLeavesTheWindow() {
        TestClock clock = new TestClock(0L);
        FairShareTracker tracker = new FairShareTracker(clock, 1_000L, 60_000L, group -> 1.0);
        tracker.recordMatch("lhcb");
        tracker.recordMatch("lhcb");

        Assertions.assertEquals(2.0, tracker.decayedUsage("lhcb"), 1e-9);
        clock.advance(1_000L);
        Assertions.assertEquals(1.0, tracker.decayedUsage("lhcb"), 1e-9);
        clock.advance(1_000L);
        Assertions.assertEquals(0.5, tracker.decayedUsage("lhcb"), 1e-9);
        clock.advance(60_000L);
        Assertions.assertEquals(0.0, tracker.decayedUsage("lhcb"), 1e-12);
        Assertions.assertEquals(0.0, tracker.decayedUsage("atlas"), 1e-12);
    }

    @Test
    void overShareComparesUsageFractionWithShareFraction() {
        TestClock clock = new TestClock(0L);
        Map<String, Double> shares = Map.of("big", 3.0, "small", 1.0);
        FairShareTracker tracker = new FairShareTracker(clock, 900_000L, 3_600_000L,
                group -> shares.getOrDefault(group, 1.0));
        for (int i = 0; i < 3; i++) {
            tracker.recordMatch("big");
        }
        tracker.recordMatch("small");
        Assertions.assertTrue(tracker.overShare(List.of("big", "small")).isEmpty());

        tracker.recordMatch("small");
        Assertions.assertEquals(Set.of("small"), tracker.overShare(List.of("big", "small")));

        Assertions.assertTrue(new FairShareTracker(clock, 1L, 1L, g -> 1.0).overShare(List.of("a", "b")).isEmpty());
    }

    @Test
    void reorderIsAStablePartition() {
        TestClock clock = new TestClock(1L);
        JobQueue queue = new JobQueue(SiteAccessPolicy.OPEN, clock);
        JobDescriptor a1 = job(queue, "A");
        JobDescriptor b1 = job(queue, "B");
        JobDescriptor a2 = job(queue, "A");
        JobDescriptor b2 = job(queue, "B");
        FairShareTracker tracker = new FairShareTracker(clock, 900_000L, 3_600_000L, group -> 1.0);

        List<JobDescriptor> tier = List.of(a1, b1, a2, b2);
        Assertions.assertSame(tier, tracker.reorder(tier));

        tracker.recordMatch("A");
        Assertions.assertEquals(List.of(b1, b2, a1, a2), tracker.reorder(tier));
    }

    @Test
    void rejectsNonPositiveParameters() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new FairShareTracker(new TestClock(0L), 0L, 10L, g -> 1.0));
    }

    private static JobDescriptor job(JobQueue queue, String group) {
        return queue.enqueue(JobDescriptor.submission("owner", group, 1, JobRequirements.NONE, null)).value();
    }
}

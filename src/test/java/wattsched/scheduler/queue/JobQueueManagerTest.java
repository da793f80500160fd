package wattsched.scheduler.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import wattsched.scheduler.exception.InvalidJobTransitionException;
import wattsched.scheduler.model.Allocation;
import wattsched.scheduler.model.Job;
import wattsched.scheduler.model.JobOutcome;
import wattsched.scheduler.model.JobState;
import wattsched.scheduler.model.RejectReason;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobQueueManagerTest {

    private JobQueueManager queue;

    @BeforeEach
    void setUp() {
        queue = new JobQueueManager();
    }

    @Test
    void ordersBySubmissionTimeThenId() {
        queue.admit(job("b", 5, 1));
        queue.admit(job("c", 0, 1));
        queue.admit(job("a", 5, 1));

        assertEquals(List.of("c", "a", "b"), ids(queue.pendingJobs()));
        assertEquals(List.of("c", "a"), ids(queue.nextCandidates(2)));
        assertEquals(3, queue.nextCandidates(10).size());
    }

    @Test
    void duplicateIdIsRefused() {
        queue.admit(job("a", 0, 1));
        assertThrows(InvalidJobTransitionException.class, () -> queue.admit(job("a", 3, 2)));
    }

    @Test
    void lifecycle() {
        queue.admit(job("a", 0, 2));

        Job running = queue.markRunning("a", new Allocation("a", List.of(0, 1), 2), 10);
        assertEquals(JobState.RUNNING, running.state());
        assertEquals(10.0, running.startTime());
        assertEquals(0, queue.pendingCount());
        assertEquals(1, queue.runningCount());
        assertEquals(JobState.RUNNING, queue.find("a").orElseThrow().state());

        Job done = queue.markCompleted("a", JobOutcome.COMPLETED_SUCCESSFULLY, 70);
        assertEquals(JobState.COMPLETED, done.state());
        assertEquals(70.0, done.finishTime());
        assertTrue(queue.find("a").isEmpty());
        assertEquals(JobOutcome.COMPLETED_SUCCESSFULLY, queue.archived("a").orElseThrow().outcome());
        assertEquals(1, queue.completedCount());
        assertTrue(queue.isDrained());
        assertTrue(queue.knows("a"));
    }

    @Test
    @DisplayName("Archived jobs keep their outcome but drop the allocation")
    void archiveKeepsOnlyTheTerminalRecord() {
        queue.admit(job("a", 0, 2));
        queue.markRunning("a", new Allocation("a", List.of(0, 1), 2), 10);

        Job done = queue.markCompleted("a", JobOutcome.COMPLETED_KILLED, 40);

        // 1. The caller still sees the full record
        assertEquals(List.of(0, 1), done.allocation().hostIds());

        // 2. The archive holds what repeated terminations need
        Job archived = queue.archived("a").orElseThrow();
        assertEquals(JobState.COMPLETED, archived.state());
        assertEquals(JobOutcome.COMPLETED_KILLED, archived.outcome());
        assertEquals(40.0, archived.finishTime());
        assertNull(archived.allocation());
    }

    @Test
    void allocationMustCoverRequest() {
        queue.admit(job("a", 0, 3));

        assertThrows(InvalidJobTransitionException.class,
                () -> queue.markRunning("a", new Allocation("a", List.of(0, 1), 2), 0));
        assertThrows(InvalidJobTransitionException.class,
                () -> queue.markRunning("a", new Allocation("other", List.of(0, 1, 2), 3), 0));
        assertEquals(1, queue.pendingCount());
    }

    @Test
    void rejection() {
        queue.admit(job("big", 0, 10));

        Job rejected = queue.markRejected("big", RejectReason.INFEASIBLE_REQUEST, 0);

        assertEquals(JobState.REJECTED, rejected.state());
        assertEquals(RejectReason.INFEASIBLE_REQUEST, rejected.rejectReason());
        assertEquals(1, queue.rejectedCount());
        assertTrue(queue.isDrained());
    }

    @Test
    void invalidTransitions() {
        queue.admit(job("a", 0, 1));

        InvalidJobTransitionException e = assertThrows(InvalidJobTransitionException.class,
                () -> queue.markCompleted("a", JobOutcome.COMPLETED_SUCCESSFULLY, 1));
        assertEquals("a", e.jobId());
        assertEquals(JobState.COMPLETED, e.to());

        queue.markRunning("a", new Allocation("a", List.of(0), 1), 1);
        assertThrows(InvalidJobTransitionException.class,
                () -> queue.markRejected("a", RejectReason.INFEASIBLE_REQUEST, 2));
        assertThrows(InvalidJobTransitionException.class,
                () -> queue.markRunning("a", new Allocation("a", List.of(1), 1), 2));

        queue.markCompleted("a", JobOutcome.COMPLETED_KILLED, 3);
        e = assertThrows(InvalidJobTransitionException.class,
                () -> queue.markCompleted("a", JobOutcome.COMPLETED_KILLED, 4));
        assertEquals(JobState.COMPLETED, e.from());

        assertThrows(InvalidJobTransitionException.class,
                () -> queue.markCompleted("ghost", JobOutcome.COMPLETED_SUCCESSFULLY, 4));
    }

    private static Job job(String id, double subtime, int res) {
        return Job.builder().id(id).submissionTime(subtime).requestedResources(res).build();
    }

    private static List<String> ids(List<Job> jobs) {
        return jobs.stream().map(Job::id).toList();
    }
}

package com.repo.velocity.core;

import org.junit.jupiter.api.Test;

import static com.repo.velocity.core.Fixtures.T0;
import static com.repo.velocity.core.Fixtures.hoursAfter;
import static org.junit.jupiter.api.Assertions.*;

class RecordValidationTest {

    @Test
    void testCommitChurnAndDefaults() {
        CommitRecord commit = new CommitRecord("abc", "alice", T0, 100, 50, 3, null);
        assertEquals(150, commit.churn());
        assertEquals("", commit.message());
    }

    @Test
    void testCommitMissingAuthor() {
        MalformedRecordException e = assertThrows(MalformedRecordException.class,
                () -> new CommitRecord("abc", " ", T0, 1, 1, 1, "m"));
        assertEquals("abc", e.getRecordId());
        assertTrue(e.getMessage().contains("author"));
    }

    @Test
    void testCommitNegativeCount() {
        assertThrows(MalformedRecordException.class, () -> new CommitRecord("abc", "alice", T0, -1, 0, 0, ""));
    }

    @Test
    void testCommitWithoutShaReportsUnknownId() {
        MalformedRecordException e = assertThrows(MalformedRecordException.class,
                () -> new CommitRecord(null, "alice", T0, 1, 1, 1, ""));
        assertEquals("?", e.getRecordId());
    }

    @Test
    void testPullRequestLeadTime() {
        PullRequestRecord pr = new PullRequestRecord("1", "bob", T0, hoursAfter(36), 2, 10, 5, 1, null);
        assertTrue(pr.isMerged());
        assertEquals(36.0, pr.leadTimeHours().getAsDouble(), 1e-9);
        assertEquals(CiStatus.PENDING, pr.ciStatus());
        assertEquals(15, pr.churn());
    }

    @Test
    void testOpenPullRequestHasNoLeadTime() {
        PullRequestRecord pr = new PullRequestRecord("1", "bob", T0, null, 0, 10, 5, 1, CiStatus.SUCCESS);
        assertFalse(pr.isMerged());
        assertTrue(pr.leadTimeHours().isEmpty());
    }

    @Test
    void testPullRequestMergedBeforeCreated() {
        assertThrows(MalformedRecordException.class,
                () -> new PullRequestRecord("1", "bob", hoursAfter(5), T0, 0, 1, 1, 1, CiStatus.SUCCESS));
    }

    @Test
    void testIncidentStatusIsDerived() {
        IncidentRecord open = new IncidentRecord("i1", T0, null);
        IncidentRecord resolved = new IncidentRecord("i2", T0, hoursAfter(3));
        assertEquals(IncidentStatus.OPEN, open.status());
        assertTrue(open.recoveryHours().isEmpty());
        assertEquals(IncidentStatus.RESOLVED, resolved.status());
        assertEquals(3.0, resolved.recoveryHours().getAsDouble(), 1e-9);
    }

    @Test
    void testIncidentResolvedBeforeDetected() {
        assertThrows(MalformedRecordException.class, () -> new IncidentRecord("i1", hoursAfter(2), T0));
    }

    @Test
    void testDeploymentRequiresStatus() {
        assertThrows(MalformedRecordException.class, () -> new DeploymentRecord("d1", T0, null));
        assertTrue(new DeploymentRecord("d1", T0, DeploymentStatus.ROLLED_BACK).isFailed());
        assertFalse(new DeploymentRecord("d2", T0, DeploymentStatus.SUCCESS).isFailed());
    }

    @Test
    void testLenientStatusParsing() {
        assertEquals(CiStatus.FAILURE, CiStatus.parse("Failed"));
        assertEquals(CiStatus.PENDING, CiStatus.parse("queued"));
        assertEquals(DeploymentStatus.ROLLED_BACK, DeploymentStatus.parse("rollback"));
        assertNull(DeploymentStatus.parse("exploded"));
    }
}

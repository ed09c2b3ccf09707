package com.scheduler.lifecycle.archival;

import com.scheduler.lifecycle.core.model.ArchiveRecord;
import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.maintenance.CancellationToken;
import com.scheduler.lifecycle.store.ArchiveStore;
import com.scheduler.lifecycle.store.InMemoryArchiveStore;
import com.scheduler.lifecycle.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static com.scheduler.lifecycle.testutil.Records.NOW;
import static com.scheduler.lifecycle.testutil.Records.daysOld;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ArchivePurger")
class ArchivePurgerTest {

    private InMemoryArchiveStore archive;
    private ArchivePurger purger;

    @Mock
    private ArchiveStore mockStore;

    @BeforeEach
    void setUp() {
        archive = new InMemoryArchiveStore();
        purger = new ArchivePurger(archive);
    }

    private void archiveAt(String id, Instant archivedAt) {
        archive.insertArchive(EntityKind.JOB,
                List.of(ArchiveRecord.of(daysOld(EntityKind.JOB, id, 3000), archivedAt, "system")));
    }

    @Test
    @DisplayName("Should never delete rows archived at or after the cutoff")
    void strictCutoff() {
        archiveAt("old", NOW.minusSeconds(1));
        archiveAt("edge", NOW);
        archiveAt("young", NOW.plusSeconds(1));

        ArchivalResult result = purger.purge(EntityKind.JOB, NOW, 100);

        assertTrue(result.isSuccess());
        assertEquals(1, result.count());
        assertEquals(2, archive.count(EntityKind.JOB));
    }

    @Test
    @DisplayName("Should loop over batches until a short batch")
    void batches() {
        for (int i = 0; i < 23; i++) {
            archiveAt("r" + i, NOW.minusSeconds(100 + i));
        }

        ArchivalResult result = purger.purge(EntityKind.JOB, NOW, 5);

        assertEquals(23, result.count());
        assertEquals(0, archive.rowCount(EntityKind.JOB));
    }

    @Test
    @DisplayName("Should purge duplicate copies as separate rows")
    void duplicateRows() {
        archiveAt("dup", NOW.minusSeconds(10));
        archiveAt("dup", NOW.minusSeconds(5));

        assertEquals(2, purger.purge(EntityKind.JOB, NOW, 10).count());
        assertEquals(0, archive.rowCount(EntityKind.JOB));
    }

    @Test
    @DisplayName("A store failure should end the kind with the partial count")
    void failure() {
        when(mockStore.deleteArchivedBefore(eq(EntityKind.AUDIT_LOG), any(Instant.class), anyInt()))
                .thenReturn(10)
                .thenThrow(new StoreException("connection lost"));

        ArchivalResult result = new ArchivePurger(mockStore).purge(EntityKind.AUDIT_LOG, NOW, 10);

        assertFalse(result.isSuccess());
        assertEquals(10, result.count());
        assertEquals("Archive purge failed for AUDIT_LOG: connection lost", result.errorMessage());
    }

    @Test
    @DisplayName("Cancellation should be honoured between batches")
    void cancellation() {
        CancellationToken token = CancellationToken.create();
        when(mockStore.deleteArchivedBefore(eq(EntityKind.JOB), any(Instant.class), anyInt()))
                .thenAnswer(inv -> {
                    token.cancel();
                    return 10;
                });

        ArchivalResult result = new ArchivePurger(mockStore).purge(EntityKind.JOB, NOW, 10, token);

        assertTrue(result.cancelled());
        assertEquals(10, result.count());
        verify(mockStore, times(1)).deleteArchivedBefore(eq(EntityKind.JOB), any(Instant.class), anyInt());
    }

    @Test
    @DisplayName("Should reject a non-positive batch size")
    void rejectsBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> purger.purge(EntityKind.JOB, NOW, -1));
    }
}

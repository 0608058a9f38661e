package de.conciso.torrentbridge.sync;

import org.junit.jupiter.api.Test;

import static de.conciso.torrentbridge.sync.TransferStatus.COMPLETED;
import static de.conciso.torrentbridge.sync.TransferStatus.DELETED;
import static de.conciso.torrentbridge.sync.TransferStatus.DOWNLOADING;
import static de.conciso.torrentbridge.sync.TransferStatus.ERROR;
import static de.conciso.torrentbridge.sync.TransferStatus.IMPORTED;
import static de.conciso.torrentbridge.sync.TransferStatus.PAUSED;
import static de.conciso.torrentbridge.sync.TransferStatus.QUEUED;
import static org.assertj.core.api.Assertions.assertThat;

class TransferStatusTest {

    @Test
    void forwardTransitionsAreAllowed() {
        assertThat(QUEUED.canTransitionTo(DOWNLOADING)).isTrue();
        assertThat(DOWNLOADING.canTransitionTo(COMPLETED)).isTrue();
        assertThat(COMPLETED.canTransitionTo(IMPORTED)).isTrue();
        assertThat(QUEUED.canTransitionTo(COMPLETED)).isTrue();
        assertThat(PAUSED.canTransitionTo(COMPLETED)).isTrue();
    }

    @Test
    void pauseOnlyFromDownloading() {
        assertThat(DOWNLOADING.canTransitionTo(PAUSED)).isTrue();
        assertThat(PAUSED.canTransitionTo(DOWNLOADING)).isTrue();
        assertThat(QUEUED.canTransitionTo(PAUSED)).isFalse();
        assertThat(COMPLETED.canTransitionTo(PAUSED)).isFalse();
    }

    @Test
    void backwardTransitionsAreRejected() {
        assertThat(DOWNLOADING.canTransitionTo(QUEUED)).isFalse();
        assertThat(COMPLETED.canTransitionTo(DOWNLOADING)).isFalse();
        assertThat(IMPORTED.canTransitionTo(COMPLETED)).isFalse();
    }

    @Test
    void errorOnlyLeadsBackToQueued() {
        assertThat(ERROR.canTransitionTo(QUEUED)).isTrue();
        assertThat(ERROR.canTransitionTo(DOWNLOADING)).isFalse();
    }

    @Test
    void everyStateCanBeDeleted() {
        for (TransferStatus status : TransferStatus.values()) {
            assertThat(status.canTransitionTo(DELETED)).isTrue();
        }
        assertThat(DELETED.canTransitionTo(QUEUED)).isFalse();
    }

    @Test
    void mapsCloudStatusStrings() {
        assertThat(TransferStatus.fromCloud("Downloading")).isEqualTo(DOWNLOADING);
        assertThat(TransferStatus.fromCloud("finished")).isEqualTo(COMPLETED);
        assertThat(TransferStatus.fromCloud("wishlist")).isEqualTo(QUEUED);
        assertThat(TransferStatus.fromCloud("failed")).isEqualTo(ERROR);
        assertThat(TransferStatus.fromCloud("mystery")).isNull();
        assertThat(TransferStatus.fromCloud(null)).isNull();
    }
}

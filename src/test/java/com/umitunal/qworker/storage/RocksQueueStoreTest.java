package com.umitunal.qworker.storage;

import com.umitunal.qworker.config.StorageConfig;
import com.umitunal.qworker.core.Priority;
import com.umitunal.qworker.core.QueueStore;
import com.umitunal.qworker.core.QueueStoreException;
import com.umitunal.qworker.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RocksQueueStoreTest extends AbstractQueueStoreTest {

    @TempDir
    Path tempDir;

    @Override
    protected QueueStore createStore(MutableClock clock) {
        return new RocksQueueStore(config(), clock);
    }

    private StorageConfig config() {
        return StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .withPopPollInterval(20)
                .build();
    }

    @Test
    @DisplayName("Should keep queued and failed jobs across reopen")
    void testPersistenceAcrossReopen() {
        // Given
        String failedId = store.push(job("broken"), Priority.DEFAULT, 0);
        store.pop(0);
        store.fail(failedId, job("broken"), "bad data");
        store.push(job("pending"), Priority.LOW, 0);

        // When
        store.close();
        store = new RocksQueueStore(config(), clock);

        // Then
        assertThat(store.failedRecords()).extracting(r -> r.getReason()).containsExactly("bad data");
        assertThat(nameOf(store.pop(0))).isEqualTo("pending");
    }

    @Test
    @DisplayName("Should continue enqueue order after reopen")
    void testSequenceAfterReopen() {
        // Given
        store.push(job("before"), Priority.DEFAULT, 0);
        store.close();
        store = new RocksQueueStore(config(), clock);

        // When
        store.push(job("after"), Priority.DEFAULT, 0);

        // Then
        assertThat(nameOf(store.pop(0))).isEqualTo("before");
        assertThat(nameOf(store.pop(0))).isEqualTo("after");
    }

    @Test
    @DisplayName("Should keep a claimed job claimed across reopen until recovered")
    void testClaimSurvivesReopen() {
        // Given
        store.push(job("in-flight"), Priority.DEFAULT, 0);
        store.pop(0);
        store.close();
        store = new RocksQueueStore(config(), clock);

        // Then
        assertThat(store.pop(0)).isEmpty();
        assertThat(store.recoverAbandoned(0)).isZero();

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.recoverAbandoned(0)).isEqualTo(1);
        assertThat(nameOf(store.pop(0))).isEqualTo("in-flight");
    }

    @Test
    @DisplayName("Should refuse a second store on the same directory")
    void testDirectoryLocked() {
        assertThatThrownBy(() -> new RocksQueueStore(config(), clock))
                .isInstanceOf(QueueStoreException.class);
    }
}

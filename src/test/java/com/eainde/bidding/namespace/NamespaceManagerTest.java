package com.eainde.bidding.namespace;

import com.eainde.bidding.error.StoreUnavailableException;
import com.eainde.bidding.error.TransientProviderException;
import com.eainde.bidding.model.IsolationMode;
import com.eainde.bidding.model.NamespaceHandle;
import com.eainde.bidding.provider.RetryPolicy;
import com.eainde.bidding.provider.RetryingCaller;
import com.eainde.bidding.provider.VectorStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NamespaceManagerTest {

    @Mock
    private VectorStore store;

    private NamespaceManager manager() {
        return new NamespaceManager(store, new RetryingCaller(
                new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(2), 0.0)));
    }

    @Nested
    @DisplayName("acquire()")
    class Acquire {

        @Test
        @DisplayName("isolated mode should clear the session namespace")
        void isolatedClears() {
            NamespaceHandle handle = manager().acquire("abc", IsolationMode.ISOLATED);

            assertThat(handle.namespaceId()).isEqualTo("bid-abc");
            assertThat(handle.mode()).isEqualTo(IsolationMode.ISOLATED);
            verify(store).clear("bid-abc");
        }

        @Test
        @DisplayName("cumulative mode should probe the shared namespace but never clear")
        void cumulativeKeeps() {
            NamespaceHandle handle = manager().acquire("abc", IsolationMode.CUMULATIVE);

            assertThat(handle.namespaceId()).isEqualTo(NamespaceManager.SHARED_NAMESPACE);
            assertThat(handle.sessionId()).isEqualTo("abc");
            verify(store).checkAvailable(NamespaceManager.SHARED_NAMESPACE);
            verify(store, never()).clear(anyString());
        }

        @Test
        @DisplayName("cumulative sessions should resolve to one namespace, isolated sessions to their own")
        void namespaceResolution() {
            assertThat(NamespaceManager.namespaceFor("s1", IsolationMode.CUMULATIVE))
                    .isEqualTo(NamespaceManager.namespaceFor("s2", IsolationMode.CUMULATIVE))
                    .isEqualTo("bid-shared");
            assertThat(NamespaceManager.namespaceFor("s1", IsolationMode.ISOLATED)).isEqualTo("bid-s1");
            assertThat(NamespaceManager.namespaceFor(" s2 ", IsolationMode.ISOLATED)).isEqualTo("bid-s2");
        }

        @Test
        @DisplayName("unreachable store should surface as StoreUnavailableException")
        void storeDown() {
            doThrow(new StoreUnavailableException("connection refused")).when(store).clear("bid-abc");

            assertThatThrownBy(() -> manager().acquire("abc", IsolationMode.ISOLATED))
                    .isInstanceOf(StoreUnavailableException.class);
        }

        @Test
        @DisplayName("transient probe failures should be retried, then reported as unavailable")
        void transientProbe() {
            doThrow(new TransientProviderException("timeout")).when(store).checkAvailable(NamespaceManager.SHARED_NAMESPACE);

            assertThatThrownBy(() -> manager().acquire("abc", IsolationMode.CUMULATIVE))
                    .isInstanceOf(StoreUnavailableException.class)
                    .hasCauseInstanceOf(TransientProviderException.class);
            verify(store, times(3)).checkAvailable(NamespaceManager.SHARED_NAMESPACE);
        }

        @Test
        @DisplayName("blank session id should be rejected")
        void blankSession() {
            assertThatThrownBy(() -> NamespaceManager.namespaceFor(" ", IsolationMode.CUMULATIVE))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Locking")
    class Locking {

        @Test
        @DisplayName("a clear should wait for in-flight reads of the same namespace")
        void clearWaitsForReaders() throws Exception {
            NamespaceManager manager = manager();
            NamespaceHandle handle = manager.acquire("lock", IsolationMode.ISOLATED);
            CountDownLatch readerInside = new CountDownLatch(1);
            CountDownLatch releaseReader = new CountDownLatch(1);
            AtomicBoolean readerDone = new AtomicBoolean();
            AtomicBoolean clearedWhileReading = new AtomicBoolean();

            doAnswer(invocation -> {
                clearedWhileReading.set(!readerDone.get());
                return null;
            }).when(store).clear("bid-lock");

            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<?> reader = executor.submit(() -> manager.readAccess(handle, () -> {
                    readerInside.countDown();
                    try {
                        releaseReader.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    readerDone.set(true);
                    return null;
                }));
                assertThat(readerInside.await(5, TimeUnit.SECONDS)).isTrue();
                Future<?> clearer = executor.submit(() -> manager.acquire("lock", IsolationMode.ISOLATED));

                Thread.sleep(100);
                assertThat(clearer.isDone()).isFalse();
                releaseReader.countDown();

                reader.get(5, TimeUnit.SECONDS);
                clearer.get(5, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }
            assertThat(clearedWhileReading).isFalse();
        }

        @Test
        @DisplayName("release should not touch the store")
        void releaseIsNoOp() {
            NamespaceManager manager = manager();
            NamespaceHandle handle = manager.acquire("r", IsolationMode.ISOLATED);

            manager.release(handle);

            InOrder order = inOrder(store);
            order.verify(store).clear("bid-r");
            order.verifyNoMoreInteractions();
        }
    }
}

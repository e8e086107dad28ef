package com.example.redismanager.service;

import com.example.redismanager.error.ErrorKind;
import com.example.redismanager.error.ManagerException;
import com.example.redismanager.kv.InMemoryKvClient;
import com.example.redismanager.lock.LockClient;
import com.example.redismanager.lock.LockException;
import com.example.redismanager.lock.LockHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisManagerLockingTest {

    private static final Duration DEFAULT_LOCK_TTL = Duration.ofSeconds(5);

    @Mock
    private LockClient lockClient;

    @Mock
    private LockHandle lockHandle;

    private InMemoryKvClient kvClient;
    private RedisManager redisManager;

    @BeforeEach
    void setUp() {
        kvClient = new InMemoryKvClient();
        redisManager = RedisManager.builder(kvClient)
                .namespace("locked")
                .maxRetries(5)
                .locking(lockClient, DEFAULT_LOCK_TTL)
                .build();
    }

    @Test
    void testAdd_LocksKeyWithDefaultTtl() {
        // Given
        when(lockClient.acquire(List.of("lock:locked:a"), DEFAULT_LOCK_TTL)).thenReturn(lockHandle);

        // When
        String result = redisManager.add("a", 1);

        // Then
        assertEquals(RedisManager.OK, result);
        assertTrue(redisManager.isLocking());
        verify(lockHandle, times(1)).release();
    }

    @Test
    void testUpsert_PerCallLockTtl() {
        Duration ttl = Duration.ofMillis(750);
        when(lockClient.acquire(List.of("lock:locked:a"), ttl)).thenReturn(lockHandle);

        redisManager.upsert("a", 1, ttl);

        verify(lockClient).acquire(List.of("lock:locked:a"), ttl);
        verify(lockHandle).release();
    }

    @Test
    void testAdd_ConflictStillReleasesLock() {
        // Given
        when(lockClient.acquire(any(), any())).thenReturn(lockHandle);
        redisManager.add("a", 1);

        // When
        ManagerException e = assertThrows(ManagerException.class, () -> redisManager.add("a", 2));

        // Then
        assertEquals(ErrorKind.KEY_EXISTS, e.getKind());
        verify(lockHandle, times(2)).release();
    }

    @Test
    void testAcquireFailure_WriteIsSkipped() {
        when(lockClient.acquire(any(), any())).thenThrow(new LockException("busy"));

        ManagerException e = assertThrows(ManagerException.class, () -> redisManager.add("a", 1));

        assertEquals(ErrorKind.LOCK_INTERNAL, e.getKind());
        assertInstanceOf(LockException.class, e.getCause());
        assertTrue(kvClient.rawValues().isEmpty());
    }

    @Test
    void testReleaseFailureAfterSuccessfulWriteIsReported() {
        // Given
        when(lockClient.acquire(any(), any())).thenReturn(lockHandle);
        doThrow(new LockException("lock expired")).when(lockHandle).release();

        // When
        ManagerException e = assertThrows(ManagerException.class, () -> redisManager.upsert("a", "v"));

        // Then
        assertEquals(ErrorKind.LOCK_INTERNAL, e.getKind());
        assertEquals(40, e.getCode());
        assertEquals("\"v\"", kvClient.rawValues().get("locked:a"));
    }

    @Test
    void testReleaseFailureAfterFailedWriteIsSuppressed() {
        // Given
        when(lockClient.acquire(any(), any())).thenReturn(lockHandle);
        doThrow(new LockException("lock expired")).when(lockHandle).release();

        // When
        ManagerException e = assertThrows(ManagerException.class, () -> redisManager.update("missing", 1));

        // Then
        assertEquals(ErrorKind.KEY_NOT_EXIST, e.getKind());
        assertEquals(1, e.getSuppressed().length);
        assertInstanceOf(LockException.class, e.getSuppressed()[0]);
    }

    @Test
    void testDelete_Locked() {
        when(lockClient.acquire(any(), any())).thenReturn(lockHandle);
        kvClient.rawValues().put("locked:a", "1");

        assertTrue(redisManager.delete("a"));

        verify(lockClient).acquire(List.of("lock:locked:a"), DEFAULT_LOCK_TTL);
        verify(lockHandle).release();
    }

    @Test
    void testReadsAreNeverLocked() {
        redisManager.get("a");
        redisManager.has("a");

        verifyNoInteractions(lockClient);
    }

    @Test
    void testLockingRequiresDefaultTtl() {
        assertThrows(IllegalArgumentException.class,
                () -> RedisManager.builder(kvClient).namespace("ns").locking(lockClient, null));
    }
}

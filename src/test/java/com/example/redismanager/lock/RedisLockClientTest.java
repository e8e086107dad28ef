package com.example.redismanager.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisLockClientTest {

    private static final Duration TTL = Duration.ofSeconds(5);

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> valueOps;

    private RedisLockClient lockClient;

    @BeforeEach
    void setUp() {
        LockSettings settings = LockSettings.builder()
                .retryCount(2)
                .retryDelay(Duration.ZERO)
                .retryJitter(Duration.ZERO)
                .build();
        lockClient = new RedisLockClient(redis, settings);
    }

    @Test
    void testAcquireAndRelease() {
        // Given
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq("lock:ns:a"), anyString(), eq(TTL))).thenReturn(true);
        when(redis.execute(eq(RedisLockClient.RELEASE_SCRIPT), eq(List.of("lock:ns:a")), anyString())).thenReturn(1L);

        // When
        LockHandle handle = lockClient.acquire(List.of("lock:ns:a"), TTL);
        handle.release();

        // Then
        assertEquals(List.of("lock:ns:a"), handle.resources());
        verify(redis).execute(eq(RedisLockClient.RELEASE_SCRIPT), eq(List.of("lock:ns:a")), anyString());
    }

    @Test
    void testAcquire_ContendedLockGivesUpAfterRetryCount() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq("lock:ns:a"), anyString(), eq(TTL))).thenReturn(false);

        LockException e = assertThrows(LockException.class, () -> lockClient.acquire(List.of("lock:ns:a"), TTL));

        assertTrue(e.getMessage().contains("3 attempts"));
        verify(valueOps, times(3)).setIfAbsent(eq("lock:ns:a"), anyString(), eq(TTL));
    }

    @Test
    void testAcquire_PartialAcquisitionIsRolledBack() {
        // Given
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq("r1"), anyString(), eq(TTL))).thenReturn(true, true);
        when(valueOps.setIfAbsent(eq("r2"), anyString(), eq(TTL))).thenReturn(false, true);
        when(redis.execute(eq(RedisLockClient.RELEASE_SCRIPT), eq(List.of("r1")), anyString())).thenReturn(1L);

        // When
        LockHandle handle = lockClient.acquire(List.of("r1", "r2"), TTL);

        // Then
        assertEquals(List.of("r1", "r2"), handle.resources());
        verify(redis, times(1)).execute(eq(RedisLockClient.RELEASE_SCRIPT), eq(List.of("r1")), anyString());
    }

    @Test
    void testRelease_LostLock() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq("lock:ns:a"), anyString(), eq(TTL))).thenReturn(true);
        when(redis.execute(eq(RedisLockClient.RELEASE_SCRIPT), eq(List.of("lock:ns:a")), anyString())).thenReturn(0L);

        LockHandle handle = lockClient.acquire(List.of("lock:ns:a"), TTL);

        LockException e = assertThrows(LockException.class, handle::release);
        assertTrue(e.getMessage().contains("expired"));
    }

    @Test
    void testAcquire_RedisDown() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq("lock:ns:a"), anyString(), eq(TTL)))
                .thenThrow(new RedisConnectionFailureException("down"));

        LockException e = assertThrows(LockException.class, () -> lockClient.acquire(List.of("lock:ns:a"), TTL));

        assertInstanceOf(RedisConnectionFailureException.class, e.getCause());
    }

    @Test
    void testAcquire_InvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> lockClient.acquire(List.of(), TTL));
        assertThrows(IllegalArgumentException.class, () -> lockClient.acquire(List.of("r"), Duration.ZERO));
        verifyNoInteractions(redis);
    }
}

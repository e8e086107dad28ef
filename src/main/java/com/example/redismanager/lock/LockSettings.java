package com.example.redismanager.lock;

import lombok.*;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LockSettings {
    @Builder.Default
    private int retryCount = 10;
    @Builder.Default
    private Duration retryDelay = Duration.ofMillis(200);
    @Builder.Default
    private Duration retryJitter = Duration.ofMillis(200);

    public static LockSettings defaults() {
        return LockSettings.builder().build();
    }
}

package com.ai.handoff.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "store_entry", indexes = {
    @Index(name = "idx_store_entry_key", columnList = "store_key", unique = true),
    @Index(name = "idx_store_entry_expires", columnList = "expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoreEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "store_key", nullable = false, length = 255)
    private String storeKey;

    @Column(name = "store_value", columnDefinition = "TEXT", nullable = false)
    private String storeValue;

    /** Null means the entry never expires. */
    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isLive(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}

package com.ai.handoff.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One element of a store list. Elements of the same list share an expiry; the identity
 * column gives insertion order.
 */
@Entity
@Table(name = "store_list_item", indexes = {
    @Index(name = "idx_store_list_item_key", columnList = "list_key")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoreListItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "list_key", nullable = false, length = 255)
    private String listKey;

    @Column(name = "item_value", columnDefinition = "TEXT", nullable = false)
    private String itemValue;

    @Column(name = "expires_at")
    private Instant expiresAt;

    public boolean isLive(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}

package com.ai.handoff.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "store_index_entry", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"index_name", "member_key"})
}, indexes = {
    @Index(name = "idx_store_index_score", columnList = "index_name, score")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoreIndexEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "index_name", nullable = false, length = 100)
    private String indexName;

    @Column(name = "member_key", nullable = false, length = 255)
    private String memberKey;

    @Column(nullable = false)
    private double score;
}

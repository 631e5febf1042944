package com.ai.handoff.store;

import com.ai.handoff.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour every store implementation must share. Subclasses provide the store and
 * the clock it reads.
 */
abstract class CoordinationStoreContract {

    protected abstract CoordinationStore store();

    protected abstract MutableClock clock();

    @Test
    void missing_keys_read_as_absent() {
        assertThat(store().get("nope")).isEmpty();
        assertThat(store().exists("nope")).isFalse();
        assertThat(store().ttl("nope")).isEmpty();
        assertThat(store().range("nope")).isEmpty();
    }

    @Test
    void set_overwrites_and_expires() {
        store().set("k", "one", Duration.ofSeconds(10));
        store().set("k", "two", Duration.ofSeconds(10));
        assertThat(store().get("k")).contains("two");

        clock().advance(Duration.ofSeconds(11));

        assertThat(store().get("k")).isEmpty();
        assertThat(store().exists("k")).isFalse();
    }

    @Test
    void keys_without_ttl_never_expire() {
        store().set("counter", "3", null);

        clock().advance(Duration.ofDays(400));

        assertThat(store().get("counter")).contains("3");
        assertThat(store().ttl("counter")).isEmpty();
    }

    @Test
    void set_if_absent_only_wins_once_per_lifetime() {
        assertThat(store().setIfAbsent("lock", "a", Duration.ofSeconds(35))).isTrue();
        assertThat(store().setIfAbsent("lock", "b", Duration.ofSeconds(35))).isFalse();
        assertThat(store().get("lock")).contains("a");

        clock().advance(Duration.ofSeconds(36));

        assertThat(store().setIfAbsent("lock", "c", Duration.ofSeconds(35))).isTrue();
        assertThat(store().get("lock")).contains("c");
    }

    @Test
    void expire_extends_live_keys_only() {
        store().set("k", "v", Duration.ofSeconds(10));

        assertThat(store().expire("k", Duration.ofHours(1))).isTrue();
        assertThat(store().ttl("k")).hasValueSatisfying(ttl -> assertThat(ttl).isEqualTo(Duration.ofHours(1)));
        assertThat(store().expire("missing", Duration.ofHours(1))).isFalse();

        clock().advance(Duration.ofMinutes(30));
        assertThat(store().ttl("k")).hasValue(Duration.ofMinutes(30));
    }

    @Test
    void delete_removes_values_and_lists_together() {
        store().set("a", "1", Duration.ofMinutes(1));
        store().append("b", "x", Duration.ofMinutes(1));

        long removed = store().delete("a", "b", "c");

        assertThat(removed).isEqualTo(2);
        assertThat(store().get("a")).isEmpty();
        assertThat(store().range("b")).isEmpty();
    }

    @Test
    void lists_keep_arrival_order_and_share_one_expiry() {
        assertThat(store().append("buf", "hola", Duration.ofSeconds(90))).isEqualTo(1);
        assertThat(store().append("buf", "quiero", Duration.ofSeconds(90))).isEqualTo(2);
        assertThat(store().append("buf", "info", null)).isEqualTo(3);

        assertThat(store().range("buf")).containsExactly("hola", "quiero", "info");
        assertThat(store().size("buf")).isEqualTo(3);

        clock().advance(Duration.ofSeconds(91));

        assertThat(store().range("buf")).isEmpty();
        assertThat(store().append("buf", "again", Duration.ofSeconds(90))).isEqualTo(1);
    }

    @Test
    void expire_applies_to_lists() {
        store().append("buf", "a", Duration.ofSeconds(10));

        assertThat(store().expire("buf", Duration.ofMinutes(5))).isTrue();
        clock().advance(Duration.ofMinutes(1));

        assertThat(store().range("buf")).containsExactly("a");
    }

    @Test
    void trim_keeps_the_newest_items() {
        for (int i = 1; i <= 5; i++) {
            store().append("alerts", "alert-" + i, null);
        }

        store().trimToLast("alerts", 3);

        assertThat(store().range("alerts")).containsExactly("alert-3", "alert-4", "alert-5");
    }

    @Test
    void index_ranges_are_inclusive_ordered_and_capped() {
        store().addToIndex("idx", "c", 30);
        store().addToIndex("idx", "a", 10);
        store().addToIndex("idx", "b", 20);
        store().addToIndex("idx", "d", 40);
        store().addToIndex("other", "x", 20);

        assertThat(store().rangeByScore("idx", 10, 30, 10)).containsExactly("a", "b", "c");
        assertThat(store().rangeByScore("idx", 0, 100, 2)).containsExactly("a", "b");
        assertThat(store().rangeByScore("idx", 11, 19, 10)).isEmpty();
    }

    @Test
    void index_members_can_move_and_be_removed() {
        store().addToIndex("idx", "a", 10);
        store().addToIndex("idx", "b", 20);
        store().addToIndex("idx", "a", 30);

        assertThat(store().rangeByScore("idx", 0, 100, 10)).containsExactly("b", "a");

        assertThat(store().removeFromIndex("idx", "a")).isTrue();
        assertThat(store().removeFromIndex("idx", "a")).isFalse();
        assertThat(store().rangeByScore("idx", 0, 100, 10)).containsExactly("b");
    }

    @Test
    void purge_drops_only_expired_values() {
        store().set("old1", "x", Duration.ofSeconds(5));
        store().set("old2", "x", Duration.ofSeconds(5));
        store().set("live", "x", Duration.ofHours(1));

        clock().advance(Duration.ofSeconds(6));

        assertThat(store().purgeExpired()).isEqualTo(2);
        assertThat(store().get("live")).contains("x");
    }
}

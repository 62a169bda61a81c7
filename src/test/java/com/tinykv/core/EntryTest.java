package com.tinykv.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class EntryTest {

    @Test
    void constructor_copiesValue() {
        byte[] value = "hello".getBytes(StandardCharsets.UTF_8);
        Entry entry = new Entry(value, 1000, 0);

        value[0] = 'j';

        assertThat(entry.getValue()).isEqualTo("hello".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void getValue_returnsCopy() {
        Entry entry = new Entry("hello".getBytes(StandardCharsets.UTF_8), 1000, 0);

        entry.getValue()[0] = 'j';

        assertThat(entry.getValueUnsafe()).isEqualTo("hello".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void constructor_rejectsNullValue() {
        assertThatThrownBy(() -> new Entry(null, 1000, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_rejectsNegativeExpiration() {
        assertThatThrownBy(() -> new Entry(new byte[0], 1000, -5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isExpiredAt_noExpiration_neverExpires() {
        Entry entry = new Entry(new byte[]{1}, 1000, 0);

        assertThat(entry.hasTtl()).isFalse();
        assertThat(entry.isExpiredAt(Long.MAX_VALUE)).isFalse();
        assertThat(entry.getRemainingTtl(5000)).isEqualTo(-1);
    }

    @Test
    void isExpiredAt_expiresExactlyAtDeadline() {
        Entry entry = new Entry(new byte[]{1}, 1000, 2000);

        assertThat(entry.isExpiredAt(1999)).isFalse();
        assertThat(entry.isExpiredAt(2000)).isTrue();
        assertThat(entry.getRemainingTtl(1500)).isEqualTo(500);
        assertThat(entry.getRemainingTtl(2500)).isZero();
    }

    @Test
    void equals_comparesValueContent() {
        Entry a = new Entry("v".getBytes(StandardCharsets.UTF_8), 1000, 0);
        Entry b = new Entry("v".getBytes(StandardCharsets.UTF_8), 1000, 0);
        Entry c = new Entry("w".getBytes(StandardCharsets.UTF_8), 1000, 0);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
    }
}

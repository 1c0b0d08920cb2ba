package com.demo.tokenauth.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class InMemoryRevocationStoreTest {

    private final InMemoryRevocationStore store = new InMemoryRevocationStore();

    @Test
    void insertThenExists() {
        assertThat(store.exists("jti-1")).isFalse();

        store.insert("jti-1");

        assertThat(store.exists("jti-1")).isTrue();
        assertThat(store.exists("jti-2")).isFalse();
    }

    @Test
    void insertIsIdempotent() {
        store.insert("jti-1");
        store.insert("jti-1");

        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void deleteRemovesKey() {
        store.insert("jti-1");

        store.delete("jti-1");
        store.delete("missing");

        assertThat(store.exists("jti-1")).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    void rejectsBlankKeys() {
        assertThatThrownBy(() -> store.insert(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.exists(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.delete("")).isInstanceOf(IllegalArgumentException.class);
    }
}

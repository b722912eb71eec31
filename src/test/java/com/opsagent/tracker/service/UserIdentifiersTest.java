package com.opsagent.tracker.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UserIdentifiersTest {

    @Test
    void knownPrefixesAreKeys() {
        assertThat(UserIdentifiers.looksLikeUserKey("user_42")).isTrue();
        assertThat(UserIdentifiers.looksLikeUserKey("ou_1f2e")).isTrue();
    }

    @Test
    void opaqueAlphanumericsAreKeys() {
        assertThat(UserIdentifiers.looksLikeUserKey("7301588312")).isTrue();
        assertThat(UserIdentifiers.looksLikeUserKey("a1b2-c3d4_e5")).isTrue();
    }

    @Test
    void namesAndEmailsAreNotKeys() {
        assertThat(UserIdentifiers.looksLikeUserKey("张三")).isFalse();
        assertThat(UserIdentifiers.looksLikeUserKey("John Smith")).isFalse();
        assertThat(UserIdentifiers.looksLikeUserKey("zhang.san@example.com")).isFalse();
        assertThat(UserIdentifiers.looksLikeUserKey("bob")).isFalse();
        assertThat(UserIdentifiers.looksLikeUserKey("")).isFalse();
        assertThat(UserIdentifiers.looksLikeUserKey(null)).isFalse();
    }
}

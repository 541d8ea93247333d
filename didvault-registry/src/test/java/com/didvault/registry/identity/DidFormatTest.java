package com.didvault.registry.identity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DidFormatTest {

    @Test
    void acceptsBoundaryLengths() {
        assertThat(DidFormat.isValid("did:stx:a")).isTrue();
        assertThat(DidFormat.isValid("did:stx:" + "a".repeat(92))).isTrue();
    }

    @Test
    void rejectsOverlongAndBarePrefix() {
        assertThat(DidFormat.isValid("did:stx:" + "a".repeat(93))).isFalse();
        assertThat(DidFormat.isValid("did:stx:")).isFalse();
        assertThat(DidFormat.isValid("")).isFalse();
        assertThat(DidFormat.isValid(null)).isFalse();
    }

    @Test
    void credentialFormat_boundaries() {
        assertThat(CredentialFormat.isValid("x")).isTrue();
        assertThat(CredentialFormat.isValid("x".repeat(200))).isTrue();
        assertThat(CredentialFormat.isValid("x".repeat(201))).isFalse();
        assertThat(CredentialFormat.isValid("")).isFalse();
        assertThat(CredentialFormat.isValid(null)).isFalse();
    }
}

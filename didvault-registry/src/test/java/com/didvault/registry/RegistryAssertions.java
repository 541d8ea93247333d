package com.didvault.registry;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Shared assertions for registry rejections.
 */
public final class RegistryAssertions {

    private RegistryAssertions() {
    }

    public static void assertRejected(ThrowingCallable call, RegistryErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOf(RegistryException.class)
                .extracting(e -> ((RegistryException) e).getErrorCode())
                .isEqualTo(expected);
    }
}

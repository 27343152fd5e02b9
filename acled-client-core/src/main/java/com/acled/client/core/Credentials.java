package com.acled.client.core;

import java.util.Objects;

/** Access key and the e-mail address it was registered to; sent as {@code key} and {@code email} on every request. */
public record Credentials(String key, String email) {

    public Credentials {
        requireText(key, "key");
        requireText(email, "email");
    }

    private static void requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
    }

    @Override
    public String toString() {
        return "Credentials[key=***, email=" + email + "]";
    }
}

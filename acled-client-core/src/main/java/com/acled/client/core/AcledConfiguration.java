package com.acled.client.core;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Settings shared by every request of an {@link AcledApi}.
 *
 * @param baseUrl scheme and host of the API, without endpoint path
 * @param credentials access key and e-mail
 * @param pageSize rows per page; used both to request pages and to detect the last one
 */
public record AcledConfiguration(String baseUrl, Credentials credentials, int pageSize) {
    public static final String DEFAULT_BASE_URL = "https://api.acleddata.com";
    /** Row limit the API applies when no {@code limit} parameter is sent. */
    public static final int DEFAULT_PAGE_SIZE = 5000;

    public static final String PROP_BASE_URL = "acled.api.url";
    public static final String ENV_BASE_URL = "ACLED_API_URL";
    public static final String PROP_KEY = "acled.api.key";
    public static final String ENV_KEY = "ACLED_API_KEY";
    public static final String PROP_EMAIL = "acled.api.email";
    public static final String ENV_EMAIL = "ACLED_API_EMAIL";

    public AcledConfiguration {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(credentials, "credentials");
        if (baseUrl.isBlank()) throw new IllegalArgumentException("baseUrl must not be blank");
        if (pageSize <= 0) throw new IllegalArgumentException("Page size must be positive. Provided: " + pageSize);
    }

    public static AcledConfiguration of(Credentials credentials) {
        return new AcledConfiguration(DEFAULT_BASE_URL, credentials, DEFAULT_PAGE_SIZE);
    }

    /** Resolves every setting from system properties first, then environment variables. */
    public static AcledConfiguration fromEnvironment() {
        return resolve(System::getProperty, System::getenv);
    }

    static AcledConfiguration resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        String baseUrl = lookup(properties, environment, PROP_BASE_URL, ENV_BASE_URL);
        String key = lookup(properties, environment, PROP_KEY, ENV_KEY);
        String email = lookup(properties, environment, PROP_EMAIL, ENV_EMAIL);
        if (key == null || email == null) {
            throw new IllegalStateException("ACLED credentials missing: set " + PROP_KEY + "/" + ENV_KEY + " and "
                    + PROP_EMAIL + "/" + ENV_EMAIL);
        }
        return new AcledConfiguration(
                baseUrl != null ? baseUrl : DEFAULT_BASE_URL, new Credentials(key, email), DEFAULT_PAGE_SIZE);
    }

    public AcledConfiguration withBaseUrl(String baseUrl) {
        return new AcledConfiguration(baseUrl, credentials, pageSize);
    }

    public AcledConfiguration withPageSize(int pageSize) {
        return new AcledConfiguration(baseUrl, credentials, pageSize);
    }

    /** {@code true} when requests must carry an explicit {@code limit} parameter. */
    public boolean customPageSize() {
        return pageSize != DEFAULT_PAGE_SIZE;
    }

    private static String lookup(
            UnaryOperator<String> properties, UnaryOperator<String> environment, String prop, String env) {
        String sys = properties.apply(prop);
        if (sys != null && !sys.isBlank()) return sys.trim();
        String fromEnv = environment.apply(env);
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv.trim();
        return null;
    }
}

package com.acled.client.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;

class ApiTransportTest {

    @Test
    void endpointUrlAppendsReadSuffix() {
        assertThat(ApiTransport.endpointUrl("https://api.acleddata.com", "acled"))
                .isEqualTo("https://api.acleddata.com/acled/read");
        assertThat(ApiTransport.endpointUrl("https://api.acleddata.com/", "/deleted"))
                .isEqualTo("https://api.acleddata.com/deleted/read");
    }

    @Test
    void buildUriKeepsParameterOrderAndEncodes() {
        URI uri = ApiTransport.buildUri(
                "https://api.acleddata.com",
                "acled",
                List.of(
                        QueryParameter.of("event_date_where", "BETWEEN"),
                        QueryParameter.of("event_date", "2024-01-01|2024-02-01"),
                        QueryParameter.of("country", "Burkina Faso")));

        assertThat(uri.getRawQuery())
                .isEqualTo("event_date_where=BETWEEN&event_date=2024-01-01%7C2024-02-01&country=Burkina%20Faso");
        assertThat(uri.getQuery())
                .isEqualTo("event_date_where=BETWEEN&event_date=2024-01-01|2024-02-01&country=Burkina Faso");
        assertThat(uri.getPath()).isEqualTo("/acled/read");
    }

    @Test
    void buildUriWithoutParametersHasNoQuery() {
        URI uri = ApiTransport.buildUri("http://localhost:8080", "acled", List.of());
        assertThat(uri.toString()).isEqualTo("http://localhost:8080/acled/read");
    }

    @Test
    void describeMasksCredentials() {
        String described = ApiTransport.describe(List.of(
                QueryParameter.of("year", "2022"),
                QueryParameter.of("key", "secret"),
                QueryParameter.of("email", "me@example.com")));
        assertThat(described).isEqualTo("[year=2022, key=***, email=***]");
    }

    @Test
    void parameterRejectsNulls() {
        assertThatThrownBy(() -> QueryParameter.of(null, "x")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> QueryParameter.of("x", null)).isInstanceOf(NullPointerException.class);
    }
}

package com.acled.client.core.response;

import com.acled.client.core.exception.AcledException;
import com.acled.client.core.exception.ApiErrorException;
import com.acled.client.core.exception.EnvelopeContractException;
import com.acled.client.core.exception.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes one page body into typed records.
 * <p>
 * The API does not tag its envelopes, so the body is matched against the data shape first and against the error
 * shape second. A body that fits neither, or whose {@code success}/{@code count} fields disagree with the payload,
 * raises {@link EnvelopeContractException}.
 */
public final class ResponseEnvelopeDecoder {
    static final String SUCCESS = "success";
    static final String COUNT = "count";
    static final String DATA = "data";
    static final String ERROR = "error";
    static final String MESSAGE = "message";

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final ObjectMapper mapper;

    public ResponseEnvelopeDecoder() {
        this(defaultMapper());
    }

    public ResponseEnvelopeDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /** Raw record types declare for themselves which columns they skip. */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper();
    }

    /**
     * Converts every record of a data envelope, or throws.
     *
     * @throws ApiErrorException for an error envelope
     * @throws com.acled.client.core.exception.FieldParseException for the first record field that does not parse;
     *     the rest of the page is discarded
     * @throws TransportException if the body is empty or not JSON
     * @throws EnvelopeContractException if the body breaks the envelope contract
     */
    public <R, T> List<T> decode(byte[] body, Class<R> rawType, RecordConverter<R, T> converter)
            throws AcledException {
        Envelope<R> envelope = parse(body, rawType);
        if (envelope instanceof Envelope.Failure<R> failure) {
            throw new ApiErrorException(failure.message());
        }
        List<R> data = ((Envelope.Data<R>) envelope).data();
        List<T> records = new ArrayList<>(data.size());
        for (R raw : data) {
            records.add(converter.convert(raw));
        }
        return records;
    }

    /** Matches the body against the data shape, then the error shape, and checks the integrity fields. */
    public <R> Envelope<R> parse(byte[] body, Class<R> rawType) throws TransportException {
        JsonNode root = readTree(body);

        Optional<Envelope.Data<R>> data = dataShape(root, rawType);
        if (data.isPresent()) {
            Envelope.Data<R> d = data.get();
            if (!d.success()) {
                throw new EnvelopeContractException("Data envelope reports success=false");
            }
            if (d.count() != d.data().size()) {
                throw new EnvelopeContractException(
                        "Data envelope count " + d.count() + " does not match " + d.data().size() + " records");
            }
            return d;
        }

        Optional<Envelope.Failure<R>> failure = failureShape(root);
        if (failure.isPresent()) {
            Envelope.Failure<R> f = failure.get();
            if (f.success()) {
                throw new EnvelopeContractException("Error envelope reports success=true");
            }
            if (f.count() != 0) {
                throw new EnvelopeContractException("Error envelope count must be 0, was " + f.count());
            }
            return f;
        }

        throw new EnvelopeContractException("Response matches neither the data nor the error envelope");
    }

    private JsonNode readTree(byte[] body) throws TransportException {
        if (body == null || body.length == 0) {
            throw new TransportException("Empty response body", null);
        }
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new TransportException("Response body is not valid JSON", e);
        }
    }

    private <R> Optional<Envelope.Data<R>> dataShape(JsonNode root, Class<R> rawType) {
        Optional<Boolean> success = success(root);
        Optional<Long> count = count(root);
        JsonNode data = root.get(DATA);
        if (success.isEmpty() || count.isEmpty() || data == null || !data.isArray()) {
            return Optional.empty();
        }
        List<R> records = new ArrayList<>(data.size());
        for (JsonNode element : data) {
            R raw;
            try {
                raw = element.isObject() ? mapper.treeToValue(element, rawType) : null;
            } catch (JsonProcessingException e) {
                // element does not bind: not a data envelope
                return Optional.empty();
            }
            if (raw == null) return Optional.empty();
            records.add(raw);
        }
        return Optional.of(new Envelope.Data<>(success.get(), count.get(), records));
    }

    private <R> Optional<Envelope.Failure<R>> failureShape(JsonNode root) {
        Optional<Boolean> success = success(root);
        Optional<Long> count = count(root);
        JsonNode message = root.path(ERROR).path(MESSAGE);
        if (success.isEmpty() || count.isEmpty() || root.has(DATA) || !message.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(new Envelope.Failure<>(success.get(), count.get(), message.asText()));
    }

    private static Optional<Boolean> success(JsonNode root) {
        JsonNode node = root.get(SUCCESS);
        return node != null && node.isBoolean() ? Optional.of(node.booleanValue()) : Optional.empty();
    }

    /** The API is not consistent about numeric types; {@code count} may arrive as a number or as digits. */
    private static Optional<Long> count(JsonNode root) {
        JsonNode node = root.get(COUNT);
        if (node == null) return Optional.empty();
        if (node.isIntegralNumber() && node.canConvertToLong() && node.longValue() >= 0) {
            return Optional.of(node.longValue());
        }
        if (node.isTextual() && DIGITS.matcher(node.textValue()).matches()) {
            try {
                return Optional.of(Long.parseLong(node.textValue()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}

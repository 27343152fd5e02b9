package com.acled.client.core.response;

import java.util.List;

/** The two shapes a page response can take. Neither carries a type tag; see {@link ResponseEnvelopeDecoder}. */
public sealed interface Envelope<R> permits Envelope.Data, Envelope.Failure {

    boolean success();

    long count();

    /** {@code {"success": true, "count": n, "data": [...]}} */
    record Data<R>(boolean success, long count, List<R> data) implements Envelope<R> {
        public Data {
            data = List.copyOf(data);
        }
    }

    /** {@code {"success": false, "count": 0, "error": {"message": "..."}}} */
    record Failure<R>(boolean success, long count, String message) implements Envelope<R> {}
}

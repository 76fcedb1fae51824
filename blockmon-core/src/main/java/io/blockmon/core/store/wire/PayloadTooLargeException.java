package io.blockmon.core.store.wire;

import io.blockmon.core.store.StoreException;

/** A message body, raw or after gunzip, is larger than the reader accepts. */
public class PayloadTooLargeException extends StoreException {

    private final long limit;

    public PayloadTooLargeException(long limit) {
        super("Body exceeds " + limit + " bytes");
        this.limit = limit;
    }

    public long limit() {
        return limit;
    }
}

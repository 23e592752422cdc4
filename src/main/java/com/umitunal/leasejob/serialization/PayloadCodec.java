package com.umitunal.leasejob.serialization;

/**
 * Encodes job payloads into the opaque bytes kept in a job document, and back.
 *
 * @param <T> the type of payload
 */
public interface PayloadCodec<T> {

    /**
     * Encode a payload to bytes.
     *
     * @throws PayloadCodecException if the payload cannot be encoded
     */
    byte[] encode(T payload);

    /**
     * Decode bytes to a payload.
     *
     * @throws PayloadCodecException if the bytes do not hold a valid payload
     */
    T decode(byte[] bytes);
}

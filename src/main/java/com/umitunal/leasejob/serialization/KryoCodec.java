package com.umitunal.leasejob.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.io.ByteArrayOutputStream;
import java.util.function.Supplier;

/**
 * Compact binary payload codec using Kryo.
 * Kryo instances are not thread-safe, so each thread gets its own.
 *
 * @param <T> the payload type
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this(type, KryoCodec::defaultKryo);
    }

    /**
     * Create a Kryo codec with custom Kryo instance configuration,
     * e.g. with class registration required.
     */
    public KryoCodec(Class<T> type, Supplier<Kryo> factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory);
    }

    @Override
    public byte[] encode(T payload) {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeObject(output, payload);
            output.flush();
            return baos.toByteArray();
        } catch (KryoException | IllegalArgumentException e) {
            // unregistered classes surface as IllegalArgumentException
            throw new PayloadCodecException("Failed to write " + type.getSimpleName() + " with Kryo", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (KryoException | IllegalArgumentException e) {
            throw new PayloadCodecException("Failed to read " + type.getSimpleName() + " with Kryo", e);
        }
    }

    static Kryo defaultKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);
        return kryo;
    }
}

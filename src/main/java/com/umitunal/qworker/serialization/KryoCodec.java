package com.umitunal.qworker.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.io.ByteArrayOutputStream;

/**
 * Compact binary payload serialization using Kryo.
 *
 * The concrete class is written along with the object, so the codec also works
 * for interface-typed payloads such as {@code Map<String, Object>}.
 *
 * @param <T> the type to serialize
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this(type, KryoCodec::defaultKryo);
    }

    /**
     * Create a Kryo codec with custom Kryo instance configuration.
     */
    public KryoCodec(Class<T> type, KryoFactory factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory::create);
    }

    @Override
    public byte[] encode(T payload) {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeClassAndObject(output, payload);
            output.flush();
            return baos.toByteArray();
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            Object value = kryo.readClassAndObject(input);
            if (value != null && !type.isInstance(value)) {
                throw new IllegalStateException(
                        "Decoded " + value.getClass().getName() + ", expected " + type.getName());
            }
            return type.cast(value);
        }
    }

    /**
     * Unregistered classes allowed, references tracked for shared nested values.
     */
    public static Kryo defaultKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);
        return kryo;
    }

    /**
     * Factory interface for custom Kryo configuration.
     */
    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }
}

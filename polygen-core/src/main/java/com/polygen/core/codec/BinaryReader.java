package com.polygen.core.codec;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads values written by {@link BinaryWriter}.
 *
 * <p>Truncated input raises {@link EOFException}; invalid UTF-8 raises
 * {@link CharacterCodingException}.
 */
public class BinaryReader {

    private final InputStream in;

    public BinaryReader(InputStream in) {
        this.in = Objects.requireNonNull(in, "in must not be null");
    }

    /**
     * Reads one element of an array or optional.
     *
     * @param <T> element type
     */
    @FunctionalInterface
    public interface ValueReader<T> {
        T read(BinaryReader reader) throws IOException;
    }

    public boolean readBool() throws IOException {
        return readRawByte() != 0;
    }

    public byte readI8() throws IOException {
        return (byte) readRawByte();
    }

    public int readU8() throws IOException {
        return readRawByte();
    }

    public short readI16() throws IOException {
        return buffer(Short.BYTES).getShort();
    }

    public int readU16() throws IOException {
        return Short.toUnsignedInt(readI16());
    }

    public int readI32() throws IOException {
        return buffer(Integer.BYTES).getInt();
    }

    public long readU32() throws IOException {
        return Integer.toUnsignedLong(readI32());
    }

    public long readI64() throws IOException {
        return buffer(Long.BYTES).getLong();
    }

    /**
     * Reads a u64 as its two's-complement bit pattern.
     */
    public long readU64() throws IOException {
        return readI64();
    }

    public float readF32() throws IOException {
        return buffer(Float.BYTES).getFloat();
    }

    public double readF64() throws IOException {
        return buffer(Double.BYTES).getDouble();
    }

    public String readString() throws IOException {
        byte[] bytes = readBytes();
        if (bytes.length == 0) {
            return "";
        }
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }

    public byte[] readBytes() throws IOException {
        return readExactly(lengthPrefix());
    }

    public int readEnum() throws IOException {
        return readI32();
    }

    public Instant readTimestamp() throws IOException {
        return Instant.ofEpochMilli(readI64());
    }

    /**
     * Reads an optional value.
     *
     * @return the value, or null when the presence flag is 0
     */
    public <T> T readOptional(ValueReader<T> elementReader) throws IOException {
        if (readRawByte() == 0) {
            return null;
        }
        return elementReader.read(this);
    }

    public <T> List<T> readArray(ValueReader<T> elementReader) throws IOException {
        int count = lengthPrefix();
        List<T> values = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            values.add(elementReader.read(this));
        }
        return values;
    }

    private int lengthPrefix() throws IOException {
        long length = readU32();
        if (length > Integer.MAX_VALUE) {
            throw new IOException("Length " + length + " exceeds the supported maximum");
        }
        return (int) length;
    }

    private int readRawByte() throws IOException {
        int value = in.read();
        if (value < 0) {
            throw new EOFException("Unexpected end of input");
        }
        return value;
    }

    private ByteBuffer buffer(int size) throws IOException {
        return ByteBuffer.wrap(readExactly(size)).order(ByteOrder.LITTLE_ENDIAN);
    }

    private byte[] readExactly(int size) throws IOException {
        byte[] bytes = in.readNBytes(size);
        if (bytes.length < size) {
            throw new EOFException("Expected " + size + " bytes, got " + bytes.length);
        }
        return bytes;
    }
}

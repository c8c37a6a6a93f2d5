package com.polygen.core.codec;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Writes values in the generated wire format.
 *
 * <p>All numbers are little-endian. Strings and byte arrays carry a u32 byte count,
 * arrays a u32 element count, optionals a one-byte presence flag. Enums are written as
 * their i32 value and timestamps as i64 epoch milliseconds.
 */
public class BinaryWriter {

    private static final long MAX_U32 = 0xFFFF_FFFFL;

    private final OutputStream out;
    private final ByteBuffer scratch = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);

    public BinaryWriter(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    /**
     * Writes one element of an array or optional.
     *
     * @param <T> element type
     */
    @FunctionalInterface
    public interface ValueWriter<T> {
        void write(BinaryWriter writer, T value) throws IOException;
    }

    public void writeBool(boolean value) throws IOException {
        out.write(value ? 1 : 0);
    }

    public void writeI8(byte value) throws IOException {
        out.write(value);
    }

    public void writeU8(int value) throws IOException {
        checkRange(value, 0, 0xFF, "u8");
        out.write(value);
    }

    public void writeI16(short value) throws IOException {
        scratch.clear();
        scratch.putShort(value);
        flushScratch();
    }

    public void writeU16(int value) throws IOException {
        checkRange(value, 0, 0xFFFF, "u16");
        writeI16((short) value);
    }

    public void writeI32(int value) throws IOException {
        scratch.clear();
        scratch.putInt(value);
        flushScratch();
    }

    public void writeU32(long value) throws IOException {
        checkRange(value, 0, MAX_U32, "u32");
        writeI32((int) value);
    }

    public void writeI64(long value) throws IOException {
        scratch.clear();
        scratch.putLong(value);
        flushScratch();
    }

    /**
     * Writes a u64 given as its two's-complement bit pattern.
     */
    public void writeU64(long bits) throws IOException {
        writeI64(bits);
    }

    public void writeF32(float value) throws IOException {
        scratch.clear();
        scratch.putFloat(value);
        flushScratch();
    }

    public void writeF64(double value) throws IOException {
        scratch.clear();
        scratch.putDouble(value);
        flushScratch();
    }

    /**
     * Writes a UTF-8 string with its u32 byte count. Null is written as the empty string.
     */
    public void writeString(String value) throws IOException {
        writeBytes(value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8));
    }

    public void writeBytes(byte[] value) throws IOException {
        byte[] bytes = value == null ? new byte[0] : value;
        writeU32(bytes.length);
        out.write(bytes);
    }

    public void writeEnum(int value) throws IOException {
        writeI32(value);
    }

    public void writeTimestamp(Instant value) throws IOException {
        writeI64(value.toEpochMilli());
    }

    public <T> void writeOptional(T value, ValueWriter<T> elementWriter) throws IOException {
        if (value == null) {
            out.write(0);
            return;
        }
        out.write(1);
        elementWriter.write(this, value);
    }

    public <T> void writeArray(List<T> values, ValueWriter<T> elementWriter) throws IOException {
        List<T> list = values == null ? List.of() : values;
        writeU32(list.size());
        for (T value : list) {
            elementWriter.write(this, value);
        }
    }

    public void flush() throws IOException {
        out.flush();
    }

    private void flushScratch() throws IOException {
        out.write(scratch.array(), 0, scratch.position());
    }

    private static void checkRange(long value, long min, long max, String type) {
        if (value < min || value > max) {
            throw new IllegalArgumentException("Value " + value + " out of range for " + type);
        }
    }
}

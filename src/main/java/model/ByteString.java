package model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 바이너리 안전한 불변 바이트 문자열.
 * 저장소의 키와 값, RESP bulk string 페이로드로 사용됩니다.
 */
public final class ByteString {

    public static final ByteString EMPTY = new ByteString(new byte[0]);

    private final byte[] bytes;
    private int hash;

    private ByteString(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * 배열을 복사해서 감쌉니다.
     */
    public static ByteString copyOf(byte[] source) {
        return copyOf(source, 0, source.length);
    }

    public static ByteString copyOf(byte[] source, int offset, int length) {
        if (length == 0) {
            return EMPTY;
        }
        return new ByteString(Arrays.copyOfRange(source, offset, offset + length));
    }

    public static ByteString of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return new ByteString(value.getBytes(StandardCharsets.UTF_8));
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    /**
     * 내부 배열의 복사본을 반환합니다.
     */
    public byte[] toByteArray() {
        return bytes.clone();
    }

    /**
     * 복사 없이 출력 스트림 등에 쓰기 위한 접근자. 반환된 배열을 수정하면 안 됩니다.
     */
    public byte[] unsafeArray() {
        return bytes;
    }

    public String toUtf8() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ByteString that = (ByteString) o;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0 && bytes.length > 0) {
            h = Arrays.hashCode(bytes);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return toUtf8();
    }
}

package protocol;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * 연결별 읽기 버퍼.
 * readerIndex 앞쪽은 이미 소비된 바이트, readerIndex와 writerIndex 사이는 아직 디코딩되지 않은 바이트입니다.
 */
public class RespBuffer {

    public static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final int maxCapacity;
    private byte[] data;
    private int readerIndex;
    private int writerIndex;

    public RespBuffer(int initialCapacity) {
        this(initialCapacity, MAX_CAPACITY);
    }

    public RespBuffer(int initialCapacity, int maxCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
        }
        if (maxCapacity < initialCapacity || maxCapacity > MAX_CAPACITY) {
            throw new IllegalArgumentException("maxCapacity out of range: " + maxCapacity);
        }
        this.maxCapacity = maxCapacity;
        this.data = new byte[initialCapacity];
    }

    public int readerIndex() {
        return readerIndex;
    }

    public int writerIndex() {
        return writerIndex;
    }

    public int readableBytes() {
        return writerIndex - readerIndex;
    }

    public int capacity() {
        return data.length;
    }

    byte getByte(int index) {
        if (index < readerIndex || index >= writerIndex) {
            throw new IndexOutOfBoundsException("index " + index + " outside [" + readerIndex + ", " + writerIndex + ")");
        }
        return data[index];
    }

    byte[] array() {
        return data;
    }

    /**
     * 디코딩이 끝난 프레임 뒤로 커서를 옮깁니다.
     */
    void advanceTo(int newReaderIndex) {
        if (newReaderIndex < readerIndex || newReaderIndex > writerIndex) {
            throw new IndexOutOfBoundsException("reader index " + newReaderIndex + " outside [" + readerIndex + ", " + writerIndex + "]");
        }
        readerIndex = newReaderIndex;
    }

    public void append(byte[] src) {
        append(src, 0, src.length);
    }

    public void append(byte[] src, int offset, int length) {
        if (!ensureWritable(length)) {
            throw new IllegalStateException("read buffer cannot grow beyond " + maxCapacity + " bytes");
        }
        System.arraycopy(src, offset, data, writerIndex, length);
        writerIndex += length;
    }

    /**
     * 스트림에서 한 번 읽어 버퍼 끝에 덧붙입니다.
     * @return 읽은 바이트 수, 스트림이 닫혔으면 -1
     * @throws RespProtocolException 아직 디코딩되지 않은 프레임이 최대 크기를 넘어 더 읽을 공간이 없을 때
     */
    public int readFrom(InputStream in) throws IOException {
        if (writerIndex == data.length
                && !ensureWritable(Math.max(1, data.length / 2))
                && !ensureWritable(1)) {
            throw new RespProtocolException("frame exceeds read buffer limit");
        }
        int n = in.read(data, writerIndex, data.length - writerIndex);
        if (n > 0) {
            writerIndex += n;
        }
        return n;
    }

    /**
     * 소비된 바이트를 버립니다. 남은 바이트는 배열 앞쪽으로 이동합니다.
     */
    public void discardReadBytes() {
        if (readerIndex == 0) {
            return;
        }
        int remaining = readableBytes();
        if (remaining > 0) {
            System.arraycopy(data, readerIndex, data, 0, remaining);
        }
        readerIndex = 0;
        writerIndex = remaining;
    }

    public byte[] readableCopy() {
        return Arrays.copyOfRange(data, readerIndex, writerIndex);
    }

    private boolean ensureWritable(int length) {
        if (data.length - writerIndex >= length) {
            return true;
        }
        discardReadBytes();
        if (data.length - writerIndex >= length) {
            return true;
        }
        long required = (long) writerIndex + length;
        if (required > maxCapacity) {
            return false;
        }
        int newCapacity = data.length;
        while (newCapacity < required) {
            newCapacity = (int) Math.min((long) newCapacity << 1, maxCapacity);
        }
        data = Arrays.copyOf(data, newCapacity);
        return true;
    }
}

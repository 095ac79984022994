package protocol;

import model.ByteString;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RespBuffer에서 RESP 값을 하나씩 꺼내는 디코더.
 *
 * <p>decode()는 세 가지 결과 중 하나를 냅니다.
 * <ul>
 *   <li>성공: 값을 반환하고 버퍼 커서를 프레임 끝으로 옮깁니다.</li>
 *   <li>데이터 부족: null을 반환하고 버퍼는 전혀 건드리지 않습니다.</li>
 *   <li>문법 오류: {@link RespProtocolException}을 던지며 이때도 커서는 그대로입니다.</li>
 * </ul>
 * 배열은 원소를 모두 읽을 수 있을 때만 한 번에 소비됩니다. 중간까지만 도착한 배열은 다음 읽기 후 처음부터 다시 파싱합니다.
 */
public class RespDecoder {

    public static final long DEFAULT_MAX_BULK_LENGTH = 512L * 1024 * 1024;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int MAX_NESTING_DEPTH = 128;
    // 헤더와 CRLF를 포함한 프레임 전체가 읽기 버퍼에 들어가야 한다
    public static final int MAX_BULK_LENGTH_LIMIT = RespBuffer.MAX_CAPACITY - 64;
    public static final int MAX_TEXT_LINE = 64 * 1024;

    // "-9223372036854775808" 길이
    private static final int MAX_NUMBER_LINE = 20;

    private final long maxBulkLength;
    private final int maxArrayLength;

    public RespDecoder() {
        this(DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_ARRAY_LENGTH);
    }

    public RespDecoder(long maxBulkLength, int maxArrayLength) {
        this.maxBulkLength = Math.min(maxBulkLength, MAX_BULK_LENGTH_LIMIT);
        this.maxArrayLength = maxArrayLength;
    }

    /**
     * 버퍼의 현재 커서 위치에서 값 하나를 디코딩합니다.
     * @return 디코딩된 값, 바이트가 부족하면 null
     */
    public RespValue decode(RespBuffer buffer) throws RespProtocolException {
        if (buffer.readableBytes() == 0) {
            return null;
        }
        Cursor cursor = new Cursor(buffer);
        RespValue value = parseValue(cursor, 0);
        if (value == null) {
            return null;
        }
        buffer.advanceTo(cursor.position);
        return value;
    }

    private RespValue parseValue(Cursor cursor, int depth) throws RespProtocolException {
        if (!cursor.hasRemaining()) {
            return null;
        }
        byte prefix = cursor.next();
        RespType type = RespType.fromPrefix(prefix);
        if (type == null) {
            throw new RespProtocolException("unknown type byte " + describe(prefix));
        }

        switch (type) {
            case SIMPLE_STRING: {
                String line = readTextLine(cursor);
                return line == null ? null : new RespSimpleString(line);
            }
            case ERROR: {
                String line = readTextLine(cursor);
                return line == null ? null : new RespError(line);
            }
            case INTEGER: {
                Long value = readNumberLine(cursor, "invalid integer");
                return value == null ? null : new RespInteger(value);
            }
            case BULK_STRING:
                return parseBulkString(cursor);
            case ARRAY:
                return parseArray(cursor, depth);
            default:
                throw new IllegalStateException("unhandled type " + type);
        }
    }

    private RespValue parseBulkString(Cursor cursor) throws RespProtocolException {
        Long length = readNumberLine(cursor, "invalid bulk length");
        if (length == null) {
            return null;
        }
        if (length < 0) {
            return RespBulkString.NULL;
        }
        if (length > maxBulkLength) {
            throw new RespProtocolException("bulk length exceeds limit");
        }
        // 페이로드 + CRLF가 전부 도착하기 전에는 복사하지 않는다
        if (cursor.remaining() < length + 2) {
            return null;
        }
        int start = cursor.position;
        int end = start + length.intValue();
        if (cursor.byteAt(end) != '\r' || cursor.byteAt(end + 1) != '\n') {
            throw new RespProtocolException("expected CRLF after bulk payload");
        }
        ByteString payload = ByteString.copyOf(cursor.buffer.array(), start, length.intValue());
        cursor.position = end + 2;
        return new RespBulkString(payload);
    }

    private RespValue parseArray(Cursor cursor, int depth) throws RespProtocolException {
        Long count = readNumberLine(cursor, "invalid multibulk length");
        if (count == null) {
            return null;
        }
        if (count < 0) {
            return RespArray.NULL;
        }
        if (count > maxArrayLength) {
            throw new RespProtocolException("multibulk length exceeds limit");
        }
        if (count > 0 && depth + 1 > MAX_NESTING_DEPTH) {
            throw new RespProtocolException("nesting too deep");
        }
        int size = count.intValue();
        // 도착하지 않은 원소 수만큼 미리 할당하지 않도록 상한을 둔다
        List<RespValue> elements = new ArrayList<>(Math.min(size, 16));
        for (int i = 0; i < size; i++) {
            RespValue element = parseValue(cursor, depth + 1);
            if (element == null) {
                return null;
            }
            elements.add(element);
        }
        return new RespArray(elements);
    }

    /**
     * CRLF로 끝나는 텍스트 줄을 읽습니다. 줄 안에 CR이나 LF가 단독으로 나오거나 64KiB 안에 CRLF가 없으면 문법 오류입니다.
     */
    private String readTextLine(Cursor cursor) throws RespProtocolException {
        int start = cursor.position;
        int end = findLineEnd(cursor, start, MAX_TEXT_LINE, "invalid line");
        if (end < 0) {
            return null;
        }
        cursor.position = end + 2;
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(cursor.buffer.array(), start, end - start))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new RespProtocolException("invalid UTF-8 in line");
        }
    }

    /**
     * 부호 있는 10진수 한 줄을 읽습니다. 20바이트 안에 CRLF가 없으면 뒤를 기다리지 않고 오류로 처리합니다.
     */
    private Long readNumberLine(Cursor cursor, String error) throws RespProtocolException {
        int start = cursor.position;
        int end = findLineEnd(cursor, start, MAX_NUMBER_LINE, error);
        if (end < 0) {
            return null;
        }
        if (end == start) {
            throw new RespProtocolException(error);
        }
        boolean negative = cursor.byteAt(start) == '-';
        int digitsStart = negative ? start + 1 : start;
        if (digitsStart == end) {
            throw new RespProtocolException(error);
        }
        long value = 0;
        for (int i = digitsStart; i < end; i++) {
            byte b = cursor.byteAt(i);
            if (b < '0' || b > '9') {
                throw new RespProtocolException(error);
            }
            int digit = b - '0';
            // 음수 쪽으로 누적해서 Long.MIN_VALUE까지 표현한다
            if (value < (Long.MIN_VALUE + digit) / 10) {
                throw new RespProtocolException(error);
            }
            value = value * 10 - digit;
        }
        if (!negative) {
            if (value == Long.MIN_VALUE) {
                throw new RespProtocolException(error);
            }
            value = -value;
        }
        cursor.position = end + 2;
        return value;
    }

    /**
     * start부터 CR 위치를 찾습니다. CR 뒤에 LF가 아직 없으면 -1을 반환합니다.
     * maxLength 안에서 CR을 찾지 못하거나 단독 LF, CR 뒤의 다른 바이트를 만나면 오류입니다.
     */
    private int findLineEnd(Cursor cursor, int start, int maxLength, String error) throws RespProtocolException {
        int limit = cursor.limit();
        for (int i = start; i < limit; i++) {
            byte b = cursor.byteAt(i);
            if (b == '\r') {
                if (i + 1 >= limit) {
                    return -1;
                }
                if (cursor.byteAt(i + 1) != '\n') {
                    throw new RespProtocolException(error);
                }
                return i;
            }
            if (b == '\n' || i - start >= maxLength) {
                throw new RespProtocolException(error);
            }
        }
        return -1;
    }

    private static String describe(byte b) {
        if (b >= 0x20 && b < 0x7F) {
            return "'" + (char) b + "'";
        }
        return String.format("0x%02x", b & 0xFF);
    }

    /**
     * 한 번의 decode 호출 동안만 쓰는 읽기 위치. 성공했을 때만 버퍼에 반영됩니다.
     */
    private static final class Cursor {
        private final RespBuffer buffer;
        private int position;

        Cursor(RespBuffer buffer) {
            this.buffer = buffer;
            this.position = buffer.readerIndex();
        }

        boolean hasRemaining() {
            return position < buffer.writerIndex();
        }

        long remaining() {
            return buffer.writerIndex() - position;
        }

        int limit() {
            return buffer.writerIndex();
        }

        byte next() {
            return buffer.getByte(position++);
        }

        byte byteAt(int index) {
            return buffer.getByte(index);
        }
    }
}

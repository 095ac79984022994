package protocol;

import model.ByteString;

import java.util.Arrays;
import java.util.List;

/**
 * 디코더와 인코더가 주고받는 RESP 값의 공통 상위 타입.
 */
public abstract class RespValue {

    RespValue() {
    }

    public abstract RespType getType();

    public boolean isNull() {
        return false;
    }

    public static RespSimpleString simpleString(String value) {
        return new RespSimpleString(value);
    }

    public static RespError error(String message) {
        return new RespError(message);
    }

    public static RespInteger integer(long value) {
        return new RespInteger(value);
    }

    public static RespBulkString bulkString(ByteString value) {
        return value == null ? RespBulkString.NULL : new RespBulkString(value);
    }

    public static RespBulkString bulkString(String value) {
        return value == null ? RespBulkString.NULL : new RespBulkString(ByteString.of(value));
    }

    public static RespArray array(List<RespValue> elements) {
        return elements == null ? RespArray.NULL : new RespArray(elements);
    }

    public static RespArray array(RespValue... elements) {
        return new RespArray(Arrays.asList(elements));
    }

    /**
     * 명령어 형태의 배열을 만듭니다. 각 인자는 bulk string이 됩니다.
     */
    public static RespArray command(String... parts) {
        RespValue[] elements = new RespValue[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = bulkString(parts[i]);
        }
        return array(elements);
    }

    static void checkLine(String line) {
        if (line == null) {
            throw new IllegalArgumentException("line cannot be null");
        }
        if (line.indexOf('\r') >= 0 || line.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("line must not contain CR or LF");
        }
    }
}

package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import model.ByteString;

/**
 * 길이 접두사가 붙은 바이너리 안전 문자열.
 * value가 null이면 nil($-1)이며, 길이 0인 문자열과는 구분됩니다.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class RespBulkString extends RespValue {

    public static final RespBulkString NULL = new RespBulkString(null);

    private final ByteString value;

    RespBulkString(ByteString value) {
        this.value = value;
    }

    @Override
    public RespType getType() {
        return RespType.BULK_STRING;
    }

    @Override
    public boolean isNull() {
        return value == null;
    }

    @Override
    public String toString() {
        return value == null ? "$nil" : "$" + value;
    }
}

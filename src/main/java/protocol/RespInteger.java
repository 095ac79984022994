package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class RespInteger extends RespValue {

    private final long value;

    RespInteger(long value) {
        this.value = value;
    }

    @Override
    public RespType getType() {
        return RespType.INTEGER;
    }

    @Override
    public String toString() {
        return ":" + value;
    }
}

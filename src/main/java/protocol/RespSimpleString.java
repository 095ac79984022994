package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class RespSimpleString extends RespValue {

    private final String value;

    RespSimpleString(String value) {
        checkLine(value);
        this.value = value;
    }

    @Override
    public RespType getType() {
        return RespType.SIMPLE_STRING;
    }

    @Override
    public String toString() {
        return "+" + value;
    }
}

package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * RESP 배열. elements가 null이면 nil 배열(*-1)입니다.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class RespArray extends RespValue {

    public static final RespArray NULL = new RespArray(null);

    private final List<RespValue> elements;

    RespArray(List<RespValue> elements) {
        this.elements = elements == null ? null : Collections.unmodifiableList(elements);
    }

    @Override
    public RespType getType() {
        return RespType.ARRAY;
    }

    @Override
    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? -1 : elements.size();
    }

    @Override
    public String toString() {
        return elements == null ? "*nil" : "*" + elements;
    }
}

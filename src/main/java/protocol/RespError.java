package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 에러 응답. 메시지는 보통 "ERR ..." 처럼 에러 코드로 시작합니다.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class RespError extends RespValue {

    private final String message;

    RespError(String message) {
        checkLine(message);
        this.message = message;
    }

    @Override
    public RespType getType() {
        return RespType.ERROR;
    }

    @Override
    public String toString() {
        return "-" + message;
    }
}

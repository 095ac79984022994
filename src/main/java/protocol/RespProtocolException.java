package protocol;

import java.io.IOException;

/**
 * 바이트 스트림이 RESP 문법을 벗어났을 때 발생합니다.
 * 스트림 정렬을 되찾을 방법이 없으므로 연결을 닫아야 합니다.
 */
public class RespProtocolException extends IOException {

    public RespProtocolException(String message) {
        super(message);
    }
}

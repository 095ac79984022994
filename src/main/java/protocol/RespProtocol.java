package protocol;

/**
 * 자주 쓰는 응답 값과 에러 응답 생성 도우미.
 */
public final class RespProtocol {

    public static final RespSimpleString OK_RESPONSE = RespValue.simpleString("OK");

    private static final int MAX_ECHOED_BYTES = 128;

    private RespProtocol() {
    }

    /**
     * "ERR " 접두사가 붙은 에러 응답을 만듭니다.
     */
    public static RespError createErrorResponse(String message) {
        return RespValue.error("ERR " + message);
    }

    public static RespError createProtocolError(String reason) {
        return createErrorResponse("Protocol error: " + sanitize(reason));
    }

    public static RespError createWrongArityError(String commandName) {
        return createErrorResponse("wrong number of arguments for '" + commandName + "' command");
    }

    public static RespError createSyntaxError() {
        return createErrorResponse("syntax error");
    }

    /**
     * 클라이언트가 보낸 바이트를 에러 메시지에 넣을 수 있게 정리합니다.
     * UTF-8 기준 128바이트를 넘지 않도록 코드 포인트 단위로 자르고, CR, LF는 공백으로 바꿉니다.
     */
    public static String sanitize(String text) {
        int bytes = 0;
        int end = 0;
        while (end < text.length()) {
            int codePoint = text.codePointAt(end);
            bytes += utf8Length(codePoint);
            if (bytes > MAX_ECHOED_BYTES) {
                break;
            }
            end += Character.charCount(codePoint);
        }
        return text.substring(0, end).replace('\r', ' ').replace('\n', ' ');
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        } else if (codePoint < 0x800) {
            return 2;
        } else if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }
}

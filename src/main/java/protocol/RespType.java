package protocol;

/**
 * RESP 값의 종류와 와이어 상의 첫 바이트.
 */
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    ARRAY('*');

    private final byte prefix;

    RespType(char prefix) {
        this.prefix = (byte) prefix;
    }

    public byte getPrefix() {
        return prefix;
    }

    /**
     * 첫 바이트에 해당하는 타입을 찾습니다. 알 수 없는 바이트면 null.
     */
    public static RespType fromPrefix(byte b) {
        switch (b) {
            case '+':
                return SIMPLE_STRING;
            case '-':
                return ERROR;
            case ':':
                return INTEGER;
            case '$':
                return BULK_STRING;
            case '*':
                return ARRAY;
            default:
                return null;
        }
    }
}

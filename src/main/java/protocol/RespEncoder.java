package protocol;

import model.ByteString;
import org.apache.commons.io.output.ByteArrayOutputStream;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * RESP 값을 표준 바이트 표현으로 직렬화합니다. 페이로드 바이트는 이스케이프하지 않습니다.
 */
public final class RespEncoder {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK_STRING = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespEncoder() {
    }

    public static byte[] encode(RespValue value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            encode(value, out);
        } catch (IOException e) {
            // 메모리 스트림은 IOException을 던지지 않는다
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public static void encode(RespValue value, OutputStream out) throws IOException {
        switch (value.getType()) {
            case SIMPLE_STRING:
                writeLine(out, RespType.SIMPLE_STRING, ((RespSimpleString) value).getValue());
                break;
            case ERROR:
                writeLine(out, RespType.ERROR, ((RespError) value).getMessage());
                break;
            case INTEGER:
                writeLine(out, RespType.INTEGER, Long.toString(((RespInteger) value).getValue()));
                break;
            case BULK_STRING:
                writeBulkString(out, (RespBulkString) value);
                break;
            case ARRAY:
                writeArray(out, (RespArray) value);
                break;
            default:
                throw new IllegalArgumentException("unsupported RESP type: " + value.getType());
        }
    }

    private static void writeBulkString(OutputStream out, RespBulkString bulkString) throws IOException {
        if (bulkString.isNull()) {
            out.write(NULL_BULK_STRING);
            return;
        }
        ByteString payload = bulkString.getValue();
        writeLine(out, RespType.BULK_STRING, Integer.toString(payload.length()));
        out.write(payload.unsafeArray());
        out.write(CRLF);
    }

    private static void writeArray(OutputStream out, RespArray array) throws IOException {
        if (array.isNull()) {
            out.write(NULL_ARRAY);
            return;
        }
        writeLine(out, RespType.ARRAY, Integer.toString(array.size()));
        for (RespValue element : array.getElements()) {
            encode(element, out);
        }
    }

    private static void writeLine(OutputStream out, RespType type, String line) throws IOException {
        out.write(type.getPrefix());
        out.write(line.getBytes(StandardCharsets.UTF_8));
        out.write(CRLF);
    }
}

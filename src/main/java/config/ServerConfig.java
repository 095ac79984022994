package config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import protocol.RespBuffer;
import protocol.RespDecoder;

/**
 * Redis 서버 설정을 관리하는 클래스
 */
@Slf4j
@Getter
@Setter
public class ServerConfig {
    private int port = 6379;
    private String bindAddress = "0.0.0.0";
    private int readBufferSize = 4096;                            // 연결별 읽기 버퍼의 초기 크기
    private long maxBulkLength = RespDecoder.DEFAULT_MAX_BULK_LENGTH;
    private int maxArrayLength = RespDecoder.DEFAULT_MAX_ARRAY_LENGTH;

    /**
     * 명령행 인수를 파싱하여 설정을 업데이트합니다.
     * 잘못된 값은 경고만 남기고 기본값을 유지합니다.
     */
    public void parseCommandLineArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        Integer parsed = parseInt(value, 0, 65535);
                        if (parsed != null) {
                            this.port = parsed;
                            log.info("명령행에서 포트 설정: {}", this.port);
                        } else {
                            log.warn("잘못된 포트 번호: {}", value);
                        }
                    }
                    break;
                case "--bind":
                    if (i + 1 < args.length) {
                        this.bindAddress = args[++i];
                        log.info("명령행에서 바인드 주소 설정: {}", this.bindAddress);
                    }
                    break;
                case "--read-buffer":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        Integer parsed = parseInt(value, 1, RespBuffer.MAX_CAPACITY);
                        if (parsed != null) {
                            this.readBufferSize = parsed;
                        } else {
                            log.warn("잘못된 읽기 버퍼 크기: {}", value);
                        }
                    }
                    break;
                case "--proto-max-bulk-len":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        Integer parsed = parseInt(value, 1, RespDecoder.MAX_BULK_LENGTH_LIMIT);
                        if (parsed != null) {
                            this.maxBulkLength = parsed;
                        } else {
                            log.warn("잘못된 proto-max-bulk-len 값: {}", value);
                        }
                    }
                    break;
                default:
                    log.warn("알 수 없는 옵션 무시: {}", args[i]);
                    break;
            }
        }
    }

    private static Integer parseInt(String value, int min, int max) {
        try {
            int parsed = Integer.parseInt(value);
            return parsed < min || parsed > max ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

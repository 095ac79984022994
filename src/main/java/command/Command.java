package command;

import model.ByteString;
import protocol.RespValue;

import java.util.List;

/**
 * 모든 Redis 명령어 클래스가 구현해야 하는 공통 인터페이스
 */
public interface Command {

    /**
     * 명령어 실행 로직
     * @param args 명령어 이름을 제외한 인자 리스트
     * @return 클라이언트에게 보낼 응답 값
     */
    RespValue execute(List<ByteString> args);
}

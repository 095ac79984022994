package command;

import model.ByteString;
import protocol.RespProtocol;
import protocol.RespValue;

import java.util.List;

/**
 * redis-cli가 접속 직후 보내는 COMMAND 요청용. 인자와 상관없이 OK만 돌려줍니다.
 */
public class CommandCommand implements Command {

    @Override
    public RespValue execute(List<ByteString> args) {
        return RespProtocol.OK_RESPONSE;
    }
}

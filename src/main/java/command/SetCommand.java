package command;

import model.ByteString;
import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

import java.util.List;

/**
 * SET key value. 옵션은 지원하지 않으므로 인자가 더 붙으면 syntax error로 거절합니다.
 */
public class SetCommand implements Command {

    private final StorageService storageService;

    public SetCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public RespValue execute(List<ByteString> args) {
        if (args.size() < 2) {
            return RespProtocol.createWrongArityError("set");
        }
        if (args.size() > 2) {
            return RespProtocol.createSyntaxError();
        }

        storageService.set(args.get(0), args.get(1));
        return RespProtocol.OK_RESPONSE;
    }
}

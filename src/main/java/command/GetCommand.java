package command;

import model.ByteString;
import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

import java.util.List;

public class GetCommand implements Command {

    private final StorageService storageService;

    public GetCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public RespValue execute(List<ByteString> args) {
        if (args.size() != 1) {
            return RespProtocol.createWrongArityError("get");
        }
        ByteString value = storageService.get(args.get(0));
        return RespValue.bulkString(value);
    }
}

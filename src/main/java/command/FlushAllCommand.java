package command;

import model.ByteString;
import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

import java.util.List;

public class FlushAllCommand implements Command {

    private final StorageService storageService;

    public FlushAllCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public RespValue execute(List<ByteString> args) {
        if (!args.isEmpty()) {
            return RespProtocol.createWrongArityError("flushall");
        }
        storageService.clear();
        return RespProtocol.OK_RESPONSE;
    }
}

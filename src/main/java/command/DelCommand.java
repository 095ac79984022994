package command;

import model.ByteString;
import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

import java.util.List;

public class DelCommand implements Command {

    private final StorageService storageService;

    public DelCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public RespValue execute(List<ByteString> args) {
        if (args.isEmpty()) {
            return RespProtocol.createWrongArityError("del");
        }
        return RespValue.integer(storageService.delete(args));
    }
}

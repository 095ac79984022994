package command;

import lombok.extern.slf4j.Slf4j;
import model.ByteString;
import protocol.RespArray;
import protocol.RespBulkString;
import protocol.RespProtocol;
import protocol.RespType;
import protocol.RespValue;
import service.StorageService;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 모든 Redis 명령어를 관리하고, 요청에 맞는 명령어를 찾아 실행하는 핸들러 클래스
 */
@Slf4j
public class CommandHandler {

    private final Map<String, Command> commandMap;

    public CommandHandler(StorageService storageService) {
        this(defaultCommands(storageService));
    }

    /**
     * 명령어 이름(소문자)과 구현을 직접 지정합니다.
     */
    CommandHandler(Map<String, Command> commandMap) {
        this.commandMap = new HashMap<>(commandMap);
    }

    private static Map<String, Command> defaultCommands(StorageService storageService) {
        Map<String, Command> commands = new HashMap<>();
        commands.put("get", new GetCommand(storageService));
        commands.put("set", new SetCommand(storageService));
        commands.put("del", new DelCommand(storageService));
        commands.put("flushall", new FlushAllCommand(storageService));
        commands.put("command", new CommandCommand());
        return commands;
    }

    /**
     * 디코딩된 요청 하나를 실행하고 응답을 돌려줍니다.
     * 요청은 bulk string으로만 이루어진 비어 있지 않은 배열이어야 합니다.
     */
    public RespValue handleCommand(RespValue request) {
        if (request.getType() != RespType.ARRAY || request.isNull()) {
            return RespProtocol.createProtocolError("expected array of bulk strings");
        }
        RespArray array = (RespArray) request;
        if (array.size() == 0) {
            return RespProtocol.createProtocolError("expected array of bulk strings");
        }

        List<ByteString> parts = new ArrayList<>(array.size());
        for (RespValue element : array.getElements()) {
            if (element.getType() != RespType.BULK_STRING || element.isNull()) {
                return RespProtocol.createProtocolError("expected bulk string argument");
            }
            parts.add(((RespBulkString) element).getValue());
        }

        return handleCommand(parts.get(0), parts.subList(1, parts.size()));
    }

    public RespValue handleCommand(ByteString commandName, List<ByteString> args) {
        String name = commandName.toUtf8();
        Command command = commandMap.get(name.toLowerCase(Locale.ROOT));
        if (command == null) {
            log.debug("Unknown command '{}'", name);
            return unknownCommand(name, args);
        }

        try {
            return command.execute(args);
        } catch (RuntimeException e) {
            log.error("Command '{}' failed", name, e);
            return RespProtocol.createErrorResponse("internal server error");
        }
    }

    private static RespValue unknownCommand(String name, List<ByteString> args) {
        StringBuilder message = new StringBuilder();
        message.append("unknown command `").append(RespProtocol.sanitize(name))
                .append("`, with args beginning with: ");
        for (ByteString arg : args) {
            message.append('`').append(RespProtocol.sanitize(arg.toUtf8())).append("`, ");
        }
        return RespProtocol.createErrorResponse(message.toString());
    }
}

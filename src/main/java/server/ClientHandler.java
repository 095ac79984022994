package server;

import command.CommandHandler;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import protocol.RespArray;
import protocol.RespBuffer;
import protocol.RespDecoder;
import protocol.RespEncoder;
import protocol.RespProtocol;
import protocol.RespProtocolException;
import protocol.RespType;
import protocol.RespValue;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.util.function.Consumer;

/**
 * 클라이언트 연결 하나를 처리하는 작업.
 *
 * <p>소켓에서 읽은 바이트를 버퍼에 쌓고, 완성된 프레임이 있는 동안 디코딩과 명령 실행을 반복합니다.
 * 한 번의 읽기에서 나온 응답은 모아서 한 번에 flush합니다.
 */
@Slf4j
public class ClientHandler implements Runnable {

    private final Socket clientSocket;
    private final CommandHandler commandHandler;
    private final RespDecoder decoder;
    private final int readBufferSize;
    private final Consumer<Socket> onClose;

    public ClientHandler(Socket clientSocket, CommandHandler commandHandler, RespDecoder decoder,
                         int readBufferSize, Consumer<Socket> onClose) {
        this.clientSocket = clientSocket;
        this.commandHandler = commandHandler;
        this.decoder = decoder;
        this.readBufferSize = readBufferSize;
        this.onClose = onClose;
    }

    @Override
    public void run() {
        String clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());

        try (InputStream inputStream = clientSocket.getInputStream();
             OutputStream outputStream = new BufferedOutputStream(clientSocket.getOutputStream())) {

            handleClientLoop(inputStream, outputStream, clientAddress);

        } catch (SocketException e) {
            log.info("Client disconnected: {} ({})", clientAddress, e.getMessage());
        } catch (IOException e) {
            log.warn("Error handling client {}: {}", clientAddress, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling client {}", clientAddress, e);
        } finally {
            IOUtils.closeQuietly(clientSocket, e -> log.warn("Error closing client socket {}: {}", clientAddress, e.getMessage()));
            onClose.accept(clientSocket);
        }

        log.info("Client connection closed: {}", clientAddress);
    }

    private void handleClientLoop(InputStream inputStream, OutputStream outputStream, String clientAddress) throws IOException {
        RespBuffer buffer = new RespBuffer(readBufferSize);

        while (true) {
            boolean replied = false;
            try {
                int bytesRead = buffer.readFrom(inputStream);
                if (bytesRead < 0) {
                    if (buffer.readableBytes() > 0) {
                        log.debug("Client {} closed with {} unparsed bytes", clientAddress, buffer.readableBytes());
                    }
                    return;
                }

                RespValue request;
                while ((request = decoder.decode(buffer)) != null) {
                    if (isEmptyRequest(request)) {
                        continue;
                    }
                    log.debug("Received from {}: {}", clientAddress, request);
                    RespValue response = commandHandler.handleCommand(request);
                    log.debug("Sent to {}: {}", clientAddress, response);
                    RespEncoder.encode(response, outputStream);
                    replied = true;
                }
            } catch (RespProtocolException e) {
                // 스트림 정렬이 깨졌으므로 에러를 보내고 연결을 끊는다
                log.warn("Protocol error from client {}: {}", clientAddress, e.getMessage());
                RespEncoder.encode(RespProtocol.createProtocolError(e.getMessage()), outputStream);
                outputStream.flush();
                return;
            }

            if (replied) {
                outputStream.flush();
            }
            if (buffer.readableBytes() == 0) {
                buffer.discardReadBytes();
            }
        }
    }

    /**
     * 빈 배열과 nil 배열 요청은 응답 없이 건너뜁니다.
     */
    private static boolean isEmptyRequest(RespValue request) {
        return request.getType() == RespType.ARRAY && ((RespArray) request).size() <= 0;
    }
}

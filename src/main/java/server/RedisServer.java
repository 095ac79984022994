package server;

import command.CommandHandler;
import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import protocol.RespDecoder;
import service.StorageService;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Redis 서버의 메인 클래스
 * 서버 시작, 클라이언트 연결 처리를 담당
 */
@Slf4j
public class RedisServer implements Closeable {

    private final ServerConfig config;
    private final StorageService storageService;
    private final CommandHandler commandHandler;
    private final RespDecoder decoder;
    private final ExecutorService clientExecutor;
    private final Set<Socket> clientSockets = ConcurrentHashMap.newKeySet();

    private volatile ServerSocket serverSocket;
    private volatile boolean closed = false;

    public RedisServer(ServerConfig config) {
        this.config = config;
        this.storageService = new StorageService();
        this.commandHandler = new CommandHandler(storageService);
        this.decoder = new RespDecoder(config.getMaxBulkLength(), config.getMaxArrayLength());
        this.clientExecutor = Executors.newCachedThreadPool(clientThreadFactory());
    }

    /**
     * 서버를 시작합니다. 소켓을 바인드한 뒤 close()가 호출될 때까지 연결을 받습니다.
     */
    public void start() throws IOException {
        bind();
        serve();
    }

    /**
     * 리스닝 소켓을 생성하고 바인드합니다.
     */
    public void bind() throws IOException {
        ServerSocket socket = new ServerSocket();
        // 서버 재시작 시 'Address already in use' 에러 방지
        socket.setReuseAddress(true);
        try {
            socket.bind(new InetSocketAddress(config.getBindAddress(), config.getPort()));
        } catch (IOException e) {
            IOUtils.closeQuietly(socket, suppressed -> e.addSuppressed(suppressed));
            throw e;
        }
        this.serverSocket = socket;
        log.info("Redis server listening on {}:{}", config.getBindAddress(), socket.getLocalPort());
    }

    /**
     * 연결 수락 루프. 각 연결은 별도의 스레드에서 처리됩니다.
     */
    public void serve() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("server is not bound");
        }

        while (!closed) {
            Socket clientSocket;
            try {
                clientSocket = socket.accept();
            } catch (IOException e) {
                if (closed) {
                    break;
                }
                log.error("Error accepting client connection: {}", e.getMessage());
                continue;
            }

            log.info("Client connected: {}", clientSocket.getRemoteSocketAddress());
            if (!registerClient(clientSocket)) {
                break;
            }
            ClientHandler clientHandler = new ClientHandler(clientSocket, commandHandler, decoder,
                    config.getReadBufferSize(), clientSockets::remove);
            try {
                clientExecutor.execute(clientHandler);
            } catch (RejectedExecutionException e) {
                // close()와 경합한 경우
                clientSockets.remove(clientSocket);
                IOUtils.closeQuietly(clientSocket, suppressed -> log.warn("Error closing client socket: {}", suppressed.getMessage()));
            }
        }
        log.info("Redis server stopped accepting connections");
    }

    /**
     * 연결을 close() 대상 목록에 등록합니다.
     * 등록 직후 서버가 이미 닫혀 있으면 close()가 목록을 훑은 뒤일 수 있으므로 직접 닫고 false를 반환합니다.
     */
    boolean registerClient(Socket clientSocket) {
        clientSockets.add(clientSocket);
        if (closed) {
            clientSockets.remove(clientSocket);
            IOUtils.closeQuietly(clientSocket, e -> log.warn("Error closing client socket: {}", e.getMessage()));
            return false;
        }
        return true;
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public StorageService getStorageService() {
        return storageService;
    }

    /**
     * 리스닝 소켓과 모든 클라이언트 연결을 닫습니다.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        ServerSocket socket = serverSocket;
        if (socket != null) {
            IOUtils.closeQuietly(socket, e -> log.warn("Error closing server socket: {}", e.getMessage()));
        }
        for (Socket clientSocket : clientSockets) {
            IOUtils.closeQuietly(clientSocket, e -> log.warn("Error closing client socket: {}", e.getMessage()));
        }
        clientExecutor.shutdownNow();
    }

    private static ThreadFactory clientThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "client-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

package config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ServerConfigTest {

    @Test
    public void testDefaults() {
        ServerConfig config = new ServerConfig();
        assertEquals(6379, config.getPort());
        assertEquals("0.0.0.0", config.getBindAddress());
        assertEquals(4096, config.getReadBufferSize());
        assertEquals(512L * 1024 * 1024, config.getMaxBulkLength());
    }

    @Test
    public void testParseCommandLineArgs() {
        ServerConfig config = new ServerConfig();
        config.parseCommandLineArgs(new String[]{
                "--port", "7000", "--bind", "127.0.0.1", "--read-buffer", "128", "--proto-max-bulk-len", "1024"});

        assertEquals(7000, config.getPort());
        assertEquals("127.0.0.1", config.getBindAddress());
        assertEquals(128, config.getReadBufferSize());
        assertEquals(1024, config.getMaxBulkLength());
    }

    @Test
    public void testInvalidValuesKeepDefaults() {
        ServerConfig config = new ServerConfig();
        config.parseCommandLineArgs(new String[]{"--port", "abc", "--read-buffer", "0", "--unknown", "--port", "70000"});

        assertEquals(6379, config.getPort());
        assertEquals(4096, config.getReadBufferSize());
    }

    @Test
    public void testMissingValueIsIgnored() {
        ServerConfig config = new ServerConfig();
        config.parseCommandLineArgs(new String[]{"--port"});
        assertEquals(6379, config.getPort());
    }

    @Test
    public void testLimitsAboveReadBufferBoundAreRejected() {
        ServerConfig config = new ServerConfig();
        config.parseCommandLineArgs(new String[]{
                "--proto-max-bulk-len", String.valueOf(Integer.MAX_VALUE),
                "--read-buffer", String.valueOf(Integer.MAX_VALUE)});

        assertEquals(512L * 1024 * 1024, config.getMaxBulkLength());
        assertEquals(4096, config.getReadBufferSize());
    }
}

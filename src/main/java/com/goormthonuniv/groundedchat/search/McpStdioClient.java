package com.goormthonuniv.groundedchat.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 서브프로세스와 줄 단위 JSON-RPC (stdio) 로 통신하는 MCP 클라이언트.
 * initialize → notifications/initialized 이후 tools/call 을 보낸다.
 */
@Slf4j
public class McpStdioClient implements AutoCloseable {

    private final List<String> command;
    private final Map<String, String> env;
    private final Duration timeout;
    private final ObjectMapper om;

    private final Map<Integer, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final AtomicInteger nextId = new AtomicInteger(1);

    private Process process;
    private OutputStream stdin;

    public McpStdioClient(List<String> command, Map<String, String> env, Duration timeout, ObjectMapper om) {
        this.command = List.copyOf(command);
        this.env = env == null ? Map.of() : Map.copyOf(env);
        this.timeout = timeout;
        this.om = om;
    }

    public synchronized void start() throws IOException {
        if (process != null && process.isAlive()) return;

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.environment().putAll(env);
        process = pb.start();
        stdin = process.getOutputStream();

        Thread reader = new Thread(this::readLoop, "mcp-stdout");
        reader.setDaemon(true);
        reader.start();
        Thread drainer = new Thread(this::drainStderr, "mcp-stderr");
        drainer.setDaemon(true);
        drainer.start();

        initialize();
    }

    /** tools/call 결과(result 노드)를 돌려준다. */
    public JsonNode callTool(String name, Map<String, Object> arguments) throws IOException {
        JsonNode resp = request("tools/call", Map.of("name", name, "arguments", arguments));
        if (resp.has("error")) {
            throw new IOException("MCP tools/call failed: " + resp.get("error"));
        }
        return resp.path("result");
    }

    JsonNode request(String method, Map<String, Object> params) throws IOException {
        start();
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pending.put(id, future);
        try {
            ObjectNode msg = om.createObjectNode();
            msg.put("jsonrpc", "2.0");
            msg.put("id", id);
            msg.put("method", method);
            msg.set("params", om.valueToTree(params == null ? Map.of() : params));
            send(msg);
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new IOException("MCP request timed out: " + method, e);
        } catch (ExecutionException e) {
            throw new IOException("MCP request failed: " + method, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("MCP request interrupted: " + method, e);
        } finally {
            pending.remove(id);
        }
    }

    private void initialize() throws IOException {
        JsonNode resp = request("initialize", Map.of(
                "protocolVersion", "2024-11-05",
                "capabilities", Map.of(),
                "clientInfo", Map.of("name", "grounded-chat", "version", "0.1")
        ));
        if (resp.has("error")) {
            throw new IOException("MCP initialize failed: " + resp.get("error"));
        }
        ObjectNode note = om.createObjectNode();
        note.put("jsonrpc", "2.0");
        note.put("method", "notifications/initialized");
        note.set("params", om.createObjectNode());
        send(note);
    }

    private synchronized void send(JsonNode msg) throws IOException {
        if (stdin == null) throw new IOException("MCP process not started");
        // 직렬화 결과에 개행이 없으므로 한 줄 = 한 메시지
        String line = om.writeValueAsString(msg);
        stdin.write((line + "\n").getBytes(StandardCharsets.UTF_8));
        stdin.flush();
    }

    private void readLoop() {
        try (BufferedReader r = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                line = line.strip();
                if (line.isEmpty()) continue;
                JsonNode msg;
                try {
                    msg = om.readTree(line);
                } catch (IOException e) {
                    log.debug("[mcp] non-json stdout line skipped: {}", line);
                    continue;
                }
                JsonNode id = msg.get("id");
                if (id != null && id.isInt()) {
                    CompletableFuture<JsonNode> f = pending.get(id.asInt());
                    if (f != null) f.complete(msg);
                }
            }
        } catch (IOException e) {
            log.debug("[mcp] stdout closed: {}", e.getMessage());
        }
        pending.values().forEach(f -> f.completeExceptionally(new IOException("MCP process exited")));
    }

    private void drainStderr() {
        try (BufferedReader r = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                log.debug("[mcp] stderr: {}", line);
            }
        } catch (IOException e) {
            log.debug("[mcp] stderr closed: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        Process p = process;
        if (p == null) return;
        try {
            if (stdin != null) stdin.close();
        } catch (IOException e) {
            log.debug("[mcp] stdin close failed: {}", e.getMessage());
        }
        p.destroy();
        try {
            if (!p.waitFor(3, TimeUnit.SECONDS)) p.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
        }
        process = null;
        stdin = null;
    }
}

package com.goormthonuniv.groundedchat.memory;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.Turn;
import com.goormthonuniv.groundedchat.exception.PersistenceException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 채팅별 마크다운 턴 로그. 한 줄 = 한 턴, 개행은 이스케이프해서 저장한다.
 * <pre>- [2026-02-18T09:00:00Z] chat:42 (user) 첫 줄\n둘째 줄</pre>
 * mode: per_chat_daily (chat_{id}/{날짜}.md, 최근 days 일을 읽음) | per_chat (chat_{id}.md)
 */
@Component
public class MarkdownTurnStore implements TurnStore {

    private static final Pattern LINE = Pattern.compile("^- \\[([^\\]]+)] chat:(-?\\d+) \\((user|assistant)\\) ?(.*)$");

    private final Path dir;
    private final String mode;
    private final int days;
    private final Clock clock;

    @Autowired
    public MarkdownTurnStore(AssistantProperties props, Clock clock) {
        this(Path.of(props.getMemory().getDir()), props.getMemory().getMode(), props.getMemory().getDays(), clock);
    }

    public MarkdownTurnStore(Path dir, String mode, int days, Clock clock) {
        this.dir = dir;
        this.mode = mode;
        this.days = Math.max(1, days);
        this.clock = clock;
    }

    @Override
    public void append(long chatId, Turn turn) {
        LocalDate day = LocalDate.ofInstant(turn.timestamp(), clock.getZone());
        Path path = pathFor(chatId, day);
        String line = "- [" + turn.timestamp() + "] chat:" + chatId + " (" + turn.role().wire() + ") "
                + escape(turn.content()) + "\n";
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new PersistenceException("cannot append turn for chat " + chatId, e);
        }
    }

    @Override
    public List<Turn> recentTurns(long chatId, int limit) {
        if (limit <= 0) return List.of();
        List<Turn> turns = new ArrayList<>();
        for (Path path : pathsToRead(chatId)) {
            if (!Files.exists(path)) continue;
            List<String> lines;
            try {
                lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new PersistenceException("cannot read turns for chat " + chatId, e);
            }
            for (String line : lines) {
                Matcher m = LINE.matcher(line);
                if (!m.matches() || Long.parseLong(m.group(2)) != chatId) continue;
                Instant ts;
                try {
                    ts = Instant.parse(m.group(1));
                } catch (DateTimeParseException e) {
                    continue;
                }
                turns.add(new Turn(Turn.Role.fromWire(m.group(3)), unescape(m.group(4)), ts));
            }
        }
        return turns.size() <= limit ? turns : List.copyOf(turns.subList(turns.size() - limit, turns.size()));
    }

    Path pathFor(long chatId, LocalDate day) {
        if ("per_chat".equals(mode)) return dir.resolve("chat_" + chatId + ".md");
        return dir.resolve("chat_" + chatId).resolve(day + ".md");
    }

    private List<Path> pathsToRead(long chatId) {
        LocalDate today = LocalDate.now(clock);
        if ("per_chat".equals(mode)) return List.of(pathFor(chatId, today));
        List<Path> out = new ArrayList<>();
        for (int i = days - 1; i >= 0; i--) {
            out.add(pathFor(chatId, today.minusDays(i)));
        }
        return out;
    }

    static String escape(String content) {
        String s = content == null ? "" : content.replace("\r\n", "\n").replace('\r', '\n');
        return s.replace("\\", "\\\\").replace("\n", "\\n");
    }

    static String unescape(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char n = s.charAt(++i);
                out.append(n == 'n' ? '\n' : n);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}

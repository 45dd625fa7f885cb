package com.goormthonuniv.groundedchat.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.Profile;
import com.goormthonuniv.groundedchat.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** chat_{id}/profile.json */
@Slf4j
@Component
public class JsonProfileStore implements ProfileStore {

    private final Path dir;
    private final ObjectMapper om;

    @Autowired
    public JsonProfileStore(AssistantProperties props, ObjectMapper om) {
        this(Path.of(props.getMemory().getDir()), om);
    }

    public JsonProfileStore(Path dir, ObjectMapper om) {
        this.dir = dir;
        this.om = om.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Profile get(long chatId) {
        Path path = pathFor(chatId);
        if (!Files.exists(path)) return Profile.empty();
        try {
            Profile p = om.readValue(path.toFile(), Profile.class);
            return p == null ? Profile.empty() : p;
        } catch (IOException e) {
            // 손상된 파일은 빈 프로필로 취급하고 다음 병합에서 덮어쓴다
            log.warn("[profile] unreadable profile chat={}: {}", chatId, e.getMessage());
            return Profile.empty();
        }
    }

    @Override
    public Profile merge(long chatId, Profile updates) {
        Profile merged = get(chatId).mergedWith(updates);
        Path path = pathFor(chatId);
        try {
            Files.createDirectories(path.getParent());
            om.writeValue(path.toFile(), merged);
        } catch (IOException e) {
            throw new PersistenceException("cannot write profile for chat " + chatId, e);
        }
        return merged;
    }

    @Override
    public boolean clear(long chatId) {
        try {
            return Files.deleteIfExists(pathFor(chatId));
        } catch (IOException e) {
            throw new PersistenceException("cannot clear profile for chat " + chatId, e);
        }
    }

    private Path pathFor(long chatId) {
        return dir.resolve("chat_" + chatId).resolve("profile.json");
    }
}

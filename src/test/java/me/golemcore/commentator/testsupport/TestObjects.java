package me.golemcore.commentator.testsupport;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.commentator.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;

import java.nio.file.Path;

public final class TestObjects {

    private TestObjects() {
    }

    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public static CommentatorProperties properties(Path baseDir) {
        CommentatorProperties properties = new CommentatorProperties();
        properties.getStorage().setBasePath(baseDir.toString());
        return properties;
    }

    public static LocalStorageAdapter storage(CommentatorProperties properties) {
        LocalStorageAdapter adapter = new LocalStorageAdapter(properties);
        adapter.init();
        return adapter;
    }
}

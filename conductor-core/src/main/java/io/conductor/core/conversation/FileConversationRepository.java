package io.conductor.core.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.conductor.core.model.Conversation;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One pretty-printed JSON document per conversation under a directory.
 */
public final class FileConversationRepository implements ConversationRepository {
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final Path directory;
    private final ObjectMapper mapper;

    public FileConversationRepository(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Optional<Conversation> get(String id) throws IOException {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            return Optional.empty();
        }
        Path path = pathFor(id);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(Files.readString(path), Conversation.class));
    }

    @Override
    public synchronized String add(Conversation conversation) throws IOException {
        if (Files.exists(pathFor(conversation.id()))) {
            throw new IllegalArgumentException("Conversation already exists: " + conversation.id());
        }
        save(conversation);
        return conversation.id();
    }

    @Override
    public synchronized void update(Conversation conversation) throws IOException {
        save(conversation);
    }

    @Override
    public synchronized boolean delete(String id) throws IOException {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            return false;
        }
        return Files.deleteIfExists(pathFor(id));
    }

    @Override
    public synchronized List<Conversation> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Conversation> conversations = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                conversations.add(mapper.readValue(Files.readString(file), Conversation.class));
            }
        }
        conversations.sort(Comparator.comparing(Conversation::createdAt));
        return conversations;
    }

    private void save(Conversation conversation) throws IOException {
        Files.createDirectories(directory);
        Path target = pathFor(conversation.id());
        Path temp = directory.resolve(conversation.id() + ".json.tmp");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(conversation);
        Files.writeString(temp, json + System.lineSeparator());
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }

    private Path pathFor(String id) {
        if (!SAFE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid conversation id: " + id);
        }
        return directory.resolve(id + ".json");
    }
}

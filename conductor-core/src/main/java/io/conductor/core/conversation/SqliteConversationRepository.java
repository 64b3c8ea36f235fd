package io.conductor.core.conversation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.Conversation;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteConversationRepository implements ConversationRepository {
    private static final TypeReference<List<ChatMessage>> CHAT_MESSAGES = new TypeReference<>() {
    };
    private static final String COLUMNS = "conversation_id, class_id, date, time_slot, history_json, created_at, updated_at";

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteConversationRepository(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        init();
    }

    @Override
    public synchronized Optional<Conversation> get(String id) throws IOException {
        if (id == null) {
            return Optional.empty();
        }
        String sql = "SELECT " + COLUMNS + " FROM conversations WHERE conversation_id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(read(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load conversation " + id, e);
        }
    }

    @Override
    public synchronized String add(Conversation conversation) throws IOException {
        String sql = "INSERT INTO conversations (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversation.id());
            statement.setString(2, conversation.classId());
            statement.setString(3, conversation.date().toString());
            setTimeSlot(statement, 4, conversation.timeSlot());
            statement.setString(5, mapper.writeValueAsString(conversation.messages()));
            statement.setString(6, conversation.createdAt().toString());
            statement.setString(7, conversation.updatedAt().toString());
            statement.executeUpdate();
            return conversation.id();
        } catch (SQLException e) {
            throw new IOException("Failed to add conversation " + conversation.id(), e);
        }
    }

    @Override
    public synchronized void update(Conversation conversation) throws IOException {
        String sql = """
            UPDATE conversations
            SET class_id = ?, date = ?, time_slot = ?, history_json = ?, updated_at = ?
            WHERE conversation_id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversation.classId());
            statement.setString(2, conversation.date().toString());
            setTimeSlot(statement, 3, conversation.timeSlot());
            statement.setString(4, mapper.writeValueAsString(conversation.messages()));
            statement.setString(5, conversation.updatedAt().toString());
            statement.setString(6, conversation.id());
            if (statement.executeUpdate() == 0) {
                throw new IOException("Conversation not found: " + conversation.id());
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update conversation " + conversation.id(), e);
        }
    }

    @Override
    public synchronized boolean delete(String id) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM conversations WHERE conversation_id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete conversation " + id, e);
        }
    }

    @Override
    public synchronized List<Conversation> list() throws IOException {
        return query("SELECT " + COLUMNS + " FROM conversations ORDER BY created_at ASC", null);
    }

    @Override
    public synchronized List<Conversation> findByClassId(String classId) throws IOException {
        return query("SELECT " + COLUMNS + " FROM conversations WHERE class_id = ? ORDER BY created_at ASC", classId);
    }

    private List<Conversation> query(String sql, String parameter) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            if (parameter != null) {
                statement.setString(1, parameter);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                List<Conversation> conversations = new ArrayList<>();
                while (resultSet.next()) {
                    conversations.add(read(resultSet));
                }
                return conversations;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list conversations", e);
        }
    }

    private Conversation read(ResultSet resultSet) throws SQLException, IOException {
        int timeSlot = resultSet.getInt("time_slot");
        Integer slot = resultSet.wasNull() ? null : timeSlot;
        return new Conversation(
            resultSet.getString("conversation_id"),
            resultSet.getString("class_id"),
            LocalDate.parse(resultSet.getString("date")),
            slot,
            mapper.readValue(resultSet.getString("history_json"), CHAT_MESSAGES),
            Instant.parse(resultSet.getString("created_at")),
            Instant.parse(resultSet.getString("updated_at"))
        );
    }

    private void setTimeSlot(PreparedStatement statement, int index, Integer timeSlot) throws SQLException {
        if (timeSlot == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setInt(index, timeSlot);
        }
    }

    private Connection openConnection() throws SQLException {
        return configure(DriverManager.getConnection(jdbcUrl));
    }

    /**
     * Applies the connection pragmas. The connection is closed when they fail.
     */
    static Connection configure(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS conversations (
                conversation_id TEXT PRIMARY KEY,
                class_id TEXT,
                date TEXT NOT NULL,
                time_slot INTEGER,
                history_json TEXT NOT NULL DEFAULT '[]',
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute("CREATE INDEX IF NOT EXISTS idx_conversations_class ON conversations(class_id)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_conversations_date ON conversations(date)");
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite conversation repository", e);
        }
    }
}

package io.conductor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Working copy of a stored conversation. Message order is chronological order.
 * Instances are not thread-safe; every send operation works on its own copy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Conversation {
    private final String id;
    private final String classId;
    private final LocalDate date;
    private final Integer timeSlot;
    private final List<ChatMessage> messages;
    private final Instant createdAt;
    private Instant updatedAt;

    @JsonCreator
    public Conversation(
        @JsonProperty("id") String id,
        @JsonProperty("classId") String classId,
        @JsonProperty("date") LocalDate date,
        @JsonProperty("timeSlot") Integer timeSlot,
        @JsonProperty("messages") List<ChatMessage> messages,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt
    ) {
        Instant now = Instant.now();
        this.id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        this.classId = classId;
        this.date = date == null ? LocalDate.now(ZoneOffset.UTC) : date;
        this.timeSlot = timeSlot;
        this.messages = messages == null ? new ArrayList<>() : new ArrayList<>(messages);
        this.createdAt = createdAt == null ? now : createdAt;
        this.updatedAt = updatedAt == null ? this.createdAt : updatedAt;
    }

    public static Conversation start(String systemPrompt, String classId, Clock clock) {
        Instant now = clock.instant();
        Conversation conversation = new Conversation(
            null,
            classId,
            LocalDate.ofInstant(now, ZoneOffset.UTC),
            null,
            List.of(),
            now,
            now
        );
        conversation.append(ChatMessage.system(systemPrompt), now);
        return conversation;
    }

    @JsonProperty("id")
    public String id() {
        return id;
    }

    @JsonProperty("classId")
    public String classId() {
        return classId;
    }

    @JsonProperty("date")
    public LocalDate date() {
        return date;
    }

    @JsonProperty("timeSlot")
    public Integer timeSlot() {
        return timeSlot;
    }

    @JsonProperty("messages")
    public List<ChatMessage> messages() {
        return List.copyOf(messages);
    }

    @JsonProperty("createdAt")
    public Instant createdAt() {
        return createdAt;
    }

    @JsonProperty("updatedAt")
    public Instant updatedAt() {
        return updatedAt;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public void append(ChatMessage message, Instant at) {
        messages.add(message);
        updatedAt = at;
    }

    public void appendAll(List<ChatMessage> newMessages, Instant at) {
        messages.addAll(newMessages);
        updatedAt = at;
    }

    public Conversation copy() {
        return new Conversation(id, classId, date, timeSlot, messages, createdAt, updatedAt);
    }
}

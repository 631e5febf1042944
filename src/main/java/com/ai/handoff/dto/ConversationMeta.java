package com.ai.handoff.dto;

import com.ai.handoff.conversation.ConversationStatus;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Session metadata document stored next to the status key.
 *
 * <p>Older documents used snake_case names and zone-less timestamps; the aliases and
 * {@link LenientInstantDeserializer} read them, and the state store fills in fields
 * that did not exist yet.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationMeta {

    @JsonAlias({"phone_normalized", "phoneNormalized", "phone"})
    private String identity;

    @JsonAlias({"canal", "canal_origen"})
    private String channel;

    @Nullable
    @JsonAlias("contact_id")
    private String contactId;

    private ConversationStatus status;

    @Nullable
    @JsonAlias("last_activity")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant lastActivity;

    @Nullable
    @JsonAlias("handoff_reason")
    private String handoffReason;

    @Nullable
    @JsonAlias({"assigned_owner_id", "owner_id"})
    private String assignedOwnerId;

    @Nullable
    @JsonAlias({"display_name", "contact_name"})
    private String displayName;

    @JsonAlias("message_count")
    private int messageCount;

    @Nullable
    @JsonAlias("created_at")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant createdAt;

    @Nullable
    @JsonAlias({"last_client_message_at", "last_client_message"})
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant lastClientMessageAt;

    @Nullable
    @JsonAlias({"last_operator_message_at", "last_human_message", "last_advisor_message"})
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant lastOperatorMessageAt;

    @Nullable
    @JsonAlias("last_bot_message")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant lastBotMessageAt;

    @Nullable
    @JsonAlias({"human_activated_at", "handoff_at"})
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant humanActivatedAt;

    public static ConversationMeta fresh(String identity, String channel, Instant now) {
        return ConversationMeta.builder()
                .identity(identity)
                .channel(channel)
                .status(ConversationStatus.BOT_ACTIVE)
                .createdAt(now)
                .lastActivity(now)
                .build();
    }
}

package com.openforge.recall.domain;

import jakarta.persistence.*;
import lombok.*;

/** One chat turn of a conversation, kept so retrieval can read the recent exchange. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "conversation_messages",
       indexes = @Index(name = "idx_conversation_messages_conv", columnList = "conversation_id"))
public class ConversationMessage extends BaseEntity {

    public enum Role {
        USER,
        ASSISTANT
    }

    @Column(name = "conversation_id", nullable = false, length = 64)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private Role role;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;
}

package com.openforge.recall.conversation;

import com.openforge.recall.domain.ConversationMessage;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Chat log used for conversational retrieval context.
 *
 *   POST /api/conversations/{conversationId}/messages          append one message
 *   GET  /api/conversations/{conversationId}/messages?limit=n  newest first
 */
@Validated
@RestController
@RequestMapping("/api/conversations/{conversationId}/messages")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationHistoryService historyService;

    @PostMapping
    public ResponseEntity<MessageView> append(@PathVariable @Size(max = 64) String conversationId,
                                              @Valid @RequestBody AppendMessageRequest req) {
        ConversationMessage saved = historyService.append(conversationId, req.role(), req.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(MessageView.of(saved));
    }

    @GetMapping
    public ResponseEntity<List<MessageView>> latest(@PathVariable String conversationId,
                                                    @RequestParam(defaultValue = "20") @Min(1) @Max(200) int limit) {
        return ResponseEntity.ok(historyService.latest(conversationId, limit).stream()
                .map(MessageView::of)
                .toList());
    }

    public record AppendMessageRequest(
            @NotNull                     ConversationMessage.Role role,
            @NotBlank @Size(max = 16000) String                   content
    ) {}

    public record MessageView(
            Long                     id,
            String                   conversationId,
            ConversationMessage.Role role,
            String                   content,
            LocalDateTime            createTime
    ) {
        static MessageView of(ConversationMessage m) {
            return new MessageView(m.getId(), m.getConversationId(), m.getRole(), m.getContent(),
                    m.getCreateTime());
        }
    }
}

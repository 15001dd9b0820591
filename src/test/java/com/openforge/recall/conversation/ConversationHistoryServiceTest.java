package com.openforge.recall.conversation;

import com.openforge.recall.config.JpaConfig;
import com.openforge.recall.domain.ConversationMessage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static com.openforge.recall.domain.ConversationMessage.Role.ASSISTANT;
import static com.openforge.recall.domain.ConversationMessage.Role.USER;
import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({ConversationHistoryService.class, JpaConfig.class})
class ConversationHistoryServiceTest {

    @Autowired private ConversationHistoryService history;

    @Test
    void shouldReturnTheLastMessagesOldestFirst() {
        history.append("conv-1", USER, "hey there");
        history.append("conv-1", ASSISTANT, "what's up");
        history.append("conv-1", USER, "tell me about grandma");
        history.append("conv-1", ASSISTANT, "she made sauce every sunday");

        assertEquals(List.of("what's up", "tell me about grandma", "she made sauce every sunday"),
                history.recentMessages("conv-1", 3));
    }

    @Test
    void shouldKeepConversationsApart() {
        history.append("conv-1", USER, "pizza");
        history.append("conv-2", USER, "bowling");

        assertEquals(List.of("bowling"), history.recentMessages("conv-2", 3));
        assertEquals(List.of(), history.recentMessages("conv-9", 3));
    }

    @Test
    void shouldListNewestFirstWithRolesAndTimestamps() {
        ConversationMessage first = history.append("conv-3", USER, "first");
        history.append("conv-3", ASSISTANT, "second");

        List<ConversationMessage> latest = history.latest("conv-3", 10);

        assertEquals(List.of("second", "first"), latest.stream().map(ConversationMessage::getContent).toList());
        assertEquals(ASSISTANT, latest.get(0).getRole());
        assertNotNull(first.getId());
        assertNotNull(first.getCreateTime());
    }

    @Test
    void shouldReturnNothingForNonPositiveLimit() {
        history.append("conv-4", USER, "anything");
        assertEquals(List.of(), history.recentMessages("conv-4", 0));
    }
}

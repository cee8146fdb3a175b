package com.agentic.core.model;

import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class SessionContextTest {

    @Test
    void withActivity_shouldBumpCounter() {
        SessionContext session = SessionContext.create("s-1", "u-1", "p-1");

        SessionContext touched = session.withActivity().withActivity();

        assertThat(touched.messageCount()).isEqualTo(2);
        assertThat(touched.lastActivity()).isAfterOrEqualTo(session.lastActivity());
        assertThat(touched.createdAt()).isEqualTo(session.createdAt());
    }

    @Test
    void recentMessages_shouldReturnTailInOrder() {
        SessionContext session = SessionContext.create("s-1", "u-1", "p-1")
            .withMessage(ConversationMessage.userInput("s-1", "first"))
            .withMessage(ConversationMessage.agentResponse("s-1", "second", null))
            .withMessage(ConversationMessage.userInput("s-1", "third"));

        assertThat(session.recentMessages(2)).extracting(ConversationMessage::content)
            .containsExactly("second", "third");
        assertThat(session.recentMessages(10)).hasSize(3);
        assertThat(session.recentMessages(0)).isEmpty();
    }

    @Test
    void message_shouldRejectBlankContent() {
        assertThatThrownBy(() -> ConversationMessage.userInput("s-1", "   "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

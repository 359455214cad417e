package me.golemcore.conductor.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationSessionTest {

    private ConversationSession session;

    @BeforeEach
    void setUp() {
        session = new ConversationSession();
        session.reset("conv-1");
    }

    private static Message message(String id, String role, String content, int tokens) {
        return Message.builder().id(id).role(role).content(content).tokenCount(tokens).build();
    }

    @Test
    void shouldAssignSequentialIdsAndEstimateTokens() {
        session.addMessage(Message.user("12345678"));
        session.addMessage(Message.assistant("abcd"));

        List<Message> messages = session.getMessages();
        assertEquals("1", messages.get(0).getId());
        assertEquals("2", messages.get(1).getId());
        assertEquals(2, messages.get(0).getTokenCount());
        assertEquals(1, messages.get(1).getTokenCount());
    }

    @Test
    void shouldContinueNumberingAfterSyncedIds() {
        session.addMessage(message("41", Message.ROLE_USER, "hi", 1));
        session.addMessage(Message.user("next"));

        assertEquals("42", session.getMessages().get(1).getId());
    }

    @Test
    void shouldKeepNewestMessagesWithinTokenBudget() {
        session.addMessage(message("1", Message.ROLE_USER, "old", 50));
        session.addMessage(message("2", Message.ROLE_ASSISTANT, "middle", 30));
        session.addMessage(message("3", Message.ROLE_USER, "new", 30));

        List<Message> context = session.contextForLlm(70);

        assertEquals(List.of("middle", "new"), context.stream().map(Message::getContent).toList());
    }

    @Test
    void shouldStopAtFirstMessageThatDoesNotFit() {
        session.addMessage(message("1", Message.ROLE_USER, "small", 1));
        session.addMessage(message("2", Message.ROLE_ASSISTANT, "huge", 500));
        session.addMessage(message("3", Message.ROLE_USER, "latest", 10));

        List<Message> context = session.contextForLlm(100);

        assertEquals(1, context.size());
        assertEquals("latest", context.get(0).getContent());
    }

    @Test
    void shouldPrependSummaryAsSystemMessage() {
        session.addMessage(message("1", Message.ROLE_USER, "first", 5));
        session.addMessage(message("2", Message.ROLE_ASSISTANT, "second", 5));
        session.addMessage(message("3", Message.ROLE_USER, "third", 5));

        session.applySummary("User asked about invoices.", 2);
        List<Message> context = session.contextForLlm(1000);

        assertEquals(2, context.size());
        assertEquals(Message.ROLE_SYSTEM, context.get(0).getRole());
        assertEquals("[Previous conversation summary]\nUser asked about invoices.", context.get(0).getContent());
        assertEquals("third", context.get(1).getContent());
    }

    @Test
    void shouldKeepNonNumericIdsWhenSummarizing() {
        session.addMessage(message("1", Message.ROLE_USER, "numbered", 5));
        session.addMessage(message("local-abc", Message.ROLE_USER, "unsynced", 5));

        session.applySummary("summary", 10);

        assertEquals(List.of("local-abc"), session.getMessages().stream().map(Message::getId).toList());
    }

    @Test
    void shouldMentionAttachmentsInModelContext() {
        session.addMessage(Message.builder().role(Message.ROLE_USER).content("see this")
                .attachments(List.of("report.pdf", "chart.png")).build());

        Message formatted = session.contextForLlm(1000).get(0);

        assertEquals("see this\n\n[Attachments: report.pdf, chart.png]", formatted.getContent());
    }

    @Test
    void shouldTreatUnknownRolesAsUser() {
        session.addMessage(message("1", "tool", "raw", 1));

        assertEquals(Message.ROLE_USER, session.contextForLlm(100).get(0).getRole());
    }

    @Test
    void shouldRegisterFilesByBasename() {
        session.registerFile("/data/user/0/app/files/scan.jpg");
        session.registerFile(" ");

        assertEquals(Map.of("scan.jpg", "/data/user/0/app/files/scan.jpg"), session.getFileMap());
    }

    @Test
    void shouldClearEverythingOnReset() {
        session.addMessage(Message.user("hello"));
        session.applySummary("s", 0);
        session.registerFile("/tmp/a.txt");

        session.reset("conv-2");

        assertEquals("conv-2", session.getConversationId());
        assertTrue(session.getMessages().isEmpty());
        assertNull(session.getSummary());
        assertTrue(session.getFileMap().isEmpty());
    }

    @Test
    void shouldReplaceStateOnFullSync() {
        session.addMessage(Message.user("stale"));

        session.replaceAll("conv-9", List.of(message("7", Message.ROLE_USER, "fresh", 2)), "sum",
                Map.of("a.txt", "/tmp/a.txt"));

        assertEquals("conv-9", session.getConversationId());
        assertEquals("fresh", session.getMessages().get(0).getContent());
        assertEquals("sum", session.getSummary());
        assertEquals(Map.of("a.txt", "/tmp/a.txt"), session.getFileMap());
    }
}

package com.purchasingpower.chatgateway.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.chatgateway.model.ChatMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Context Analyzer Tests")
class ContextAnalyzerTest {

    private final ContextAnalyzer analyzer = new ContextAnalyzer();

    @Test
    @DisplayName("A lone hello is a greeting with neutral defaults")
    void hello_ShouldBeGreeting() {
        ConversationContext ctx = analyzer.analyze(List.of(ChatMessage.user("hello")));

        assertThat(ctx.intent()).isEqualTo(ConversationIntent.GREETING);
        assertThat(ctx.emotionalTone()).isEqualTo(EmotionalTone.NEUTRAL);
        assertThat(ctx.knowledgeLevel()).isEqualTo(KnowledgeLevel.INTERMEDIATE);
        assertThat(ctx.topics()).isEmpty();
        assertThat(ctx.followUp()).isFalse();
    }

    @Test
    @DisplayName("Empty or missing history resolves to the neutral context")
    void emptyHistory_ShouldBeNeutral() {
        assertEquals(ConversationContext.neutral(), analyzer.analyze(null));
        assertEquals(ConversationContext.neutral(), analyzer.analyze(List.of()));
        assertThat(ConversationContext.neutral().intent()).isEqualTo(ConversationIntent.OTHER);
    }

    @Test
    @DisplayName("Analysis is deterministic and ignores message order inside the window")
    void analysis_ShouldBeDeterministic() {
        // Given
        List<ChatMessage> history = List.of(
                ChatMessage.user("I'm curious about calculus"),
                ChatMessage.assistant("Calculus studies change."),
                ChatMessage.user("I'm stuck on my python code"),
                ChatMessage.user("what is a derivative?"));

        // When
        ConversationContext first = analyzer.analyze(history);
        ConversationContext second = analyzer.analyze(new ArrayList<>(history));
        List<ChatMessage> reversedUsers = new ArrayList<>(history);
        Collections.swap(reversedUsers, 0, 2);
        ConversationContext swapped = analyzer.analyze(reversedUsers);

        // Then
        assertEquals(first, second);
        assertThat(swapped.topics()).isEqualTo(first.topics());
        assertThat(swapped.emotionalTone()).isEqualTo(first.emotionalTone());
        assertThat(swapped.knowledgeLevel()).isEqualTo(first.knowledgeLevel());
    }

    @Test
    @DisplayName("Frustration cues override curiosity and confidence cues")
    void tone_ShouldFollowOverrideOrder() {
        ConversationContext ctx = analyzer.analyze(List.of(
                ChatMessage.user("this is interesting and I think I understand"),
                ChatMessage.user("but now I'm stuck")));

        assertThat(ctx.emotionalTone()).isEqualTo(EmotionalTone.FRUSTRATED);

        ConversationContext curious = analyzer.analyze(List.of(
                ChatMessage.user("I wonder how this works, I think I understand part of it")));
        assertThat(curious.emotionalTone()).isEqualTo(EmotionalTone.CURIOUS);
    }

    @Test
    @DisplayName("Should collect topics across user messages only")
    void topics_ShouldComeFromUserMessages() {
        ConversationContext ctx = analyzer.analyze(List.of(
                ChatMessage.user("Can you check my essay?"),
                ChatMessage.assistant("Sure, is this about history or chemistry?"),
                ChatMessage.user("It's for my algebra class, actually")));

        assertThat(ctx.topics()).containsExactlyInAnyOrder(TopicTag.WRITING, TopicTag.MATHEMATICS);
        assertThat(ctx.topicList()).isEqualTo("mathematics, writing");
        assertThat(ctx.followUp()).isTrue();
    }

    @Test
    @DisplayName("Only the trailing window is inspected")
    void window_ShouldLimitHistory() {
        ContextAnalyzer small = new ContextAnalyzer(2);
        ConversationContext ctx = small.analyze(List.of(
                ChatMessage.user("let's talk about music"),
                ChatMessage.assistant("Sure."),
                ChatMessage.user("ok")));

        assertThat(ctx.topics()).isEmpty();
        assertThat(ctx.followUp()).isFalse();
    }

    @Test
    @DisplayName("Knowledge level follows vocabulary counts")
    void knowledgeLevel_ShouldFollowVocabulary() {
        ConversationContext advanced = analyzer.analyze(List.of(ChatMessage.user(
                "Compare the asymptotic complexity of this algorithm with an optimization that uses concurrency")));
        assertThat(advanced.knowledgeLevel()).isEqualTo(KnowledgeLevel.ADVANCED);

        ConversationContext beginner = analyzer.analyze(List.of(ChatMessage.user(
                "I'm new to this, what is an algorithm?")));
        assertThat(beginner.knowledgeLevel()).isEqualTo(KnowledgeLevel.BEGINNER);

        ConversationContext inconclusive = analyzer.analyze(List.of(ChatMessage.user("tell me about rivers")));
        assertThat(inconclusive.knowledgeLevel()).isEqualTo(KnowledgeLevel.INTERMEDIATE);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "hello                               | GREETING",
            "Good morning!                       | GREETING",
            "hello, can you explain recursion?   | HELP_REQUEST",
            "thanks, that makes sense            | ACKNOWLEDGMENT",
            "ok but what do you mean by scope?   | CLARIFICATION",
            "can you help me with fractions      | HELP_REQUEST",
            "my cat is orange                    | OTHER"
    })
    @DisplayName("Intent comes from the latest user message")
    void intent_ShouldBeClassified(String text, ConversationIntent expected) {
        assertThat(analyzer.intentOf(text)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Structured content is analysed through its text part")
    void multimodalContent_ShouldUseTextView() throws Exception {
        ChatMessage message = new ObjectMapper().readValue("""
                {"role":"user","content":[
                  {"type":"image_url","image_url":{"url":"https://example.com/graph.png"}},
                  {"type":"text","text":"hi"}
                ]}""", ChatMessage.class);

        assertThat(analyzer.analyze(List.of(message)).intent()).isEqualTo(ConversationIntent.GREETING);
    }
}

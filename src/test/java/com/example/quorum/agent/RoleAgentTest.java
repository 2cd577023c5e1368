package com.example.quorum.agent;

import com.example.quorum.model.AgentAnswer;
import com.example.quorum.model.TaskSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RoleAgent functionality.
 */
@ExtendWith(MockitoExtension.class)
class RoleAgentTest {

    @Mock
    private LanguageModel model;

    @Mock
    private Embedder embedder;

    private RoleAgent agent;

    @BeforeEach
    void setUp() {
        agent = new RoleAgent("coder-1", AgentRole.CODER, model, embedder);
    }

    private static TaskSpec jsonSpec(String description) {
        return new TaskSpec(description, null, Map.of(RoleAgent.RESPONSE_FORMAT_ATTRIBUTE, "json"), null);
    }

    @Nested
    @DisplayName("Prompting")
    class Prompting {

        @Test
        @DisplayName("Should frame the task with the role prompt and dependency context")
        void shouldFramePrompt() {
            when(model.generate(anyString(), anyString())).thenReturn("done");
            TaskSpec spec = TaskSpec.of("write a parser").withContext(List.of("grammar ready"));

            AgentAnswer answer = agent.propose("t1", spec);

            verify(model).generate(AgentRole.CODER.getSystemPrompt(),
                "Implement the following:\nCompleted: grammar ready\n\nNow do: write a parser");
            assertEquals("t1", answer.getTaskId());
            assertEquals("coder-1", answer.getAgentId());
            assertEquals("CODER", answer.getRole());
            assertEquals("done", answer.getContent());
        }

        @Test
        @DisplayName("Should attach an embedding to free-text answers")
        void shouldEmbedTextAnswers() {
            when(model.generate(anyString(), anyString())).thenReturn("forty two");
            when(embedder.embed("forty two")).thenReturn(new double[]{0.5, 0.5});

            AgentAnswer answer = agent.propose("t1", TaskSpec.of("compute"));

            assertArrayEquals(new double[]{0.5, 0.5}, answer.getEmbedding());
        }

        @Test
        @DisplayName("Should continue without an embedding when the embedder fails")
        void shouldTolerateEmbedderFailure() {
            when(model.generate(anyString(), anyString())).thenReturn("forty two");
            when(embedder.embed(anyString())).thenThrow(new IllegalStateException("no vectors"));

            AgentAnswer answer = agent.propose("t1", TaskSpec.of("compute"));

            assertFalse(answer.hasEmbedding());
            assertEquals("forty two", answer.getContent());
        }

        @Test
        @DisplayName("Should work without an embedder")
        void shouldWorkWithoutEmbedder() {
            RoleAgent plain = new RoleAgent("exec-1", AgentRole.EXECUTOR, model);
            when(model.generate(anyString(), eq("compute"))).thenReturn("42");

            AgentAnswer answer = plain.propose("t1", TaskSpec.of("compute"));

            assertEquals("42", answer.getContent());
            assertNull(answer.getEmbedding());
            verifyNoInteractions(embedder);
        }
    }

    @Nested
    @DisplayName("Structured answers")
    class StructuredAnswers {

        @Test
        @DisplayName("Should parse JSON surrounded by prose")
        void shouldParseStructuredAnswer() {
            when(model.generate(anyString(), anyString()))
                .thenReturn("Sure! Here it is:\n{\"status\": \"ok\", \"items\": [1, 2]}\nAnything else?");

            AgentAnswer answer = agent.propose("t1", jsonSpec("list items"));

            assertTrue(answer.isStructured());
            assertEquals("ok", answer.getStructuredContent().get("status").asText());
            assertNull(answer.getEmbedding());
            verifyNoInteractions(embedder);
        }

        @Test
        @DisplayName("Should fall back to text when JSON is malformed")
        void shouldFallBackToText() {
            when(model.generate(anyString(), anyString())).thenReturn("{status: ok");
            when(embedder.embed(anyString())).thenReturn(new double[]{1.0});

            AgentAnswer answer = agent.propose("t1", jsonSpec("list items"));

            assertFalse(answer.isStructured());
            assertEquals("{status: ok", answer.getContent());
        }

        @Test
        @DisplayName("Should extract the outermost object or array")
        void shouldExtractJson() {
            assertEquals("{\"a\":[1]}", RoleAgent.extractJson("x {\"a\":[1]} y"));
            assertEquals("[1,{\"b\":2}]", RoleAgent.extractJson("list: [1,{\"b\":2}]"));
            assertNull(RoleAgent.extractJson("no json here"));
            assertNull(RoleAgent.extractJson("} {"));
            assertNull(RoleAgent.extractJson(null));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should wrap unexpected model errors as unavailable")
        void shouldWrapModelErrors() {
            when(model.generate(anyString(), anyString())).thenThrow(new IllegalStateException("socket closed"));

            AgentUnavailableException exception = assertThrows(AgentUnavailableException.class,
                () -> agent.propose("t1", TaskSpec.of("compute")));
            assertEquals("coder-1", exception.getAgentId());
            assertTrue(exception.getMessage().contains("socket closed"));
        }

        @Test
        @DisplayName("Should pass agent exceptions through unchanged")
        void shouldPropagateAgentExceptions() {
            AgentTimeoutException timeout = new AgentTimeoutException("ollama:llama3", Duration.ofSeconds(1));
            when(model.generate(anyString(), anyString())).thenThrow(timeout);

            AgentTimeoutException thrown = assertThrows(AgentTimeoutException.class,
                () -> agent.propose("t1", TaskSpec.of("compute")));
            assertSame(timeout, thrown);
        }

        @Test
        @DisplayName("Should reject incomplete construction")
        void shouldValidateConstruction() {
            assertThrows(IllegalArgumentException.class, () -> new RoleAgent(" ", AgentRole.CODER, model));
            assertThrows(IllegalArgumentException.class, () -> new RoleAgent("a", null, model));
            assertThrows(IllegalArgumentException.class, () -> new RoleAgent("a", AgentRole.CODER, null));
        }
    }
}

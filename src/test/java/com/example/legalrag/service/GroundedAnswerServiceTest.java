package com.example.legalrag.service;

import com.example.legalrag.client.ChatGenerationClient;
import com.example.legalrag.config.RagProperties;
import com.example.legalrag.dto.AnswerResult;
import com.example.legalrag.dto.Citation;
import com.example.legalrag.dto.RetrievedPassage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GroundedAnswerServiceTest {

    private static final String QUESTION = "Care este obiectul regulamentului?";

    private final RetrievalService retrievalService = mock(RetrievalService.class);
    private final ChatGenerationClient chatClient = mock(ChatGenerationClient.class);
    private final RagProperties props = new RagProperties();
    private GroundedAnswerService service;

    @BeforeEach
    void setUp() {
        service = new GroundedAnswerService(retrievalService, new CitationService(), chatClient, props);
    }

    @Test
    void generatesWhenTopScoreEqualsThreshold() {
        when(retrievalService.retrieve(QUESTION, null)).thenReturn(List.of(
            new RetrievedPassage("32016R0679", 0, "Articolul 1 Obiect și obiective.", 0.25),
            new RetrievedPassage("32016R0679", 4, "Articolul 5 Principii.", 0.20)));
        when(chatClient.generate(anyString(), anyString(), anyDouble())).thenReturn("Protecția datelor [#32016R0679:0].");

        AnswerResult result = service.answer(QUESTION, null);

        assertThat(result.text()).isEqualTo("Protecția datelor [#32016R0679:0].");
        assertThat(result.citations()).containsExactly(
            new Citation("#32016R0679:0", 0.25),
            new Citation("#32016R0679:4", 0.20));
    }

    @Test
    void promptCarriesInstructionsQuestionAndTaggedContext() {
        when(retrievalService.retrieve(QUESTION, 3)).thenReturn(List.of(
            new RetrievedPassage("32016R0679", 0, "Articolul 1 Obiect.", 0.9)));
        when(chatClient.generate(anyString(), anyString(), anyDouble())).thenReturn("Răspuns");

        service.answer(QUESTION, 3);

        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(chatClient).generate(system.capture(), user.capture(), eq(0.2));
        assertThat(system.getValue())
            .contains("STRICTLY from the provided context")
            .contains("[#<documentId>:<passageIndex>]")
            .contains("say you don't know")
            .endsWith("Answer in Romanian.");
        assertThat(user.getValue()).isEqualTo(
            "Întrebare:\n" + QUESTION + "\n\nContext:\n[#32016R0679:0]\nArticolul 1 Obiect.");
    }

    @Test
    void abstainsBelowThreshold() {
        when(retrievalService.retrieve(QUESTION, null)).thenReturn(List.of(
            new RetrievedPassage("32016R0679", 0, "Text fără legătură.", 0.2499)));

        AnswerResult result = service.answer(QUESTION, null);

        assertThat(result.text()).isEqualTo("Nu știu. Nu am suficiente informații din contextul recuperat.");
        assertThat(result.citations()).isEmpty();
        assertThat(result.isAbstention()).isTrue();
        verify(chatClient, never()).generate(anyString(), anyString(), anyDouble());
    }

    @Test
    void abstainsWhenNothingIsRetrieved() {
        when(retrievalService.retrieve(any(), any())).thenReturn(List.of());

        AnswerResult result = service.answer(QUESTION, 5);

        assertThat(result.citations()).isEmpty();
        assertThat(result.text()).startsWith("Nu știu.");
        verify(chatClient, never()).generate(anyString(), anyString(), anyDouble());
    }

    @Test
    void answersInConfiguredLanguage() {
        props.getAnswer().setLanguage("en");
        when(retrievalService.retrieve(QUESTION, null)).thenReturn(List.of());

        assertThat(service.answer(QUESTION, null).text())
            .isEqualTo("I don't know. There is not enough information in the retrieved context.");
        assertThat(GroundedAnswerService.userMessage(AnswerLanguage.EN, "Q", "C")).isEqualTo("Question:\nQ\n\nContext:\nC");
    }
}

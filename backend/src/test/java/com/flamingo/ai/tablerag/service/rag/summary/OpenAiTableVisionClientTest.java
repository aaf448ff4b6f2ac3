package com.flamingo.ai.tablerag.service.rag.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("OpenAiTableVisionClient Tests")
class OpenAiTableVisionClientTest {

  @Mock private ChatModel visionChatModel;

  private OpenAiTableVisionClient client;

  @BeforeEach
  void setUp() {
    client = new OpenAiTableVisionClient(visionChatModel);
  }

  @Test
  @DisplayName("Should send instruction and base64 PNG in one user message")
  void shouldSendInstructionAndImage() {
    byte[] png = {1, 2, 3, 4};
    when(visionChatModel.chat(any(ChatRequest.class)))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("Total assets 900")).build());

    String summary = client.describe(png, "Describe the table");

    assertThat(summary).isEqualTo("Total assets 900");
    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
    verify(visionChatModel).chat(captor.capture());
    assertThat(captor.getValue().messages()).hasSize(1);
    UserMessage message = (UserMessage) captor.getValue().messages().get(0);
    List<Content> contents = message.contents();
    assertThat(contents).hasSize(2);
    assertThat(((TextContent) contents.get(0)).text()).isEqualTo("Describe the table");
    ImageContent image = (ImageContent) contents.get(1);
    assertThat(image.image().base64Data()).isEqualTo(Base64.getEncoder().encodeToString(png));
    assertThat(image.image().mimeType()).isEqualTo("image/png");
    assertThat(image.detailLevel()).isEqualTo(ImageContent.DetailLevel.HIGH);
  }

  @Test
  @DisplayName("Should return empty text when the model returns no message")
  void shouldReturnEmptyWhenNoMessage() {
    when(visionChatModel.chat(any(ChatRequest.class))).thenReturn(null);

    assertThat(client.describe(new byte[] {1}, "Describe")).isEmpty();
  }
}

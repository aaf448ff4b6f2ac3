package com.flamingo.ai.tablerag.service.rag.summary;

import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * {@link TableVisionClient} that sends the image as a base64 data part of a multimodal user
 * message to an OpenAI-compatible chat model.
 */
@Component
@Slf4j
public class OpenAiTableVisionClient implements TableVisionClient {

  private final ChatModel visionChatModel;

  public OpenAiTableVisionClient(@Qualifier("visionChatModel") ChatModel visionChatModel) {
    this.visionChatModel = visionChatModel;
  }

  @Override
  public String describe(byte[] pngBytes, String instruction) {
    String base64Image = Base64.getEncoder().encodeToString(pngBytes);
    UserMessage message =
        UserMessage.from(
            TextContent.from(instruction),
            ImageContent.from(base64Image, "image/png", ImageContent.DetailLevel.HIGH));

    ChatResponse response = visionChatModel.chat(ChatRequest.builder().messages(message).build());
    if (response == null || response.aiMessage() == null) {
      return "";
    }
    String text = response.aiMessage().text();
    return text != null ? text : "";
  }
}

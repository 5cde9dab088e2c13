package com.eainde.bidding.provider.langchain4j;

import com.eainde.bidding.error.TransientProviderException;
import com.eainde.bidding.provider.LlmProvider;
import com.eainde.bidding.provider.ProviderExceptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link LlmProvider} over a langchain4j {@link ChatModel}, requesting JSON output that
 * follows the given schema.
 *
 * <p>Some models wrap JSON in a Markdown code fence even in JSON mode; the fence is
 * stripped before parsing. Output that still is not valid JSON counts as a transient
 * failure, since a second sample usually parses.</p>
 */
@Log4j2
public class ChatModelLlmProvider implements LlmProvider {

    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public ChatModelLlmProvider(ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode complete(String prompt, JsonSchema schema) {
        ChatRequest request = ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(schema)
                        .build())
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw ProviderExceptions.translate("Chat model", e);
        }

        String text = response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new TransientProviderException("Chat model returned an empty response for schema "
                    + schema.name());
        }
        log.debug("Chat model response for {}: tokenUsage={}", schema.name(), response.tokenUsage());
        return parse(schema.name(), text);
    }

    private JsonNode parse(String schemaName, String text) {
        String json = text.strip();
        Matcher fenced = CODE_FENCE.matcher(json);
        if (fenced.matches()) {
            json = fenced.group(1);
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TransientProviderException("Chat model returned malformed JSON for " + schemaName, e);
        }
    }
}

package outreach.langchain4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import outreach.compose.GenerationRequest;
import outreach.compose.GenerationResult;
import outreach.spi.GenerationService;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link GenerationService} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>Each request is a single chat turn asking for a JSON object with {@code subject},
 * {@code body} and {@code claimedFacts}. Strict retries run at temperature zero and carry
 * the previous rejection reasons in the system prompt. Any model or parsing failure is
 * thrown to the composer, which records it as a generation failure.
 */
public final class LangChainGenerationService implements GenerationService {
  private static final Logger logger = Logger.getLogger(LangChainGenerationService.class.getName());

  static final ResponseFormat RESPONSE_FORMAT = ResponseFormat.builder()
      .type(ResponseFormatType.JSON)
      .jsonSchema(JsonSchema.builder()
          .name("OutreachMessage")
          .rootElement(JsonObjectSchema.builder()
              .addStringProperty("subject")
              .addStringProperty("body")
              .addProperty("claimedFacts", JsonArraySchema.builder()
                  .items(JsonObjectSchema.builder()
                      .addStringProperty("field")
                      .addStringProperty("value")
                      .required("field", "value")
                      .build())
                  .build())
              .required("subject", "body", "claimedFacts")
              .build())
          .build())
      .build();

  private final ChatModel chatModel;
  private final double temperature;
  private final OutreachPrompts prompts;
  private final GenerationResponseParser parser;

  private LangChainGenerationService(Builder builder) {
    this.chatModel = Objects.requireNonNull(builder.chatModel, "chatModel");
    ObjectMapper objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    this.temperature = builder.temperature;
    this.prompts = new OutreachPrompts(objectMapper);
    this.parser = new GenerationResponseParser(objectMapper);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public GenerationResult generate(GenerationRequest request) throws Exception {
    Objects.requireNonNull(request, "request");
    ChatRequest chatRequest = ChatRequest.builder()
        .messages(
            SystemMessage.from(prompts.system(request)),
            UserMessage.from(prompts.user(request)))
        .parameters(ChatRequestParameters.builder()
            .responseFormat(RESPONSE_FORMAT)
            .temperature(request.strict() ? 0.0 : temperature)
            .build())
        .build();
    ChatResponse response = chatModel.chat(chatRequest);
    if (response == null || response.aiMessage() == null) {
      throw new IllegalStateException("Model returned no message");
    }
    String text = response.aiMessage().text();
    if (logger.isLoggable(Level.FINE)) {
      logger.log(Level.FINE, "Generated {0} draft (strict={1}): {2}",
          new Object[]{request.family(), request.strict(), text});
    }
    return parser.parse(text);
  }

  public static final class Builder {
    private ChatModel chatModel;
    private ObjectMapper objectMapper;
    private double temperature = 0.7;

    private Builder() {
    }

    public Builder chatModel(ChatModel chatModel) {
      this.chatModel = chatModel;
      return this;
    }

    /** Optional; a plain {@link ObjectMapper} is used when not set. */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /** Sampling temperature for first attempts. Strict retries always use zero. */
    public Builder temperature(double temperature) {
      if (temperature < 0.0 || temperature > 2.0) {
        throw new IllegalArgumentException("temperature must be between 0 and 2");
      }
      this.temperature = temperature;
      return this;
    }

    public LangChainGenerationService build() {
      return new LangChainGenerationService(this);
    }
  }
}

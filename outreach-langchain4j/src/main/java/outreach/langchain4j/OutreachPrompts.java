package outreach.langchain4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import outreach.compose.GenerationRequest;
import outreach.model.FactField;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a {@link GenerationRequest} into the system and user prompts sent to the
 * model. The user prompt is the fact payload serialized as JSON and nothing else.
 */
public final class OutreachPrompts {

  private static final String FIELD_KEYS = Arrays.stream(FactField.values())
      .map(FactField::key)
      .collect(Collectors.joining(", "));

  private final ObjectMapper objectMapper;

  public OutreachPrompts(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public String system(GenerationRequest request) {
    StringBuilder sb = new StringBuilder()
        .append("You write short, plain-text outreach emails to conference attendees.\n")
        .append("Style: ").append(request.family().instructions()).append("\n\n")
        .append("Rules:\n")
        .append("- Use only the facts in the JSON payload. Do not add facts, figures, ")
        .append("names or dates that are not in it.\n")
        .append("- Every number you write must appear in the payload exactly as given.\n")
        .append("- Do not spell numbers out or use vague quantities such as dozens or thousands.\n")
        .append("- Do not mention other people at the company; that line is added later.\n")
        .append("- Keep the body under 120 words and sign off without a name.\n")
        .append("- List every fact you used in claimedFacts. Each entry has a field (one of ")
        .append(FIELD_KEYS).append(") and the value copied verbatim from the payload.\n");
    if (!request.family().forbiddenPhrases().isEmpty()) {
      sb.append("- Never use these phrases: ")
          .append(String.join("; ", request.family().forbiddenPhrases())).append(".\n");
    }
    if (request.strict()) {
      sb.append("\nYour previous draft was rejected");
      if (!request.rejection().isEmpty()) {
        sb.append(" for: ").append(String.join("; ", request.rejection()));
      }
      sb.append(".\nWrite a more conservative draft: use fewer facts, copy values verbatim ")
          .append("and leave out anything you are unsure of.\n");
    }
    sb.append("\nRespond with a JSON object with the keys subject, body and claimedFacts.");
    return sb.toString();
  }

  /**
   * @throws JsonProcessingException if the payload cannot be serialized
   */
  public String user(GenerationRequest request) throws JsonProcessingException {
    return objectMapper.writerWithDefaultPrettyPrinter()
        .writeValueAsString(request.payload().asMap());
  }
}

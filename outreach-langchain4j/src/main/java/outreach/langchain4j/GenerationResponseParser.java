package outreach.langchain4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import outreach.compose.GenerationResult;
import outreach.model.FactClaim;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses the model's JSON answer into a {@link GenerationResult}.
 *
 * <p>Parsing is lenient about shape: a missing subject or body becomes {@code null} and
 * claims without a value are dropped, leaving it to the grounding validator to reject
 * the draft. Text that is not a JSON object at all fails.
 */
public final class GenerationResponseParser {
  private final ObjectMapper objectMapper;

  public GenerationResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  /**
   * @throws JsonProcessingException if the text is not JSON
   * @throws IllegalArgumentException if the JSON is not an object
   */
  public GenerationResult parse(String text) throws JsonProcessingException {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Model returned an empty response");
    }
    JsonNode root = objectMapper.readTree(stripFence(text));
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Model response is not a JSON object");
    }
    List<FactClaim> claims = new ArrayList<>();
    JsonNode facts = root.path("claimedFacts");
    if (facts.isArray()) {
      for (JsonNode fact : facts) {
        JsonNode value = fact.path("value");
        if (value.isMissingNode() || value.isNull()) {
          continue;
        }
        claims.add(FactClaim.parse(fact.path("field").asText(null), value.asText()));
      }
    }
    return new GenerationResult(text(root, "subject"), text(root, "body"), claims);
  }

  private static String text(JsonNode root, String field) {
    JsonNode node = root.get(field);
    return node == null || node.isNull() ? null : node.asText();
  }

  // some models wrap JSON output in a markdown fence even in JSON mode
  private static String stripFence(String text) {
    String trimmed = text.strip();
    if (!trimmed.startsWith("```")) {
      return trimmed;
    }
    int firstLine = trimmed.indexOf('\n');
    int closing = trimmed.lastIndexOf("```");
    if (firstLine < 0 || closing <= firstLine) {
      return trimmed;
    }
    return trimmed.substring(firstLine + 1, closing).strip();
  }
}

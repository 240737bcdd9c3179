package outreach.compose;

import java.util.List;
import java.util.Objects;

/**
 * Input to {@link outreach.spi.GenerationService#generate}.
 *
 * @param family    template family, with its instructions and forbidden phrases
 * @param payload   the only facts the service may use
 * @param strict    set on the retry after a rejected first attempt
 * @param rejection reasons the previous attempt was rejected, empty on the first attempt
 */
public record GenerationRequest(TemplateFamily family, FactPayload payload, boolean strict,
    List<String> rejection) {

  public GenerationRequest {
    Objects.requireNonNull(family, "family");
    Objects.requireNonNull(payload, "payload");
    rejection = rejection == null ? List.of() : List.copyOf(rejection);
  }
}

package outreach.spi;

import outreach.compose.GenerationRequest;
import outreach.compose.GenerationResult;

/**
 * Structured text generation. Implementations see only the whitelisted
 * {@link outreach.compose.FactPayload} carried by the request.
 *
 * <p>Implementations may block; the composer applies its own timeout and interrupts the
 * calling thread when it expires.
 */
public interface GenerationService {

  /**
   * @param request template family, whitelisted facts and strictness
   * @return subject, body and the facts the model claims to have used
   * @throws Exception any failure; the composer wraps it in a
   *     {@link outreach.GenerationException}
   */
  GenerationResult generate(GenerationRequest request) throws Exception;
}

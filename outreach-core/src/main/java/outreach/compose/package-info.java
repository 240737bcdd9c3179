/**
 * Message composition: fact whitelisting, the generation call, grounding validation and
 * the disclosure rule.
 *
 * <p>{@link outreach.compose.GroundingValidator} is independent of the generation call
 * and can be exercised on its own.
 */
package outreach.compose;

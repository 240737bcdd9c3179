package outreach.spi;

import outreach.DeliveryException;

/** Mail transport. Produces side effects outside the engine. */
public interface DeliveryService {

  /**
   * Sends one message.
   *
   * @param request composed message with tracking BCC
   * @return transport delivery id
   * @throws DeliveryException if the transport rejected or failed the send
   */
  String send(DeliveryRequest request) throws DeliveryException;
}

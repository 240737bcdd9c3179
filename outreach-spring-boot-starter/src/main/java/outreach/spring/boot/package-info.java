/**
 * Spring Boot auto-configuration for the outreach engine.
 *
 * <p>{@link outreach.spring.boot.OutreachAutoConfiguration} wires the JDBC stores and the
 * {@link outreach.OutreachEngine} from a {@code DataSource} and a
 * {@link outreach.spi.DeliveryService} bean. Generation comes from a
 * {@link outreach.spi.GenerationService} bean, or from a LangChain4j chat model through
 * {@link outreach.spring.boot.OutreachLangChainAutoConfiguration}.
 *
 * @see outreach.spring.boot.OutreachProperties
 */
package outreach.spring.boot;

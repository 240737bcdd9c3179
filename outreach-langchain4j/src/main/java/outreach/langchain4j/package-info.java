/**
 * LangChain4j adapter for {@link outreach.spi.GenerationService}.
 */
package outreach.langchain4j;

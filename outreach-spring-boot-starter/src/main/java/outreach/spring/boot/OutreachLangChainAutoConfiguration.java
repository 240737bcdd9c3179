package outreach.spring.boot;

import dev.langchain4j.model.chat.ChatModel;
import outreach.langchain4j.LangChainGenerationService;
import outreach.spi.GenerationService;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link LangChainGenerationService} from a LangChain4j {@link ChatModel} bean
 * unless the application defines its own {@link GenerationService}.
 *
 * <p>Runs before {@link OutreachAutoConfiguration} so the service is available to the engine.
 */
@AutoConfiguration(before = OutreachAutoConfiguration.class)
@ConditionalOnClass({LangChainGenerationService.class, ChatModel.class})
@ConditionalOnBean(ChatModel.class)
@EnableConfigurationProperties(OutreachProperties.class)
public class OutreachLangChainAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(GenerationService.class)
  public LangChainGenerationService generationService(ChatModel chatModel,
      OutreachProperties props) {
    return LangChainGenerationService.builder()
        .chatModel(chatModel)
        .temperature(props.getGeneration().getTemperature())
        .build();
  }
}

package outreach.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import outreach.compose.FactPayload;
import outreach.compose.GenerationRequest;
import outreach.compose.GenerationResult;
import outreach.compose.TemplateFamily;
import outreach.model.AttendeeRecord;
import outreach.model.CompanyRecord;
import outreach.model.FactClaim;
import outreach.model.FactField;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LangChainGenerationServiceTest {

  private static final String DRAFT = "{"
      + "\"subject\":\"Fresh Foods at the expo\","
      + "\"body\":\"Hi Dana, with 25 distribution centers Fresh Foods keeps a lot moving.\","
      + "\"claimedFacts\":[{\"field\":\"dc_count\",\"value\":\"25\"},"
      + "{\"field\":\"first_name\",\"value\":\"Dana\"}]}";

  private ChatModel chatModel;
  private LangChainGenerationService service;
  private FactPayload payload;

  @BeforeEach
  void setUp() {
    chatModel = mock(ChatModel.class);
    service = LangChainGenerationService.builder().chatModel(chatModel).temperature(0.5).build();
    CompanyRecord company = CompanyRecord.builder(7, "Fresh Foods")
        .overview("Regional grocery chain")
        .dcCount(25, "annual report")
        .hook("Opening a new cold-storage hub")
        .bullets(List.of("Runs a private fleet"))
        .fitScores(80, 40)
        .build();
    AttendeeRecord attendee = AttendeeRecord.builder(1, 7, "Dana").build();
    payload = FactPayload.of(attendee, company, TemplateFamily.STANDARD, 60);
  }

  private void answer(String text) {
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(text)).build());
  }

  private ChatRequest captureRequest() {
    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
    verify(chatModel).chat(captor.capture());
    return captor.getValue();
  }

  // ── Parsing ─────────────────────────────────────────────────────

  @Test
  void parsesSubjectBodyAndClaims() throws Exception {
    answer(DRAFT);

    GenerationResult result = service.generate(
        new GenerationRequest(TemplateFamily.STANDARD, payload, false, List.of()));

    assertThat(result.subject()).isEqualTo("Fresh Foods at the expo");
    assertThat(result.body()).startsWith("Hi Dana");
    assertThat(result.claimedFacts()).containsExactly(
        FactClaim.of(FactField.DC_COUNT, "25"),
        FactClaim.of(FactField.FIRST_NAME, "Dana"));
  }

  @Test
  void stripsMarkdownFence() throws Exception {
    answer("```json\n" + DRAFT + "\n```");

    GenerationResult result = service.generate(
        new GenerationRequest(TemplateFamily.STANDARD, payload, false, List.of()));

    assertThat(result.subject()).isEqualTo("Fresh Foods at the expo");
  }

  @Test
  void unknownFieldIsKeptUnresolved() throws Exception {
    answer("{\"subject\":\"s\",\"body\":\"b\","
        + "\"claimedFacts\":[{\"field\":\"revenue\",\"value\":\"$2B\"}]}");

    GenerationResult result = service.generate(
        new GenerationRequest(TemplateFamily.STANDARD, payload, false, List.of()));

    assertThat(result.claimedFacts()).hasSize(1);
    assertThat(result.claimedFacts().get(0).field()).isNull();
    assertThat(result.claimedFacts().get(0).rawField()).isEqualTo("revenue");
  }

  @Test
  void missingFieldsBecomeNull() throws Exception {
    answer("{\"subject\":\"Hello\"}");

    GenerationResult result = service.generate(
        new GenerationRequest(TemplateFamily.STANDARD, payload, false, List.of()));

    assertThat(result.subject()).isEqualTo("Hello");
    assertThat(result.body()).isNull();
    assertThat(result.claimedFacts()).isEmpty();
  }

  @Test
  void malformedResponseFails() {
    answer("Sure! Here is your email: Hi Dana");

    assertThatThrownBy(() -> service.generate(
        new GenerationRequest(TemplateFamily.STANDARD, payload, false, List.of())))
        .isInstanceOf(Exception.class);
  }

  @Test
  void nonObjectResponseFails() {
    answer("[1, 2, 3]");

    assertThatThrownBy(() -> service.generate(
        new GenerationRequest(TemplateFamily.STANDARD, payload, false, List.of())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("JSON object");
  }

  @Test
  void modelFailurePropagates() {
    when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("quota"));

    assertThatThrownBy(() -> service.generate(
        new GenerationRequest(TemplateFamily.STANDARD, payload, false, List.of())))
        .isInstanceOf(RuntimeException.class)
        .hasMessage("quota");
  }

  // ── Request shape ───────────────────────────────────────────────

  @Test
  void sendsFamilyInstructionsAndPayloadOnly() throws Exception {
    answer(DRAFT);

    service.generate(new GenerationRequest(TemplateFamily.STANDARD, payload, false, List.of()));

    ChatRequest request = captureRequest();
    List<ChatMessage> messages = request.messages();
    assertThat(messages).hasSize(2);
    String system = ((SystemMessage) messages.get(0)).text();
    String user = ((UserMessage) messages.get(1)).singleText();
    assertThat(system)
        .contains(TemplateFamily.STANDARD.instructions())
        .contains("private meeting")
        .doesNotContain("previous draft was rejected");
    assertThat(user)
        .contains("\"company_name\"")
        .contains("Fresh Foods")
        .contains("\"dc_count\"")
        .doesNotContain("truck_count");
    assertThat(request.parameters().temperature()).isEqualTo(0.5);
    assertThat(request.parameters().responseFormat().type()).isEqualTo(ResponseFormatType.JSON);
  }

  @Test
  void strictRetryCarriesRejectionAndZeroTemperature() throws Exception {
    answer(DRAFT);

    service.generate(new GenerationRequest(TemplateFamily.STANDARD, payload, true,
        List.of("UNSUPPORTED_NUMBER: 30")));

    ChatRequest request = captureRequest();
    String system = ((SystemMessage) request.messages().get(0)).text();
    assertThat(system)
        .contains("previous draft was rejected")
        .contains("UNSUPPORTED_NUMBER: 30");
    assertThat(request.parameters().temperature()).isEqualTo(0.0);
  }

  // ── Builder ─────────────────────────────────────────────────────

  @Test
  void builderRequiresChatModel() {
    assertThatThrownBy(() -> LangChainGenerationService.builder().build())
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("chatModel");
  }

  @Test
  void builderRejectsOutOfRangeTemperature() {
    assertThatThrownBy(() -> LangChainGenerationService.builder().temperature(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

package com.biprov.validation;

import com.biprov.domain.ProvisionRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("PayloadValidator Tests")
class PayloadValidatorTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private PayloadValidator payloadValidator;

    @BeforeAll
    static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        payloadValidator = new PayloadValidator(new ObjectMapper(), validator);
    }

    private ProvisionRequest validate(String json) {
        return payloadValidator.validate(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should accept a minimal payload and default the optional fields")
    void shouldAcceptMinimalPayload() {
        // When
        ProvisionRequest request = validate("{\"projectId\":\"abc123\",\"groupEmail\":\"team@example.com\"}");

        // Then
        assertThat(request.getProjectId()).isEqualTo("abc123");
        assertThat(request.getGroupEmail()).isEqualTo("team@example.com");
        assertThat(request.getAncestryPath()).isNull();
        assertThat(request.getTemplateDashboardIds()).isEmpty();
        assertThat(request.getTemplateFolderId()).isNull();
        assertThat(request.getTokens()).isEmpty();
    }

    @Test
    @DisplayName("Should keep every field of a full payload, template ids in input order")
    void shouldAcceptFullPayload() {
        // Given
        String json = "{\"projectId\":\"demo-proj\",\"groupEmail\":\"analysts@example.com\","
            + "\"ancestryPath\":\"org/folder/demo-proj\",\"templateDashboardIds\":[7,101,3],"
            + "\"templateFolderId\":55,\"tokens\":{\"ENV\":\"prod\",\"team_1\":\"blue\"},\"extra\":true}";

        // When
        ProvisionRequest request = validate(json);

        // Then
        assertThat(request.getAncestryPath()).isEqualTo("org/folder/demo-proj");
        assertThat(request.getTemplateDashboardIds()).containsExactly(7L, 101L, 3L);
        assertThat(request.getTemplateFolderId()).isEqualTo(55L);
        assertThat(request.getTokens()).containsExactly(Map.entry("ENV", "prod"), Map.entry("team_1", "blue"));
    }

    @Test
    @DisplayName("Should reject a project id that is too short")
    void shouldRejectShortProjectId() {
        // When
        ValidationError error = catchThrowableOfType(
            () -> validate("{\"projectId\":\"AB\",\"groupEmail\":\"team@example.com\"}"),
            ValidationError.class);

        // Then
        assertThat(error.getViolations()).hasSize(1);
        assertThat(error.getViolations().get(0)).startsWith("projectId: ");
    }

    @Test
    @DisplayName("Should reject project ids that break the DNS-label rules")
    void shouldRejectMalformedProjectIds() {
        for (String projectId : List.of("1abcdef", "abcdef-", "Abcdef", "abc_def", "a" + "b".repeat(63))) {
            assertThatThrownBy(() -> validate("{\"projectId\":\"" + projectId + "\",\"groupEmail\":\"t@e.com\"}"))
                .as(projectId)
                .isInstanceOf(ValidationError.class)
                .hasMessageStartingWith("projectId: ");
        }
    }

    @Test
    @DisplayName("Should aggregate every violation, sorted by field")
    void shouldAggregateViolations() {
        // Given
        String json = "{\"groupEmail\":\"no-at-sign\",\"templateDashboardIds\":[0,-4],"
            + "\"templateFolderId\":-1,\"tokens\":{\"bad key\":\"x\"}}";

        // When
        ValidationError error = catchThrowableOfType(() -> validate(json), ValidationError.class);

        // Then
        assertThat(error.getViolations()).containsExactly(
            "groupEmail: must contain exactly one '@' with non-empty local and domain parts",
            "projectId: is required",
            "templateDashboardIds[0]: must be positive",
            "templateDashboardIds[1]: must be positive",
            "templateFolderId: must be positive",
            "tokens[bad key]: key must match [A-Za-z0-9_]+");
        assertThat(error.getMessage()).isEqualTo(String.join("; ", error.getViolations()));
    }

    @Test
    @DisplayName("Should produce the same error text for the same bytes")
    void shouldBeDeterministic() {
        String json = "{\"projectId\":\"X\",\"groupEmail\":\"a@b@c\",\"templateFolderId\":0}";

        String first = catchThrowableOfType(() -> validate(json), ValidationError.class).getMessage();
        String second = catchThrowableOfType(() -> validate(json), ValidationError.class).getMessage();

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should reject an explicitly empty template list")
    void shouldRejectEmptyTemplateList() {
        assertThatThrownBy(() -> validate(
            "{\"projectId\":\"abc123\",\"groupEmail\":\"t@e.com\",\"templateDashboardIds\":[]}"))
            .isInstanceOf(ValidationError.class)
            .hasMessage("templateDashboardIds: must not be empty when present");
    }

    @Test
    @DisplayName("Should reject fractional and quoted ids instead of coercing them")
    void shouldRejectCoercedIds() {
        assertThatThrownBy(() -> validate(
            "{\"projectId\":\"abc123\",\"groupEmail\":\"t@e.com\",\"templateDashboardIds\":[1.5]}"))
            .isInstanceOf(ValidationError.class)
            .hasMessageStartingWith("payload has an invalid field");

        assertThatThrownBy(() -> validate(
            "{\"projectId\":\"abc123\",\"groupEmail\":\"t@e.com\",\"templateFolderId\":\"12\"}"))
            .isInstanceOf(ValidationError.class)
            .hasMessageStartingWith("payload has an invalid field");
    }

    @Test
    @DisplayName("Should reject null token values")
    void shouldRejectNullTokenValue() {
        assertThatThrownBy(() -> validate(
            "{\"projectId\":\"abc123\",\"groupEmail\":\"t@e.com\",\"tokens\":{\"ENV\":null}}"))
            .isInstanceOf(ValidationError.class)
            .hasMessage("tokens[ENV]: value must not be null");
    }

    @Test
    @DisplayName("Should reject empty input, malformed JSON and non-object roots")
    void shouldRejectStructurallyInvalidInput() {
        assertThatThrownBy(() -> payloadValidator.validate(new byte[0]))
            .isInstanceOf(ValidationError.class)
            .hasMessage("payload must not be empty");

        assertThatThrownBy(() -> validate("{\"projectId\":"))
            .isInstanceOf(ValidationError.class)
            .hasMessageStartingWith("payload is not valid JSON");

        assertThatThrownBy(() -> validate("[1,2,3]"))
            .isInstanceOf(ValidationError.class)
            .hasMessage("payload must be a JSON object");
    }
}
